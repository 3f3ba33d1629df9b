package com.fnlower.ast;

import java.util.List;

public record ListLit(
    List<ListElement> elements,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "ListLit";
    }
}
