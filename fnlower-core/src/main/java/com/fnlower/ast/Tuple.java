package com.fnlower.ast;

import java.util.List;

public record Tuple(
    List<Expr> elements,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "Tuple";
    }
}
