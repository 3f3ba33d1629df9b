package com.fnlower.ast;

import java.util.List;

public record ImportDecl(
    List<ImportItem> items,
    String from,
    Location loc
) implements Declaration {
    @Override
    public String kind() {
        return "ImportDecl";
    }
}
