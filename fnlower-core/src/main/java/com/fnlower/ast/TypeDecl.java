package com.fnlower.ast;

import java.util.List;

public record TypeDecl(
    String name,
    List<String> params,
    TypeDefinition definition,
    boolean exported,
    Location loc
) implements Declaration {
    @Override
    public String kind() {
        return "TypeDecl";
    }
}
