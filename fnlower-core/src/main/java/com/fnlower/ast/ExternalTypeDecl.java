package com.fnlower.ast;

public record ExternalTypeDecl(
    String name,
    TypeExpr typeExpr,
    boolean exported,
    Location loc
) implements Declaration {
    @Override
    public String kind() {
        return "ExternalTypeDecl";
    }
}
