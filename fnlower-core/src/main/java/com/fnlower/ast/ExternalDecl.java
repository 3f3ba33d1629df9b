package com.fnlower.ast;

public record ExternalDecl(
    String name,
    TypeExpr typeExpr,
    String jsName,
    String from,
    boolean exported,
    Location loc
) implements Declaration {
    @Override
    public String kind() {
        return "ExternalDecl";
    }
}
