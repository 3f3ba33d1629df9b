package com.fnlower.ast;

public record AliasType(
    TypeExpr typeExpr,
    Location loc
) implements TypeDefinition {
    @Override
    public String kind() {
        return "AliasType";
    }
}
