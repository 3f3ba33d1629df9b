package com.fnlower.ast;

import java.util.List;

public record VariantTypeDef(
    List<VariantConstructor> constructors,
    Location loc
) implements TypeDefinition {
    @Override
    public String kind() {
        return "VariantTypeDef";
    }
}
