package com.fnlower.ast;

import java.util.List;

public record VariantType(
    List<VariantConstructor> constructors,
    Location loc
) implements TypeExpr {
    @Override
    public String kind() {
        return "VariantType";
    }
}
