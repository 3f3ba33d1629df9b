package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

public record CoreVariantTypeDef(
    List<CoreVariantConstructor> constructors,
    Location loc
) implements CoreTypeDefinition {
    public CoreVariantTypeDef {
        constructors = List.copyOf(constructors);
    }

    @Override
    public String kind() {
        return "CoreVariantTypeDef";
    }
}
