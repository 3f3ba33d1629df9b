package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

public record CoreVariantType(
    List<CoreVariantConstructor> constructors,
    Location loc
) implements CoreTypeExpr {
    public CoreVariantType {
        constructors = List.copyOf(constructors);
    }

    @Override
    public String kind() {
        return "CoreVariantType";
    }
}
