package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

public record CoreTupleType(
    List<CoreTypeExpr> elements,
    Location loc
) implements CoreTypeExpr {
    public CoreTupleType {
        elements = List.copyOf(elements);
    }

    @Override
    public String kind() {
        return "CoreTupleType";
    }
}
