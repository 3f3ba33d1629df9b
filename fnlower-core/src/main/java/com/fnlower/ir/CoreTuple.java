package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

public record CoreTuple(
    List<CoreExpr> elements,
    Location loc
) implements CoreExpr {
    public CoreTuple {
        elements = List.copyOf(elements);
    }

    @Override
    public String kind() {
        return "CoreTuple";
    }
}
