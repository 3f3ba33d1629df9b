package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

public record CoreUnionType(
    List<CoreTypeExpr> types,
    Location loc
) implements CoreTypeExpr {
    public CoreUnionType {
        types = List.copyOf(types);
    }

    @Override
    public String kind() {
        return "CoreUnionType";
    }
}
