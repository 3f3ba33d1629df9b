package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

public record CoreFunctionType(
    List<CoreTypeExpr> params,
    CoreTypeExpr returnType,
    Location loc
) implements CoreTypeExpr {
    public CoreFunctionType {
        params = List.copyOf(params);
    }

    @Override
    public String kind() {
        return "CoreFunctionType";
    }
}
