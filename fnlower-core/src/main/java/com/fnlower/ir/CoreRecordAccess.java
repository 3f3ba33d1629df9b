package com.fnlower.ir;

import com.fnlower.ast.Location;

public record CoreRecordAccess(
    CoreExpr record,
    String field,
    Location loc
) implements CoreExpr {
    @Override
    public String kind() {
        return "CoreRecordAccess";
    }
}
