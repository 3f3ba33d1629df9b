package com.fnlower.ir;

import com.fnlower.ast.Location;

public record CoreBinOp(
    CoreBinaryOp op,
    CoreExpr left,
    CoreExpr right,
    Location loc
) implements CoreExpr {
    @Override
    public String kind() {
        return "CoreBinOp";
    }
}
