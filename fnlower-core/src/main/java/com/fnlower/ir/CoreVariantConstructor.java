package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

public record CoreVariantConstructor(String name, List<CoreTypeExpr> args, Location loc) {
    public CoreVariantConstructor {
        args = List.copyOf(args);
    }
}
