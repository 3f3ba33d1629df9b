package com.fnlower.ir;

import com.fnlower.ast.Location;

public sealed interface CoreRecordField {

    Location loc();

    record Field(String name, CoreExpr value, Location loc) implements CoreRecordField {
    }

    record Spread(CoreExpr expr, Location loc) implements CoreRecordField {
    }
}
