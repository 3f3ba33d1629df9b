package com.fnlower.ir;

import com.fnlower.ast.Location;

public record CoreRecBinding(CorePattern pattern, CoreExpr value, boolean mutable, Location loc) {
}
