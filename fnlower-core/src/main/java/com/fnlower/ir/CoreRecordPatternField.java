package com.fnlower.ir;

import com.fnlower.ast.Location;

public record CoreRecordPatternField(String name, CorePattern pattern, Location loc) {
}
