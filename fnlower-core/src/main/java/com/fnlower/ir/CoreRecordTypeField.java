package com.fnlower.ir;

import com.fnlower.ast.Location;

public record CoreRecordTypeField(String name, CoreTypeExpr typeExpr, Location loc) {
}
