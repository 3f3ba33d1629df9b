package com.fnlower.ast;

public record RecordTypeField(String name, TypeExpr typeExpr, Location loc) {
}
