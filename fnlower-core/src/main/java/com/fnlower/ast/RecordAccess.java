package com.fnlower.ast;

public record RecordAccess(
    Expr record,
    String field,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "RecordAccess";
    }
}
