package com.fnlower.ast;

public record UnitLit(Location loc) implements Expr {
    @Override
    public String kind() {
        return "UnitLit";
    }
}
