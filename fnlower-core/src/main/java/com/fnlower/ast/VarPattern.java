package com.fnlower.ast;

public record VarPattern(
    String name,
    Location loc
) implements Pattern {
    @Override
    public String kind() {
        return "VarPattern";
    }
}
