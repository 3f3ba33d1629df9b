package com.fnlower.ast;

public record WildcardPattern(Location loc) implements Pattern {
    @Override
    public String kind() {
        return "WildcardPattern";
    }
}
