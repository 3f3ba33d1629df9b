package com.fnlower.ast;

import java.util.List;

public record ConstructorPattern(
    String constructor,
    List<Pattern> args,
    Location loc
) implements Pattern {
    @Override
    public String kind() {
        return "ConstructorPattern";
    }
}
