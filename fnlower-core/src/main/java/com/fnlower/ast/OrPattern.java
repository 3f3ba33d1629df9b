package com.fnlower.ast;

import java.util.List;

public record OrPattern(
    List<Pattern> patterns,
    Location loc
) implements Pattern {
    @Override
    public String kind() {
        return "OrPattern";
    }
}
