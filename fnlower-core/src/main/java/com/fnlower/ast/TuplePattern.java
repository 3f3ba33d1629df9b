package com.fnlower.ast;

import java.util.List;

public record TuplePattern(
    List<Pattern> elements,
    Location loc
) implements Pattern {
    @Override
    public String kind() {
        return "TuplePattern";
    }
}
