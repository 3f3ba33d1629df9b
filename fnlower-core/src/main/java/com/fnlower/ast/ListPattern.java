package com.fnlower.ast;

import java.util.List;

/**
 * List pattern {@code [p1, p2, ...rest]}; {@code rest} is null when absent.
 */
public record ListPattern(
    List<Pattern> elements,
    Pattern rest,
    Location loc
) implements Pattern {
    @Override
    public String kind() {
        return "ListPattern";
    }
}
