package com.fnlower.ir;

import com.fnlower.ast.Location;

/**
 * Literal pattern over a {@link Long}, {@link Double}, {@link String}, {@link Boolean},
 * or {@code null} for unit.
 */
public record CoreLiteralPattern(
    Object literal,
    Location loc
) implements CorePattern {
    @Override
    public String kind() {
        return "CoreLiteralPattern";
    }
}
