package com.fnlower.ast;

/**
 * Literal pattern. The literal is a {@link Long}, {@link Double}, {@link String},
 * {@link Boolean}, or {@code null} for unit.
 */
public record LiteralPattern(
    Object literal,
    Location loc
) implements Pattern {
    @Override
    public String kind() {
        return "LiteralPattern";
    }
}
