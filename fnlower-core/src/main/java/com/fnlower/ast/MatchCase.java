package com.fnlower.ast;

/**
 * One arm of a match. {@code guard} is null when the arm is unguarded.
 */
public record MatchCase(Pattern pattern, Expr guard, Expr body, Location loc) {
}
