package com.fnlower.ir;

import com.fnlower.ast.Location;

/**
 * Match arm; {@code guard} is null when absent. The pattern never contains an or-pattern.
 */
public record CoreMatchCase(CorePattern pattern, CoreExpr guard, CoreExpr body, Location loc) {
}
