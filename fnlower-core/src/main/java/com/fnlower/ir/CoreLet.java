package com.fnlower.ir;

import com.fnlower.ast.Location;

/**
 * Single binding. When {@code recursive} is set the value is in scope of its own pattern.
 */
public record CoreLet(
    CorePattern pattern,
    CoreExpr value,
    CoreExpr body,
    boolean mutable,
    boolean recursive,
    Location loc
) implements CoreExpr {
    @Override
    public String kind() {
        return "CoreLet";
    }
}
