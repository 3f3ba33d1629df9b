package com.fnlower.ast;

import java.util.List;

/**
 * Mutually recursive bindings sharing one body: {@code let rec f = ... and g = ... in body}.
 */
public record LetRecExpr(
    List<LetRecBinding> bindings,
    Expr body,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "LetRecExpr";
    }
}
