package com.fnlower.ast;

/**
 * {@code expr |> func}
 */
public record Pipe(
    Expr expr,
    Expr func,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "Pipe";
    }
}
