package com.fnlower.ast;

import java.util.List;

public record Block(
    List<Expr> exprs,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "Block";
    }
}
