package com.fnlower.ast;

import java.util.List;

public record App(
    Expr func,
    List<Expr> args,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "App";
    }
}
