package com.fnlower.ast;

import java.util.List;

public record Match(
    Expr expr,
    List<MatchCase> cases,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "Match";
    }
}
