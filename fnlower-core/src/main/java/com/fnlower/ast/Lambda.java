package com.fnlower.ast;

import java.util.List;

public record Lambda(
    List<Pattern> params,
    Expr body,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "Lambda";
    }
}
