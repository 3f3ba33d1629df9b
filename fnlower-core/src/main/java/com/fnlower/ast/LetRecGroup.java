package com.fnlower.ast;

import java.util.List;

public record LetRecGroup(
    List<LetRecBinding> bindings,
    boolean exported,
    Location loc
) implements Declaration {
    @Override
    public String kind() {
        return "LetRecGroup";
    }
}
