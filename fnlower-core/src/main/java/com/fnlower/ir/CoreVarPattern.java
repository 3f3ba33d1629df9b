package com.fnlower.ir;

import com.fnlower.ast.Location;

public record CoreVarPattern(
    String name,
    Location loc
) implements CorePattern {
    @Override
    public String kind() {
        return "CoreVarPattern";
    }
}
