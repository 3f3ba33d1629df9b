package com.fnlower.ir;

import com.fnlower.ast.Location;

public record CoreWildcardPattern(Location loc) implements CorePattern {
    @Override
    public String kind() {
        return "CoreWildcardPattern";
    }
}
