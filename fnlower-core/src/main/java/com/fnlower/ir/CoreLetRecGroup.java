package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

public record CoreLetRecGroup(
    List<CoreRecBinding> bindings,
    boolean exported,
    Location loc
) implements CoreDeclaration {
    public CoreLetRecGroup {
        bindings = List.copyOf(bindings);
    }

    @Override
    public String kind() {
        return "CoreLetRecGroup";
    }
}
