package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

public record CoreVariantPattern(
    String constructor,
    List<CorePattern> args,
    Location loc
) implements CorePattern {
    public CoreVariantPattern {
        args = List.copyOf(args);
    }

    @Override
    public String kind() {
        return "CoreVariantPattern";
    }
}
