package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

public record CoreTuplePattern(
    List<CorePattern> elements,
    Location loc
) implements CorePattern {
    public CoreTuplePattern {
        elements = List.copyOf(elements);
    }

    @Override
    public String kind() {
        return "CoreTuplePattern";
    }
}
