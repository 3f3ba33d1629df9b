package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

public record CoreRecordPattern(
    List<CoreRecordPatternField> fields,
    Location loc
) implements CorePattern {
    public CoreRecordPattern {
        fields = List.copyOf(fields);
    }

    @Override
    public String kind() {
        return "CoreRecordPattern";
    }
}
