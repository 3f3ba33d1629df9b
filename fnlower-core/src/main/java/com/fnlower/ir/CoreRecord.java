package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

public record CoreRecord(
    List<CoreRecordField> fields,
    Location loc
) implements CoreExpr {
    public CoreRecord {
        fields = List.copyOf(fields);
    }

    @Override
    public String kind() {
        return "CoreRecord";
    }
}
