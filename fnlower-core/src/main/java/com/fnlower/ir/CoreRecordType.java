package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

public record CoreRecordType(
    List<CoreRecordTypeField> fields,
    Location loc
) implements CoreTypeExpr {
    public CoreRecordType {
        fields = List.copyOf(fields);
    }

    @Override
    public String kind() {
        return "CoreRecordType";
    }
}
