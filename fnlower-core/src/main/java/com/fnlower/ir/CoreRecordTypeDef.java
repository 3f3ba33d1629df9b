package com.fnlower.ir;

import com.fnlower.ast.Location;
import java.util.List;

public record CoreRecordTypeDef(
    List<CoreRecordTypeField> fields,
    Location loc
) implements CoreTypeDefinition {
    public CoreRecordTypeDef {
        fields = List.copyOf(fields);
    }

    @Override
    public String kind() {
        return "CoreRecordTypeDef";
    }
}
