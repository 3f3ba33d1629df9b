package com.fnlower.ast;

import java.util.List;

public record RecordTypeDef(
    List<RecordTypeField> fields,
    Location loc
) implements TypeDefinition {
    @Override
    public String kind() {
        return "RecordTypeDef";
    }
}
