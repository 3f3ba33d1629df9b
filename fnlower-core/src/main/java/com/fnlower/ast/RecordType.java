package com.fnlower.ast;

import java.util.List;

public record RecordType(
    List<RecordTypeField> fields,
    Location loc
) implements TypeExpr {
    @Override
    public String kind() {
        return "RecordType";
    }
}
