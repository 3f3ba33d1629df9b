package com.fnlower.ast;

import java.util.List;

public record RecordPattern(
    List<Field> fields,
    Location loc
) implements Pattern {
    @Override
    public String kind() {
        return "RecordPattern";
    }

    public record Field(String name, Pattern pattern, Location loc) {}
}
