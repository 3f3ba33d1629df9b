package com.fnlower.ast;

import java.util.List;

/**
 * Record literal, e.g. {@code { name: "x", ...defaults }}.
 */
public record RecordLit(
    List<RecordField> fields,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "RecordLit";
    }
}
