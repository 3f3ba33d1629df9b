package com.fnlower.ast;

import java.util.List;

/**
 * Record update {@code { base | field: value, ...other }}. Later updates win.
 */
public record RecordUpdate(
    Expr record,
    List<RecordField> updates,
    Location loc
) implements Expr {
    @Override
    public String kind() {
        return "RecordUpdate";
    }
}
