package com.fnlower.ast;

/**
 * Entry of a record literal or record update: either a named field or a spread of another record.
 */
public sealed interface RecordField {

    Location loc();

    record Field(String name, Expr value, Location loc) implements RecordField {
    }

    record Spread(Expr expr, Location loc) implements RecordField {
    }
}
