package com.fnlower.ast;

import java.util.List;

/**
 * {@code [export] external [from "module"] { ... }}. {@code from} is null when absent.
 */
public record ExternalBlock(
    List<Item> items,
    String from,
    boolean exported,
    Location loc
) implements Declaration {
    @Override
    public String kind() {
        return "ExternalBlock";
    }

    public sealed interface Item {
        String name();
        TypeExpr typeExpr();
        Location loc();
    }

    public record ExternalValue(String name, TypeExpr typeExpr, String jsName, Location loc) implements Item {}

    public record ExternalType(String name, TypeExpr typeExpr, Location loc) implements Item {}
}
