package com.fnlower.ast;

import java.util.List;

/**
 * A parsed compilation unit. {@code imports} holds the import declarations in source order.
 */
public record SourceModule(
    List<Declaration> imports,
    List<Declaration> declarations,
    Location loc
) implements Node {
    @Override
    public String kind() {
        return "SourceModule";
    }
}
