package com.fnlower.ast;

/**
 * Named import; {@code alias} is null when the item is not renamed.
 */
public record ImportItem(String name, String alias, boolean typeOnly) {
}
