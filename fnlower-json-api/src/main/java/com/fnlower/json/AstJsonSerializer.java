package com.fnlower.json;

import com.fnlower.ir.CoreNode;

/**
 * Writes core IR nodes as JSON. Every node object carries a {@code kind} property naming
 * its node type.
 */
public interface AstJsonSerializer {

    /**
     * @throws AstJsonException if the node cannot be written
     */
    String serialize(CoreNode node) throws AstJsonException;

    /**
     * Same as {@link #serialize} with indentation, for {@code --emit}-style dumps.
     *
     * @throws AstJsonException if the node cannot be written
     */
    String serializePretty(CoreNode node) throws AstJsonException;
}
