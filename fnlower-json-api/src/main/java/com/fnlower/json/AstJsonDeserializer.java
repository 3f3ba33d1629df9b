package com.fnlower.json;

import com.fnlower.ir.CoreExpr;
import com.fnlower.ir.CoreModule;
import com.fnlower.ir.CoreNode;

/**
 * Reads core IR nodes back from the JSON written by an {@link AstJsonSerializer}.
 */
public interface AstJsonDeserializer {

    /**
     * Reads a whole desugared module.
     *
     * @throws AstJsonException if the input is not a valid module
     */
    CoreModule deserializeModule(String json) throws AstJsonException;

    /**
     * Reads a single expression tree.
     *
     * @throws AstJsonException if the input is not a valid expression
     */
    default CoreExpr deserializeExpr(String json) throws AstJsonException {
        return deserialize(json, CoreExpr.class);
    }

    /**
     * Reads a node of the given type. {@code type} may be a sealed family such as
     * {@code CorePattern.class}; the concrete record is chosen by the {@code kind} property.
     *
     * @param <T> the node type
     * @throws AstJsonException if the input does not describe a {@code T}
     */
    <T extends CoreNode> T deserialize(String json, Class<T> type) throws AstJsonException;
}
