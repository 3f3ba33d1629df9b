package com.fnlower.desugar;

import java.util.Objects;

/**
 * Settings for a {@link Desugarer}.
 *
 * @param listConcatFunction name of the curried function used to join list segments when a
 *                           spread is not the last element
 * @param freshNamesPerDeclaration when true, {@link Desugarer#desugarModule} gives each top-level
 *                                 declaration its own {@link FreshVarGen}
 */
public record DesugarOptions(String listConcatFunction, boolean freshNamesPerDeclaration) {

    public static final String DEFAULT_LIST_CONCAT_FUNCTION = "concat";

    public DesugarOptions {
        Objects.requireNonNull(listConcatFunction, "listConcatFunction");
        if (listConcatFunction.isBlank()) {
            throw new IllegalArgumentException("listConcatFunction must not be blank");
        }
    }

    public static DesugarOptions defaults() {
        return new DesugarOptions(DEFAULT_LIST_CONCAT_FUNCTION, false);
    }

    public DesugarOptions withListConcatFunction(String name) {
        return new DesugarOptions(name, freshNamesPerDeclaration);
    }

    public DesugarOptions withFreshNamesPerDeclaration(boolean value) {
        return new DesugarOptions(listConcatFunction, value);
    }
}
