package com.fnlower.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Builds the {@link ObjectMapper} used for core IR JSON.
 *
 * <pre>
 * ObjectMapper mapper = FnLowerJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(coreModule);
 * CoreModule back = mapper.readValue(json, CoreModule.class);
 * </pre>
 */
public final class FnLowerJackson {

    private FnLowerJackson() {
    }

    /**
     * The mapper writes a {@code kind} property on every node, leaves out null-valued
     * properties (absent guards, {@code from}, aliases) and ignores unknown properties on input.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.registerModule(new CoreAstModule());
        return mapper;
    }
}
