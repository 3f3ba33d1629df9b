package com.fnlower.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fnlower.ir.CoreModule;
import com.fnlower.ir.CoreNode;
import com.fnlower.json.AstJsonDeserializer;
import com.fnlower.json.AstJsonException;
import com.fnlower.json.AstJsonProvider;
import com.fnlower.json.AstJsonSerializer;

import java.util.logging.Logger;

/**
 * {@link AstJsonProvider} backed by Jackson. Registered for {@link java.util.ServiceLoader}.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private static final Logger LOG = Logger.getLogger(JacksonAstJsonProvider.class.getName());

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this(FnLowerJackson.createObjectMapper());
    }

    public JacksonAstJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
        LOG.fine("Created Jackson core IR JSON provider");
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(CoreNode node) throws AstJsonException {
            try {
                return mapper.writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + node.kind(), e);
            }
        }

        @Override
        public String serializePretty(CoreNode node) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + node.kind(), e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public CoreModule deserializeModule(String json) throws AstJsonException {
            return deserialize(json, CoreModule.class);
        }

        @Override
        public <T extends CoreNode> T deserialize(String json, Class<T> type) throws AstJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
        }
    }
}
