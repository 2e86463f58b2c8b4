package io.offsync.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Objects;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}.
 */
public final class JacksonJsonCodec implements JsonCodec {
    static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(defaultObjectMapper());

    private final ObjectMapper mapper;

    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Creates the mapper used by {@link JsonCodec#getDefault()}: java.time support,
     * ISO-8601 instants and lenient handling of unknown properties.
     *
     * @return a new mapper
     */
    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Override
    public String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            String typeName = value == null ? "null" : value.getClass().getName();
            throw new IllegalArgumentException("Failed to encode " + typeName + " as JSON", e);
        }
    }

    @Override
    public <T> T fromJson(String json, Class<T> type) {
        Objects.requireNonNull(type, "type");
        if (json == null) {
            throw new IllegalArgumentException("json must not be null");
        }
        try {
            return mapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to decode JSON as " + type.getName(), e);
        }
    }

    @Override
    public <T> T convert(Object value, Class<T> type) {
        Objects.requireNonNull(type, "type");
        return mapper.convertValue(value, type);
    }
}
