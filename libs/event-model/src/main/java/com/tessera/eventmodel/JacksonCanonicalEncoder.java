package com.tessera.eventmodel;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@link CanonicalEncoder} backed by a Jackson {@link ObjectMapper}.
 * <p>
 * Event state is read from fields (events expose record-style accessors, not bean getters),
 * properties are sorted alphabetically and map entries by key, so the JSON text for a given event
 * is stable. The {@code JavaTimeModule} writes {@code Instant} values as ISO-8601 strings.
 */
public final class JacksonCanonicalEncoder implements CanonicalEncoder {

    private static final TypeReference<Map<String, Object>> FIELD_MAP = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public JacksonCanonicalEncoder() {
        this(createMapper());
    }

    /**
     * Creates an encoder around a caller-supplied mapper. The mapper must be configured for
     * deterministic output.
     */
    public JacksonCanonicalEncoder(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper must not be null");
        }
        this.mapper = mapper;
    }

    /** Builds the mapper used by the no-arg constructor. */
    public static ObjectMapper createMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .visibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                .build();
    }

    @Override
    public Map<String, Object> fieldsOf(DomainEvent event) {
        try {
            Map<String, Object> fields = mapper.convertValue(event, FIELD_MAP);
            return Collections.unmodifiableMap(new TreeMap<>(fields));
        } catch (IllegalArgumentException e) {
            throw new EventEncodingException(
                    "Failed to read fields of event " + event.getClass().getName(), e);
        }
    }

    @Override
    public byte[] encode(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new EventEncodingException("Failed to encode value for hashing", e);
        }
    }

    /** Returns the underlying mapper. */
    public ObjectMapper objectMapper() {
        return mapper;
    }
}
