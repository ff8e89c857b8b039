package io.jobflow4j.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Brings free-form job maps (parameters, metadata, results) into the shape a JSON parser
 * produces: integers as the narrowest of Integer/Long/BigInteger, decimals as Double, objects as
 * maps and collections as lists. A job built in memory then equals the copy a store reads back.
 */
public final class JsonValues {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private JsonValues() {
    }

    /**
     * @throws IllegalArgumentException if a value cannot be written as JSON
     */
    public static Map<String, Object> normalize(Map<String, Object> values, String field) {
        if (values == null) {
            return null;
        }
        if (values.isEmpty()) {
            return new LinkedHashMap<>();
        }
        try {
            return MAPPER.readValue(MAPPER.writeValueAsBytes(values), MAP_TYPE);
        } catch (IOException e) {
            throw new IllegalArgumentException(field + " must be JSON-compatible: " + e.getMessage(), e);
        }
    }
}
