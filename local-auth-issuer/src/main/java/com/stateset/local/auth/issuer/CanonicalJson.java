package com.stateset.local.auth.issuer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Compact JSON with object keys in natural string order at every depth and
 * null members kept, so equal content always gives equal bytes.
 */
public final class CanonicalJson {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
        .configure(SerializationFeature.INDENT_OUTPUT, false);

    private CanonicalJson() {}

    public static byte[] encode(Map<String, ?> members) {
        try {
            return MAPPER.writeValueAsBytes(canonicalize(members));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode token segment", e);
        }
    }

    static Object canonicalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            TreeMap<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k), canonicalize(v)));
            return sorted;
        }
        if (value instanceof Collection<?> items) {
            List<Object> copy = new ArrayList<>(items.size());
            items.forEach(item -> copy.add(canonicalize(item)));
            return copy;
        }
        return value;
    }
}
