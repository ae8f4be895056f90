package com.chmonitor.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Map;

/**
 * Builds deduplication keys from request parts.
 *
 * <p>Map entries are serialized in key order at every nesting level, so two requests that differ
 * only in parameter order produce the same key.
 */
public final class DedupKeys {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private DedupKeys() {
    }

    public static String of(Map<String, ?> parts) {
        try {
            return MAPPER.writeValueAsString(parts);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request parts are not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
