package com.example.boundedcache.size;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates size as the length of the value's JSON form times two (UTF-16 code units).
 */
public class JsonSizeEstimator implements SizeEstimator {

    private static final Logger log = LoggerFactory.getLogger(JsonSizeEstimator.class);

    static final long BYTES_PER_CHAR = 2;
    static final long FALLBACK_SIZE = 1000;

    private final ObjectMapper objectMapper;

    public JsonSizeEstimator() {
        this(new ObjectMapper());
    }

    public JsonSizeEstimator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public long estimateSize(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof CharSequence text) {
            // quoted JSON string
            return (text.length() + 2) * BYTES_PER_CHAR;
        }
        try {
            return objectMapper.writeValueAsString(value).length() * BYTES_PER_CHAR;
        } catch (JsonProcessingException e) {
            log.debug("Cannot serialize {} for size estimation, using {} bytes",
                value.getClass().getName(), FALLBACK_SIZE, e);
            return FALLBACK_SIZE;
        }
    }
}
