package org.iceforge.pgpulse.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Map;

/**
 * Rough size of a result as received. Not byte-accurate: 4 bytes per column per row plus a
 * per-value cost (NULL 4, number 8, boolean 1, text and anything else two bytes per character).
 */
final class ByteEstimator {

    private static final int PER_COLUMN_OVERHEAD = 4;
    private static final int NULL_BYTES = 4;
    private static final int NUMBER_BYTES = 8;
    private static final int BOOLEAN_BYTES = 1;

    private final ObjectMapper mapper;

    ByteEstimator(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    long estimate(List<String> columns, List<Map<String, Object>> rows) {
        long total = 0;
        for (Map<String, Object> row : rows) {
            total += (long) columns.size() * PER_COLUMN_OVERHEAD;
            for (Object value : row.values()) {
                total += sizeOf(value);
            }
        }
        return total;
    }

    long sizeOf(Object value) {
        if (value == null) {
            return NULL_BYTES;
        }
        if (value instanceof CharSequence cs) {
            return cs.length() * 2L;
        }
        if (value instanceof Number) {
            return NUMBER_BYTES;
        }
        if (value instanceof Boolean) {
            return BOOLEAN_BYTES;
        }
        try {
            return mapper.writeValueAsString(value).length() * 2L;
        } catch (JsonProcessingException e) {
            return String.valueOf(value).length() * 2L;
        }
    }
}
