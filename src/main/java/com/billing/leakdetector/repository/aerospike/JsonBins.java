package com.billing.leakdetector.repository.aerospike;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding for map and list valued bins. Column order of rows is preserved.
 */
final class JsonBins {

    private static final Logger log = LoggerFactory.getLogger(JsonBins.class);

    private static final TypeReference<LinkedHashMap<String, Object>> ROW = new TypeReference<>() {};
    private static final TypeReference<LinkedHashMap<String, Double>> WEIGHTS = new TypeReference<>() {};
    private static final TypeReference<List<LinkedHashMap<String, Object>>> ROWS = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    JsonBins(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize bin value", e);
        }
    }

    Map<String, Object> readRow(String json) {
        if (json == null || json.isEmpty()) return new LinkedHashMap<>();
        try {
            return objectMapper.readValue(json, ROW);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize feature values", e);
            return new LinkedHashMap<>();
        }
    }

    Map<String, Double> readWeights(String json) {
        if (json == null || json.isEmpty()) return null;
        try {
            return objectMapper.readValue(json, WEIGHTS);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize explanation", e);
            return null;
        }
    }

    List<Map<String, Object>> readRows(String json) {
        if (json == null || json.isEmpty()) return Collections.emptyList();
        try {
            return Collections.unmodifiableList(objectMapper.readValue(json, ROWS));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored dataset rows are corrupt", e);
        }
    }
}
