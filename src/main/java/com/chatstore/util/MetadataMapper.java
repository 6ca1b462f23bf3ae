package com.chatstore.util;

import com.chatstore.exception.MetadataFormatException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts metadata maps to and from the JSON text stored in jsonb columns.
 */
@Component
@RequiredArgsConstructor
public class MetadataMapper {

    private static final String EMPTY_JSON = "{}";
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * Serialize metadata to JSON. Null or empty metadata becomes "{}".
     */
    public String toJson(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return EMPTY_JSON;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new MetadataFormatException("Failed to serialize metadata", e);
        }
    }

    /**
     * Deserialize stored JSON. A null column reads back as an empty map.
     */
    public Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, Object> metadata = objectMapper.readValue(json, MAP_TYPE);
            return metadata != null ? metadata : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            throw new MetadataFormatException("Failed to deserialize metadata", e);
        }
    }
}
