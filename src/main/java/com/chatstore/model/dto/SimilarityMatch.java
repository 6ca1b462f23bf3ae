package com.chatstore.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.UUID;

/**
 * Single similarity search hit. similarity is 1 - cosine distance.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimilarityMatch {
    private UUID embeddingId;
    private String sourceType;
    private String sourceId;
    private String contentChunk;
    private Map<String, Object> metadata;
    private double similarity;
}
