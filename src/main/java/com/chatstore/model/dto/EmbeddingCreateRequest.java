package com.chatstore.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for storing one embedded document chunk.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingCreateRequest {

    @NotBlank(message = "Source type is required")
    private String sourceType;

    @NotBlank(message = "Source ID is required")
    private String sourceId;

    @NotNull(message = "Content chunk is required")
    private String contentChunk;

    // Dimension is checked when the row is written, so a bad vector fails its batch
    @NotNull(message = "Embedding is required")
    private float[] embedding;

    private Map<String, Object> metadata;
}
