package com.chatstore.model.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for nearest-neighbour search over document embeddings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimilarityQuery {

    @NotNull(message = "Query embedding is required")
    private float[] queryEmbedding;

    private String sourceType;

    @Builder.Default
    @Min(value = 0, message = "Limit cannot be negative")
    private int limit = 5;

    @Builder.Default
    @DecimalMin(value = "-1.0", message = "Similarity threshold cannot be below -1")
    @DecimalMax(value = "1.0", message = "Similarity threshold cannot exceed 1")
    private double similarityThreshold = 0.0;
}
