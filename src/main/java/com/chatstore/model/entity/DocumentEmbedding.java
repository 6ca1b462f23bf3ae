package com.chatstore.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Document embedding row used for retrieval.
 *
 * sourceType/sourceId point at the external entity the chunk came from
 * (product, page_content, faq, policy, ...). They are a convention, not a
 * foreign key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentEmbedding {

    private UUID embeddingId;

    private String sourceType;

    private String sourceId;

    private String contentChunk;

    // 384 components, stored as pgvector vector(384)
    private float[] embedding;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private OffsetDateTime createdAt;

    private OffsetDateTime updatedAt;
}
