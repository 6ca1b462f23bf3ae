package com.chatstore.repository;

import com.chatstore.model.dto.SimilarityMatch;
import com.chatstore.model.dto.SimilarityQuery;
import com.chatstore.model.entity.DocumentEmbedding;
import com.chatstore.util.MetadataMapper;
import com.chatstore.util.VectorUtil;
import io.r2dbc.spi.Readable;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for document_embeddings.
 *
 * Similarity uses pgvector's cosine distance operator (<=>), so a score of
 * 1.0 means the stored vector points in the same direction as the query.
 */
@Repository
@RequiredArgsConstructor
public class DocumentEmbeddingRepository {

    static final String INSERT_SQL = """
            INSERT INTO document_embeddings (source_type, source_id, content_chunk, embedding, metadata)
            VALUES (:sourceType, :sourceId, :contentChunk, CAST(:embedding AS vector), CAST(:metadata AS jsonb))
            RETURNING embedding_id
            """;

    // The threshold sits in WHERE so it is applied before LIMIT cuts the page.
    // Zero-norm vectors have NaN distance, which PostgreSQL compares as greater than any number.
    static final String SEARCH_SQL = """
            SELECT embedding_id, source_type, source_id, content_chunk, metadata::text AS metadata,
                   1 - (embedding <=> CAST(:query AS vector)) AS similarity
            FROM document_embeddings
            WHERE (embedding <=> CAST(:query AS vector)) <> 'NaN'::float8
              AND 1 - (embedding <=> CAST(:query AS vector)) >= :threshold
            ORDER BY embedding <=> CAST(:query AS vector)
            LIMIT :limit
            """;

    static final String SEARCH_BY_SOURCE_TYPE_SQL = """
            SELECT embedding_id, source_type, source_id, content_chunk, metadata::text AS metadata,
                   1 - (embedding <=> CAST(:query AS vector)) AS similarity
            FROM document_embeddings
            WHERE source_type = :sourceType
              AND (embedding <=> CAST(:query AS vector)) <> 'NaN'::float8
              AND 1 - (embedding <=> CAST(:query AS vector)) >= :threshold
            ORDER BY embedding <=> CAST(:query AS vector)
            LIMIT :limit
            """;

    static final String DELETE_BY_SOURCE_SQL = """
            DELETE FROM document_embeddings
            WHERE source_type = :sourceType AND source_id = :sourceId
            """;

    private final DatabaseClient databaseClient;
    private final MetadataMapper metadataMapper;

    /**
     * Insert one embedding. The vector is validated when the returned Mono is
     * subscribed, so inside a transaction a bad row aborts the whole unit.
     */
    public Mono<UUID> insert(DocumentEmbedding embedding) {
        return Mono.defer(() -> {
            String vector = VectorUtil.formatVector(embedding.getEmbedding());
            return databaseClient.sql(INSERT_SQL)
                    .bind("sourceType", embedding.getSourceType())
                    .bind("sourceId", embedding.getSourceId())
                    .bind("contentChunk", embedding.getContentChunk())
                    .bind("embedding", vector)
                    .bind("metadata", metadataMapper.toJson(embedding.getMetadata()))
                    .map(row -> row.get("embedding_id", UUID.class))
                    .one();
        });
    }

    /**
     * Nearest neighbours of the query vector, most similar first.
     */
    public Flux<SimilarityMatch> search(SimilarityQuery query) {
        return Flux.defer(() -> {
            String vector = VectorUtil.formatVector(query.getQueryEmbedding());
            boolean filtered = query.getSourceType() != null;
            DatabaseClient.GenericExecuteSpec spec = databaseClient
                    .sql(filtered ? SEARCH_BY_SOURCE_TYPE_SQL : SEARCH_SQL)
                    .bind("query", vector)
                    .bind("threshold", query.getSimilarityThreshold())
                    .bind("limit", query.getLimit());
            if (filtered) {
                spec = spec.bind("sourceType", query.getSourceType());
            }
            return spec.map(this::toMatch).all();
        });
    }

    /**
     * Delete every embedding derived from one source.
     *
     * @return Number of rows removed
     */
    public Mono<Long> deleteBySource(String sourceType, String sourceId) {
        return databaseClient.sql(DELETE_BY_SOURCE_SQL)
                .bind("sourceType", sourceType)
                .bind("sourceId", sourceId)
                .fetch()
                .rowsUpdated();
    }

    private SimilarityMatch toMatch(Readable row) {
        Double similarity = row.get("similarity", Double.class);
        return SimilarityMatch.builder()
                .embeddingId(row.get("embedding_id", UUID.class))
                .sourceType(row.get("source_type", String.class))
                .sourceId(row.get("source_id", String.class))
                .contentChunk(row.get("content_chunk", String.class))
                .metadata(metadataMapper.fromJson(row.get("metadata", String.class)))
                .similarity(similarity != null ? similarity : 0.0)
                .build();
    }
}
