package com.chatstore.repository;

import com.chatstore.model.entity.TextSelection;
import com.chatstore.util.MetadataMapper;
import com.chatstore.util.VectorUtil;
import io.r2dbc.spi.Readable;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.Parameter;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Repository for user_text_selections.
 */
@Repository
@RequiredArgsConstructor
public class TextSelectionRepository {

    static final String INSERT_SQL = """
            INSERT INTO user_text_selections (session_id, selected_text, page_url, embedding, metadata)
            VALUES (:sessionId, :selectedText, :pageUrl, CAST(:embedding AS vector), CAST(:metadata AS jsonb))
            RETURNING selection_id
            """;

    static final String FIND_BY_SESSION_SQL = """
            SELECT selection_id, session_id, selected_text, page_url, embedding::text AS embedding,
                   created_at, metadata::text AS metadata
            FROM user_text_selections
            WHERE session_id = :sessionId
            ORDER BY created_at DESC
            LIMIT :limit
            """;

    private final DatabaseClient databaseClient;
    private final MetadataMapper metadataMapper;

    public Mono<UUID> insert(TextSelection selection) {
        return Mono.defer(() -> {
            String embedding = selection.getEmbedding() != null
                    ? VectorUtil.formatVector(selection.getEmbedding())
                    : null;
            String json = metadataMapper.toJson(selection.getMetadata());
            return databaseClient.sql(INSERT_SQL)
                    .bind("sessionId", selection.getSessionId())
                    .bind("selectedText", selection.getSelectedText())
                    .bind("pageUrl", selection.getPageUrl())
                    .bind("embedding", Parameter.fromOrEmpty(embedding, String.class))
                    .bind("metadata", json)
                    .map(row -> row.get("selection_id", UUID.class))
                    .one();
        });
    }

    /**
     * Selections of a session, newest first.
     */
    public Flux<TextSelection> findBySessionId(UUID sessionId, int limit) {
        return databaseClient.sql(FIND_BY_SESSION_SQL)
                .bind("sessionId", sessionId)
                .bind("limit", limit)
                .map(this::toSelection)
                .all();
    }

    private TextSelection toSelection(Readable row) {
        return TextSelection.builder()
                .selectionId(row.get("selection_id", UUID.class))
                .sessionId(row.get("session_id", UUID.class))
                .selectedText(row.get("selected_text", String.class))
                .pageUrl(row.get("page_url", String.class))
                .embedding(VectorUtil.parseVector(row.get("embedding", String.class)))
                .createdAt(row.get("created_at", OffsetDateTime.class))
                .metadata(metadataMapper.fromJson(row.get("metadata", String.class)))
                .build();
    }
}
