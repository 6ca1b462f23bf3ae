package com.chatstore.repository;

import com.chatstore.model.dto.SessionPatch;
import com.chatstore.model.entity.ChatSession;
import com.chatstore.util.MetadataMapper;
import io.r2dbc.spi.Readable;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.Parameter;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Repository for chat_sessions.
 */
@Repository
@RequiredArgsConstructor
public class ChatSessionRepository {

    static final String INSERT_SQL = """
            INSERT INTO chat_sessions (user_agent, current_page, metadata)
            VALUES (:userAgent, :currentPage, CAST(:metadata AS jsonb))
            RETURNING session_id
            """;

    static final String FIND_BY_ID_SQL = """
            SELECT session_id, created_at, updated_at, user_agent, current_page, metadata::text AS metadata
            FROM chat_sessions
            WHERE session_id = :sessionId
            """;

    static final String UPDATE_PAGE_SQL = """
            UPDATE chat_sessions
            SET current_page = :currentPage
            WHERE session_id = :sessionId
            RETURNING session_id
            """;

    static final String UPDATE_METADATA_SQL = """
            UPDATE chat_sessions
            SET metadata = COALESCE(metadata, '{}'::jsonb) || CAST(:metadata AS jsonb)
            WHERE session_id = :sessionId
            RETURNING session_id
            """;

    static final String UPDATE_PAGE_AND_METADATA_SQL = """
            UPDATE chat_sessions
            SET current_page = :currentPage,
                metadata = COALESCE(metadata, '{}'::jsonb) || CAST(:metadata AS jsonb)
            WHERE session_id = :sessionId
            RETURNING session_id
            """;

    static final String TOUCH_SQL = "UPDATE chat_sessions SET updated_at = NOW() WHERE session_id = :sessionId";

    private final DatabaseClient databaseClient;
    private final MetadataMapper metadataMapper;

    /**
     * Insert a session and return its generated ID.
     */
    public Mono<UUID> insert(String userAgent, String currentPage, Map<String, Object> metadata) {
        return Mono.defer(() -> {
            String json = metadataMapper.toJson(metadata);
            return databaseClient.sql(INSERT_SQL)
                    .bind("userAgent", Parameter.fromOrEmpty(userAgent, String.class))
                    .bind("currentPage", Parameter.fromOrEmpty(currentPage, String.class))
                    .bind("metadata", json)
                    .map(row -> row.get("session_id", UUID.class))
                    .one();
        });
    }

    /**
     * Find a session by ID. Empty when no such session exists.
     */
    public Mono<ChatSession> findById(UUID sessionId) {
        return databaseClient.sql(FIND_BY_ID_SQL)
                .bind("sessionId", sessionId)
                .map(this::toSession)
                .one();
    }

    /**
     * Apply a partial update.
     *
     * @return true if a session row matched, false if none did or the patch is empty
     */
    public Mono<Boolean> update(UUID sessionId, SessionPatch patch) {
        return Mono.defer(() -> patch.kind()
                .map(kind -> {
                    String json = kind.touchesMetadata() ? metadataMapper.toJson(patch.getMetadata()) : null;
                    DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(updateSql(kind))
                            .bind("sessionId", sessionId);
                    if (kind.touchesPage()) {
                        spec = spec.bind("currentPage", patch.getCurrentPage());
                    }
                    if (json != null) {
                        spec = spec.bind("metadata", json);
                    }
                    return spec.map(row -> row.get("session_id", UUID.class))
                            .first()
                            .hasElement();
                })
                .orElseGet(() -> Mono.just(false)));
    }

    /**
     * Bump updated_at to the current transaction time.
     *
     * @return Number of rows touched (0 or 1)
     */
    public Mono<Long> touch(UUID sessionId) {
        return databaseClient.sql(TOUCH_SQL)
                .bind("sessionId", sessionId)
                .fetch()
                .rowsUpdated();
    }

    static String updateSql(SessionPatch.Kind kind) {
        return switch (kind) {
            case PAGE -> UPDATE_PAGE_SQL;
            case METADATA -> UPDATE_METADATA_SQL;
            case PAGE_AND_METADATA -> UPDATE_PAGE_AND_METADATA_SQL;
        };
    }

    private ChatSession toSession(Readable row) {
        return ChatSession.builder()
                .sessionId(row.get("session_id", UUID.class))
                .createdAt(row.get("created_at", OffsetDateTime.class))
                .updatedAt(row.get("updated_at", OffsetDateTime.class))
                .userAgent(row.get("user_agent", String.class))
                .currentPage(row.get("current_page", String.class))
                .metadata(metadataMapper.fromJson(row.get("metadata", String.class)))
                .build();
    }
}
