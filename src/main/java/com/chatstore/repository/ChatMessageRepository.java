package com.chatstore.repository;

import com.chatstore.model.entity.ChatMessage;
import com.chatstore.model.entity.MessageRole;
import com.chatstore.util.MetadataMapper;
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
 * Repository for chat_messages.
 */
@Repository
@RequiredArgsConstructor
public class ChatMessageRepository {

    static final String INSERT_SQL = """
            INSERT INTO chat_messages (session_id, role, content, token_usage, page_context, metadata)
            VALUES (:sessionId, :role, :content, :tokenUsage, :pageContext, CAST(:metadata AS jsonb))
            RETURNING message_id
            """;

    static final String HISTORY_SQL = """
            SELECT message_id, session_id, role, content, created_at,
                   token_usage, page_context, metadata::text AS metadata
            FROM chat_messages
            WHERE session_id = :sessionId
            ORDER BY created_at ASC
            LIMIT :limit OFFSET :offset
            """;

    private final DatabaseClient databaseClient;
    private final MetadataMapper metadataMapper;

    /**
     * Insert a message and return its generated ID. Fails with the store's
     * integrity error when the session does not exist.
     */
    public Mono<UUID> insert(ChatMessage message) {
        return Mono.defer(() -> {
            String role = message.getRole().value();
            String json = metadataMapper.toJson(message.getMetadata());
            return databaseClient.sql(INSERT_SQL)
                    .bind("sessionId", message.getSessionId())
                    .bind("role", role)
                    .bind("content", message.getContent())
                    .bind("tokenUsage", message.getTokenUsage())
                    .bind("pageContext", Parameter.fromOrEmpty(message.getPageContext(), String.class))
                    .bind("metadata", json)
                    .map(row -> row.get("message_id", UUID.class))
                    .one();
        });
    }

    /**
     * Messages of a session, oldest first.
     */
    public Flux<ChatMessage> findBySessionId(UUID sessionId, int limit, int offset) {
        return databaseClient.sql(HISTORY_SQL)
                .bind("sessionId", sessionId)
                .bind("limit", limit)
                .bind("offset", offset)
                .map(this::toMessage)
                .all();
    }

    private ChatMessage toMessage(Readable row) {
        Integer tokenUsage = row.get("token_usage", Integer.class);
        return ChatMessage.builder()
                .messageId(row.get("message_id", UUID.class))
                .sessionId(row.get("session_id", UUID.class))
                .role(MessageRole.fromValue(row.get("role", String.class)))
                .content(row.get("content", String.class))
                .createdAt(row.get("created_at", OffsetDateTime.class))
                .tokenUsage(tokenUsage != null ? tokenUsage : 0)
                .pageContext(row.get("page_context", String.class))
                .metadata(metadataMapper.fromJson(row.get("metadata", String.class)))
                .build();
    }
}
