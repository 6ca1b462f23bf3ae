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
 * Chat session row from chat_sessions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatSession {

    private UUID sessionId;

    private OffsetDateTime createdAt;

    private OffsetDateTime updatedAt;

    private String userAgent;

    private String currentPage;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
