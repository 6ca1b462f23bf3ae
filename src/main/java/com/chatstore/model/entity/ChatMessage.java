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
 * Chat message row from chat_messages. Messages are never updated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {

    private UUID messageId;

    private UUID sessionId;

    private MessageRole role;

    private String content;

    private OffsetDateTime createdAt;

    private int tokenUsage;

    private String pageContext;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
