package com.chatstore.model.dto;

import com.chatstore.model.entity.MessageRole;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.UUID;

/**
 * Request DTO for appending a message to a session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageCreateRequest {

    @NotNull(message = "Session ID is required")
    private UUID sessionId;

    @NotNull(message = "Role is required")
    private MessageRole role;

    @NotNull(message = "Content is required")
    private String content;

    @Builder.Default
    @Min(value = 0, message = "Token usage cannot be negative")
    private int tokenUsage = 0;

    private String pageContext;

    private Map<String, Object> metadata;
}
