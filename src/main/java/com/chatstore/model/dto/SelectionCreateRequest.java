package com.chatstore.model.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.UUID;

/**
 * Request DTO for recording text a user highlighted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SelectionCreateRequest {

    @NotNull(message = "Session ID is required")
    private UUID sessionId;

    @NotNull(message = "Selected text is required")
    private String selectedText;

    @NotNull(message = "Page URL is required")
    private String pageUrl;

    private float[] embedding;

    private Map<String, Object> metadata;
}
