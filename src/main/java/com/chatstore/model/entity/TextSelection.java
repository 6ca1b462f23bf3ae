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
 * Text highlighted by a user on a page, from user_text_selections.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TextSelection {

    private UUID selectionId;

    private UUID sessionId;

    private String selectedText;

    private String pageUrl;

    private float[] embedding; // optional

    private OffsetDateTime createdAt;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
