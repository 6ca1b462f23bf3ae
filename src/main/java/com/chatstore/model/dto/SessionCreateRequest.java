package com.chatstore.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for starting a chat session. Every field is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionCreateRequest {

    private String userAgent;

    private String currentPage;

    private Map<String, Object> metadata;
}
