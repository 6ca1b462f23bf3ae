package com.chatstore.service;

import com.chatstore.model.dto.SessionCreateRequest;
import com.chatstore.model.dto.SessionPatch;
import com.chatstore.model.entity.ChatSession;
import com.chatstore.repository.ChatSessionRepository;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Service for chat session lifecycle.
 */
@Slf4j
@Service
@Validated
@RequiredArgsConstructor
public class ChatSessionService {

    private final ChatSessionRepository chatSessionRepository;

    /**
     * Create a new chat session.
     *
     * @param request User agent, current page and metadata, all optional
     * @return Generated session ID
     */
    public Mono<UUID> createSession(@NotNull SessionCreateRequest request) {
        return chatSessionRepository.insert(request.getUserAgent(), request.getCurrentPage(), request.getMetadata())
                .doOnNext(sessionId -> log.info("Created chat session: {}", sessionId))
                .doOnError(error -> log.error("Error creating chat session", error));
    }

    /**
     * Get a chat session.
     *
     * @param sessionId Session ID
     * @return The session, or empty if it does not exist
     */
    public Mono<ChatSession> getSession(@NotNull UUID sessionId) {
        return chatSessionRepository.findById(sessionId)
                .doOnError(error -> log.error("Error getting chat session {}", sessionId, error));
    }

    /**
     * Update page and/or metadata of a session. Metadata is merged with what is stored.
     *
     * @param sessionId Session ID
     * @param patch Fields to change; null fields are left as they are
     * @return true if the session exists and was updated; false for an unknown
     *         session or an empty patch
     */
    public Mono<Boolean> updateSession(@NotNull UUID sessionId, @NotNull SessionPatch patch) {
        if (patch.isEmpty()) {
            log.debug("Ignoring empty update for chat session {}", sessionId);
            return Mono.just(false);
        }
        return chatSessionRepository.update(sessionId, patch)
                .doOnNext(updated -> log.debug("Chat session {} updated: {}", sessionId, updated))
                .doOnError(error -> log.error("Error updating chat session {}", sessionId, error));
    }
}
