package com.chatstore.service;

import com.chatstore.model.dto.MessageCreateRequest;
import com.chatstore.model.entity.ChatMessage;
import com.chatstore.repository.ChatMessageRepository;
import com.chatstore.repository.ChatSessionRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Service for chat messages.
 */
@Slf4j
@Service
@Validated
@RequiredArgsConstructor
public class ChatMessageService {

    public static final int DEFAULT_HISTORY_LIMIT = 50;

    private final ChatMessageRepository chatMessageRepository;
    private final ChatSessionRepository chatSessionRepository;

    /**
     * Append a message to a session and bump the session's updated_at.
     *
     * Both statements share one connection and transaction.
     *
     * @param request Message to store
     * @return Generated message ID
     */
    @Transactional
    public Mono<UUID> insertMessage(@NotNull @Valid MessageCreateRequest request) {
        ChatMessage message = ChatMessage.builder()
                .sessionId(request.getSessionId())
                .role(request.getRole())
                .content(request.getContent())
                .tokenUsage(request.getTokenUsage())
                .pageContext(request.getPageContext())
                .metadata(request.getMetadata())
                .build();

        return chatMessageRepository.insert(message)
                .flatMap(messageId -> chatSessionRepository.touch(request.getSessionId())
                        .thenReturn(messageId))
                .doOnNext(messageId -> log.debug("Inserted chat message {} for session {}",
                        messageId, request.getSessionId()))
                .doOnError(error -> log.error("Error inserting chat message for session {}",
                        request.getSessionId(), error));
    }

    /**
     * Get the first page of a session's history.
     */
    public Flux<ChatMessage> getHistory(@NotNull UUID sessionId) {
        return getHistory(sessionId, DEFAULT_HISTORY_LIMIT, 0);
    }

    /**
     * Get chat history for a session, oldest message first.
     *
     * @param sessionId Session ID
     * @param limit Maximum number of messages; 0 yields no messages
     * @param offset Number of messages to skip
     * @return Messages ordered by creation time
     */
    public Flux<ChatMessage> getHistory(@NotNull UUID sessionId,
                                        @Min(0) int limit,
                                        @Min(0) int offset) {
        if (limit == 0) {
            return Flux.empty();
        }
        return chatMessageRepository.findBySessionId(sessionId, limit, offset)
                .doOnError(error -> log.error("Error getting chat history for session {}", sessionId, error));
    }
}
