package com.chatstore.service;

import com.chatstore.model.dto.SessionCreateRequest;
import com.chatstore.model.dto.SessionPatch;
import com.chatstore.model.entity.ChatSession;
import com.chatstore.repository.ChatSessionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ChatSessionService.
 */
@ExtendWith(MockitoExtension.class)
class ChatSessionServiceTest {

    @Mock
    private ChatSessionRepository chatSessionRepository;

    @InjectMocks
    private ChatSessionService chatSessionService;

    private UUID sessionId;

    @BeforeEach
    void setUp() {
        sessionId = UUID.randomUUID();
    }

    @Test
    void createSession_Success() {
        Map<String, Object> metadata = Map.of("source", "homepage");
        SessionCreateRequest request = SessionCreateRequest.builder()
                .userAgent("Mozilla/5.0")
                .currentPage("/")
                .metadata(metadata)
                .build();
        when(chatSessionRepository.insert("Mozilla/5.0", "/", metadata)).thenReturn(Mono.just(sessionId));

        StepVerifier.create(chatSessionService.createSession(request))
                .expectNext(sessionId)
                .verifyComplete();
    }

    @Test
    void createSession_StoreUnavailable() {
        when(chatSessionRepository.insert(any(), any(), any()))
                .thenReturn(Mono.error(new DataAccessResourceFailureException("connection refused")));

        StepVerifier.create(chatSessionService.createSession(new SessionCreateRequest()))
                .expectError(DataAccessResourceFailureException.class)
                .verify();
    }

    @Test
    void getSession_Found() {
        ChatSession session = ChatSession.builder()
                .sessionId(sessionId)
                .currentPage("/products")
                .build();
        when(chatSessionRepository.findById(sessionId)).thenReturn(Mono.just(session));

        StepVerifier.create(chatSessionService.getSession(sessionId))
                .expectNextMatches(found -> found.getSessionId().equals(sessionId) && found.getMetadata().isEmpty())
                .verifyComplete();
    }

    @Test
    void getSession_NotFound() {
        when(chatSessionRepository.findById(sessionId)).thenReturn(Mono.empty());

        StepVerifier.create(chatSessionService.getSession(sessionId))
                .verifyComplete();
    }

    @Test
    void updateSession_EmptyPatch() {
        StepVerifier.create(chatSessionService.updateSession(sessionId, new SessionPatch()))
                .expectNext(false)
                .verifyComplete();

        verifyNoInteractions(chatSessionRepository);
    }

    @Test
    void updateSession_MergesMetadata() {
        SessionPatch patch = SessionPatch.builder().metadata(Map.of("b", 3)).build();
        when(chatSessionRepository.update(sessionId, patch)).thenReturn(Mono.just(true));

        StepVerifier.create(chatSessionService.updateSession(sessionId, patch))
                .expectNext(true)
                .verifyComplete();

        verify(chatSessionRepository).update(sessionId, patch);
    }

    @Test
    void updateSession_UnknownSession() {
        SessionPatch patch = SessionPatch.builder().currentPage("/cart").build();
        when(chatSessionRepository.update(sessionId, patch)).thenReturn(Mono.just(false));

        StepVerifier.create(chatSessionService.updateSession(sessionId, patch))
                .expectNext(false)
                .verifyComplete();
    }
}
