package com.chatstore.service;

import com.chatstore.exception.InvalidEmbeddingException;
import com.chatstore.model.dto.EmbeddingCreateRequest;
import com.chatstore.model.dto.MessageCreateRequest;
import com.chatstore.model.entity.ChatMessage;
import com.chatstore.model.entity.DocumentEmbedding;
import com.chatstore.model.entity.MessageRole;
import com.chatstore.repository.ChatMessageRepository;
import com.chatstore.repository.ChatSessionRepository;
import com.chatstore.repository.DocumentEmbeddingRepository;
import com.chatstore.util.VectorUtil;
import jakarta.validation.ConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.ReactiveTransaction;
import org.springframework.transaction.ReactiveTransactionManager;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Transaction boundaries of the multi-statement operations, with the
 * transaction manager and repositories mocked inside the application context.
 */
@SpringBootTest(properties = "chatstore.database.url=r2dbc:postgresql://localhost:5432/chatstore_test")
class TransactionalServicesTests {

    @MockBean
    private ReactiveTransactionManager transactionManager;

    @MockBean
    private ChatMessageRepository chatMessageRepository;

    @MockBean
    private ChatSessionRepository chatSessionRepository;

    @MockBean
    private DocumentEmbeddingRepository documentEmbeddingRepository;

    @Autowired
    private ChatMessageService chatMessageService;

    @Autowired
    private DocumentEmbeddingService documentEmbeddingService;

    private final ReactiveTransaction transaction = mock(ReactiveTransaction.class);

    @BeforeEach
    void setUp() {
        lenient().when(transactionManager.getReactiveTransaction(any())).thenReturn(Mono.just(transaction));
        lenient().when(transactionManager.commit(any())).thenReturn(Mono.empty());
        lenient().when(transactionManager.rollback(any())).thenReturn(Mono.empty());
    }

    @Test
    void batchInsertEmbeddings_MemberFailure_RollsBack() {
        when(documentEmbeddingRepository.insert(any(DocumentEmbedding.class)))
                .thenReturn(Mono.just(UUID.randomUUID()), Mono.error(new InvalidEmbeddingException(384, 3)));

        StepVerifier.create(documentEmbeddingService.batchInsertEmbeddings(List.of(embedding("a"), embedding("b"))))
                .expectError(InvalidEmbeddingException.class)
                .verify();

        verify(transactionManager).rollback(transaction);
        verify(transactionManager, never()).commit(any());
    }

    @Test
    void batchInsertEmbeddings_Success_Commits() {
        when(documentEmbeddingRepository.insert(any(DocumentEmbedding.class)))
                .thenReturn(Mono.just(UUID.randomUUID()), Mono.just(UUID.randomUUID()));

        StepVerifier.create(documentEmbeddingService.batchInsertEmbeddings(List.of(embedding("a"), embedding("b"))))
                .expectNextCount(1)
                .verifyComplete();

        verify(transactionManager).commit(transaction);
        verify(transactionManager, never()).rollback(any());
    }

    @Test
    void insertMessage_TouchFailure_RollsBack() {
        UUID sessionId = UUID.randomUUID();
        when(chatMessageRepository.insert(any(ChatMessage.class))).thenReturn(Mono.just(UUID.randomUUID()));
        when(chatSessionRepository.touch(sessionId))
                .thenReturn(Mono.error(new DataIntegrityViolationException("session row locked")));

        StepVerifier.create(chatMessageService.insertMessage(message(sessionId, MessageRole.USER)))
                .expectError(DataIntegrityViolationException.class)
                .verify();

        verify(transactionManager).rollback(transaction);
        verify(transactionManager, never()).commit(any());
    }

    @Test
    void insertMessage_InvalidRequest_RejectedBeforeTransaction() {
        assertThatThrownBy(() -> chatMessageService.insertMessage(message(UUID.randomUUID(), null)))
                .isInstanceOf(ConstraintViolationException.class);

        verifyNoInteractions(transactionManager, chatMessageRepository, chatSessionRepository);
    }

    private static EmbeddingCreateRequest embedding(String sourceId) {
        return EmbeddingCreateRequest.builder()
                .sourceType("product")
                .sourceId(sourceId)
                .contentChunk("chunk " + sourceId)
                .embedding(new float[VectorUtil.EMBEDDING_DIMENSIONS])
                .build();
    }

    private static MessageCreateRequest message(UUID sessionId, MessageRole role) {
        return MessageCreateRequest.builder()
                .sessionId(sessionId)
                .role(role)
                .content("Is the oak table in stock?")
                .build();
    }
}
