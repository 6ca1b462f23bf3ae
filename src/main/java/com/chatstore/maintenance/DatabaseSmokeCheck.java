package com.chatstore.maintenance;

import com.chatstore.model.dto.EmbeddingCreateRequest;
import com.chatstore.model.dto.MessageCreateRequest;
import com.chatstore.model.dto.SessionCreateRequest;
import com.chatstore.model.dto.SimilarityQuery;
import com.chatstore.model.entity.MessageRole;
import com.chatstore.service.ChatMessageService;
import com.chatstore.service.ChatSessionService;
import com.chatstore.service.DocumentEmbeddingService;
import com.chatstore.util.VectorUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.Map;

/**
 * End-to-end exercise of the operations layer against a migrated database.
 *
 * Leaves its test session and embedding behind, tagged with {"test": true}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseSmokeCheck {

    static final String TEST_SOURCE_ID = "test-product";

    private final ChatSessionService chatSessionService;
    private final ChatMessageService chatMessageService;
    private final DocumentEmbeddingService documentEmbeddingService;

    public Mono<Void> run() {
        float[] testEmbedding = new float[VectorUtil.EMBEDDING_DIMENSIONS];
        Arrays.fill(testEmbedding, 0.1f);

        return chatSessionService.createSession(SessionCreateRequest.builder()
                        .userAgent("Test Agent")
                        .currentPage("/test")
                        .metadata(Map.of("test", true))
                        .build())
                .doOnNext(sessionId -> log.info("1. Created session: {}", sessionId))
                .flatMap(sessionId -> chatMessageService.insertMessage(MessageCreateRequest.builder()
                                .sessionId(sessionId)
                                .role(MessageRole.USER)
                                .content("Test message")
                                .tokenUsage(10)
                                .build())
                        .doOnNext(messageId -> log.info("2. Created message: {}", messageId))
                        .flatMap(messageId -> chatMessageService.getHistory(sessionId).count()))
                .doOnNext(count -> log.info("3. Retrieved {} message(s)", count))
                .then(documentEmbeddingService.insertEmbedding(EmbeddingCreateRequest.builder()
                        .sourceType("product")
                        .sourceId(TEST_SOURCE_ID)
                        .contentChunk("Test product description")
                        .embedding(testEmbedding)
                        .metadata(Map.of("test", true))
                        .build()))
                .doOnNext(embeddingId -> log.info("4. Created embedding: {}", embeddingId))
                .then(documentEmbeddingService.searchSimilar(SimilarityQuery.builder()
                                .queryEmbedding(testEmbedding)
                                .limit(5)
                                .build())
                        .count())
                .doOnNext(count -> log.info("5. Found {} similar embedding(s)", count))
                .doOnSuccess(ignored -> log.info("All database smoke tests passed"))
                .doOnError(error -> log.error("Database smoke test failed", error))
                .then();
    }
}
