package com.chatstore.service;

import com.chatstore.model.dto.EmbeddingCreateRequest;
import com.chatstore.model.dto.SimilarityMatch;
import com.chatstore.model.dto.SimilarityQuery;
import com.chatstore.model.entity.DocumentEmbedding;
import com.chatstore.repository.DocumentEmbeddingRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

/**
 * Service for document embedding storage and semantic search.
 */
@Slf4j
@Service
@Validated
@RequiredArgsConstructor
public class DocumentEmbeddingService {

    private final DocumentEmbeddingRepository documentEmbeddingRepository;

    /**
     * Store a single embedding.
     *
     * @param request Source reference, text chunk and 384-dimensional vector
     * @return Generated embedding ID
     */
    public Mono<UUID> insertEmbedding(@NotNull @Valid EmbeddingCreateRequest request) {
        return documentEmbeddingRepository.insert(toEntity(request))
                .doOnNext(embeddingId -> log.debug("Inserted embedding {} for {}/{}",
                        embeddingId, request.getSourceType(), request.getSourceId()))
                .doOnError(error -> log.error("Error inserting embedding for {}/{}",
                        request.getSourceType(), request.getSourceId(), error));
    }

    /**
     * Store many embeddings atomically. If any row fails, none are kept.
     *
     * @param requests Embeddings to store
     * @return Generated IDs in input order
     */
    @Transactional
    public Mono<List<UUID>> batchInsertEmbeddings(@NotNull List<@NotNull @Valid EmbeddingCreateRequest> requests) {
        return Flux.fromIterable(requests)
                .map(this::toEntity)
                .concatMap(documentEmbeddingRepository::insert)
                .collectList()
                .doOnNext(ids -> log.info("Batch inserted {} embeddings", ids.size()))
                .doOnError(error -> log.error("Error batch inserting {} embeddings", requests.size(), error));
    }

    /**
     * Semantic search over stored embeddings.
     *
     * @param query Query vector, optional source type filter, limit and minimum similarity
     * @return Matches ordered by descending similarity, each at or above the threshold
     */
    public Flux<SimilarityMatch> searchSimilar(@NotNull @Valid SimilarityQuery query) {
        if (query.getLimit() == 0) {
            return Flux.empty();
        }
        return documentEmbeddingRepository.search(query)
                .collectList()
                .doOnNext(results -> log.debug("Found {} similar embeddings", results.size()))
                .flatMapIterable(results -> results)
                .doOnError(error -> log.error("Error searching similar embeddings", error));
    }

    /**
     * Delete all embeddings for a source.
     *
     * @param sourceType Source type
     * @param sourceId Source ID
     * @return Number of embeddings deleted
     */
    public Mono<Long> deleteEmbeddingsBySource(@NotBlank String sourceType, @NotBlank String sourceId) {
        return documentEmbeddingRepository.deleteBySource(sourceType, sourceId)
                .doOnNext(count -> log.info("Deleted {} embeddings for {}/{}", count, sourceType, sourceId))
                .doOnError(error -> log.error("Error deleting embeddings for {}/{}", sourceType, sourceId, error));
    }

    private DocumentEmbedding toEntity(EmbeddingCreateRequest request) {
        return DocumentEmbedding.builder()
                .sourceType(request.getSourceType())
                .sourceId(request.getSourceId())
                .contentChunk(request.getContentChunk())
                .embedding(request.getEmbedding())
                .metadata(request.getMetadata())
                .build();
    }
}
