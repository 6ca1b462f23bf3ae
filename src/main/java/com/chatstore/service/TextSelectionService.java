package com.chatstore.service;

import com.chatstore.model.dto.SelectionCreateRequest;
import com.chatstore.model.entity.TextSelection;
import com.chatstore.repository.TextSelectionRepository;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Service for user text selections.
 */
@Slf4j
@Service
@Validated
@RequiredArgsConstructor
public class TextSelectionService {

    public static final int DEFAULT_SELECTION_LIMIT = 10;

    private final TextSelectionRepository textSelectionRepository;

    /**
     * Record a text selection.
     *
     * @param request Session, selected text, page URL and optional embedding
     * @return Generated selection ID
     */
    public Mono<UUID> insertSelection(@NotNull @Valid SelectionCreateRequest request) {
        TextSelection selection = TextSelection.builder()
                .sessionId(request.getSessionId())
                .selectedText(request.getSelectedText())
                .pageUrl(request.getPageUrl())
                .embedding(request.getEmbedding())
                .metadata(request.getMetadata())
                .build();

        return textSelectionRepository.insert(selection)
                .doOnNext(selectionId -> log.debug("Inserted text selection {}", selectionId))
                .doOnError(error -> log.error("Error inserting text selection for session {}",
                        request.getSessionId(), error));
    }

    public Flux<TextSelection> getSelections(@NotNull UUID sessionId) {
        return getSelections(sessionId, DEFAULT_SELECTION_LIMIT);
    }

    /**
     * Most recent selections of a session first.
     */
    public Flux<TextSelection> getSelections(@NotNull UUID sessionId, @Min(0) int limit) {
        if (limit == 0) {
            return Flux.empty();
        }
        return textSelectionRepository.findBySessionId(sessionId, limit)
                .doOnError(error -> log.error("Error getting text selections for session {}", sessionId, error));
    }
}
