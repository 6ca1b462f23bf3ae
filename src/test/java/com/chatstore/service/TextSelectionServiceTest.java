package com.chatstore.service;

import com.chatstore.model.dto.SelectionCreateRequest;
import com.chatstore.model.entity.TextSelection;
import com.chatstore.repository.TextSelectionRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for TextSelectionService.
 */
@ExtendWith(MockitoExtension.class)
class TextSelectionServiceTest {

    @Mock
    private TextSelectionRepository textSelectionRepository;

    @InjectMocks
    private TextSelectionService textSelectionService;

    @Test
    void insertSelection_WithoutEmbedding() {
        UUID sessionId = UUID.randomUUID();
        UUID selectionId = UUID.randomUUID();
        SelectionCreateRequest request = SelectionCreateRequest.builder()
                .sessionId(sessionId)
                .selectedText("free delivery over 50 EUR")
                .pageUrl("/shipping")
                .build();
        when(textSelectionRepository.insert(any(TextSelection.class))).thenReturn(Mono.just(selectionId));

        StepVerifier.create(textSelectionService.insertSelection(request))
                .expectNext(selectionId)
                .verifyComplete();

        verify(textSelectionRepository).insert(argThat(selection ->
                selection.getSessionId().equals(sessionId) && selection.getEmbedding() == null));
    }

    @Test
    void getSelections_DefaultLimit() {
        UUID sessionId = UUID.randomUUID();
        TextSelection newest = TextSelection.builder().sessionId(sessionId).selectedText("b").build();
        TextSelection older = TextSelection.builder().sessionId(sessionId).selectedText("a").build();
        when(textSelectionRepository.findBySessionId(sessionId, TextSelectionService.DEFAULT_SELECTION_LIMIT))
                .thenReturn(Flux.just(newest, older));

        StepVerifier.create(textSelectionService.getSelections(sessionId))
                .expectNext(newest, older)
                .verifyComplete();
    }

    @Test
    void getSelections_ZeroLimit_IsEmpty() {
        StepVerifier.create(textSelectionService.getSelections(UUID.randomUUID(), 0))
                .verifyComplete();

        verifyNoInteractions(textSelectionRepository);
    }
}
