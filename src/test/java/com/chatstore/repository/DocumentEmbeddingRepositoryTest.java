package com.chatstore.repository;

import com.chatstore.exception.InvalidEmbeddingException;
import com.chatstore.model.dto.SimilarityMatch;
import com.chatstore.model.dto.SimilarityQuery;
import com.chatstore.model.entity.DocumentEmbedding;
import com.chatstore.util.MetadataMapper;
import com.chatstore.util.VectorUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.FetchSpec;
import org.springframework.r2dbc.core.RowsFetchSpec;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for DocumentEmbeddingRepository.
 */
@ExtendWith(MockitoExtension.class)
class DocumentEmbeddingRepositoryTest {

    @Mock
    private DatabaseClient databaseClient;

    @Mock
    private DatabaseClient.GenericExecuteSpec executeSpec;

    @Mock
    private RowsFetchSpec<SimilarityMatch> rowsSpec;

    @Mock
    private FetchSpec<Map<String, Object>> fetchSpec;

    private DocumentEmbeddingRepository repository;

    private float[] embedding;

    @BeforeEach
    void setUp() {
        repository = new DocumentEmbeddingRepository(databaseClient, new MetadataMapper(new ObjectMapper()));
        embedding = new float[VectorUtil.EMBEDDING_DIMENSIONS];
        Arrays.fill(embedding, 0.1f);
    }

    @Test
    void insert_WrongDimensions_FailsBeforeQuery() {
        DocumentEmbedding document = DocumentEmbedding.builder()
                .sourceType("product")
                .sourceId("p-1")
                .contentChunk("chunk")
                .embedding(new float[3])
                .build();

        StepVerifier.create(repository.insert(document))
                .expectError(InvalidEmbeddingException.class)
                .verify();

        verifyNoInteractions(databaseClient);
    }

    @Test
    void search_WithoutSourceType_UsesUnfilteredStatement() {
        when(databaseClient.sql(DocumentEmbeddingRepository.SEARCH_SQL)).thenReturn(executeSpec);
        when(executeSpec.bind(anyString(), any())).thenReturn(executeSpec);
        doReturn(rowsSpec).when(executeSpec).map(any(Function.class));
        when(rowsSpec.all()).thenReturn(Flux.empty());

        SimilarityQuery query = SimilarityQuery.builder()
                .queryEmbedding(embedding)
                .build();

        StepVerifier.create(repository.search(query))
                .verifyComplete();

        verify(executeSpec).bind("query", VectorUtil.formatVector(embedding));
        verify(executeSpec).bind("threshold", 0.0);
        verify(executeSpec).bind("limit", 5);
        verify(executeSpec, never()).bind(eq("sourceType"), any());
    }

    @Test
    void search_WithSourceType_FiltersAndAppliesThresholdBeforeLimit() {
        when(databaseClient.sql(DocumentEmbeddingRepository.SEARCH_BY_SOURCE_TYPE_SQL)).thenReturn(executeSpec);
        when(executeSpec.bind(anyString(), any())).thenReturn(executeSpec);
        doReturn(rowsSpec).when(executeSpec).map(any(Function.class));
        when(rowsSpec.all()).thenReturn(Flux.empty());

        SimilarityQuery query = SimilarityQuery.builder()
                .queryEmbedding(embedding)
                .sourceType("faq")
                .limit(3)
                .similarityThreshold(0.7)
                .build();

        StepVerifier.create(repository.search(query))
                .verifyComplete();

        verify(executeSpec).bind("sourceType", "faq");
        verify(executeSpec).bind("threshold", 0.7);
        verify(executeSpec).bind("limit", 3);

        String sql = DocumentEmbeddingRepository.SEARCH_BY_SOURCE_TYPE_SQL;
        assertThat(sql.indexOf(":threshold")).isLessThan(sql.indexOf("LIMIT"));
    }

    @Test
    void searchStatements_ExcludeUndefinedSimilarity() {
        for (String sql : new String[]{DocumentEmbeddingRepository.SEARCH_SQL,
                DocumentEmbeddingRepository.SEARCH_BY_SOURCE_TYPE_SQL}) {
            assertThat(sql).contains("<> 'NaN'::float8");
            assertThat(sql.indexOf("'NaN'")).isLessThan(sql.indexOf("ORDER BY"));
        }
    }

    @Test
    void deleteBySource_ReturnsCount() {
        when(databaseClient.sql(DocumentEmbeddingRepository.DELETE_BY_SOURCE_SQL)).thenReturn(executeSpec);
        when(executeSpec.bind(anyString(), any())).thenReturn(executeSpec);
        when(executeSpec.fetch()).thenReturn(fetchSpec);
        when(fetchSpec.rowsUpdated()).thenReturn(Mono.just(0L));

        StepVerifier.create(repository.deleteBySource("product", "gone"))
                .expectNext(0L)
                .verifyComplete();

        verify(executeSpec).bind("sourceType", "product");
        verify(executeSpec).bind("sourceId", "gone");
    }
}
