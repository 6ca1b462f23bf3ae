package com.chatstore.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.RowsFetchSpec;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.function.Function;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.when;

/**
 * Unit tests for DatabaseAdminService.
 */
@ExtendWith(MockitoExtension.class)
class DatabaseAdminServiceTest {

    @Mock
    private DatabaseClient databaseClient;

    @Mock
    private DatabaseClient.GenericExecuteSpec executeSpec;

    @Mock
    private RowsFetchSpec<Integer> rowsSpec;

    @InjectMocks
    private DatabaseAdminService databaseAdminService;

    @Test
    void ping_Success() {
        when(databaseClient.sql("SELECT 1 AS ok")).thenReturn(executeSpec);
        doReturn(rowsSpec).when(executeSpec).map(any(Function.class));
        when(rowsSpec.one()).thenReturn(Mono.just(1));

        StepVerifier.create(databaseAdminService.ping())
                .expectNext(true)
                .verifyComplete();
    }

    @Test
    void ping_StoreUnreachable_ReportsFalse() {
        when(databaseClient.sql("SELECT 1 AS ok")).thenReturn(executeSpec);
        doReturn(rowsSpec).when(executeSpec).map(any(Function.class));
        when(rowsSpec.one()).thenReturn(Mono.error(new DataAccessResourceFailureException("timeout")));

        StepVerifier.create(databaseAdminService.ping())
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void enableVectorExtension_PropagatesFailure() {
        when(databaseClient.sql("CREATE EXTENSION IF NOT EXISTS vector")).thenReturn(executeSpec);
        when(executeSpec.then()).thenReturn(Mono.error(new DataAccessResourceFailureException("permission denied")));

        StepVerifier.create(databaseAdminService.enableVectorExtension())
                .expectError(DataAccessResourceFailureException.class)
                .verify();
    }
}
