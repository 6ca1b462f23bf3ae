package com.chatstore.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Connectivity and setup helpers for the store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatabaseAdminService {

    private final DatabaseClient databaseClient;

    /**
     * Run SELECT 1 against the pool.
     *
     * @return true if the store answered, false on any failure (logged)
     */
    public Mono<Boolean> ping() {
        return databaseClient.sql("SELECT 1 AS ok")
                .map(row -> row.get("ok", Integer.class))
                .one()
                .map(result -> result != null && result == 1)
                .defaultIfEmpty(false)
                .doOnNext(ok -> {
                    if (ok) {
                        log.info("Database connection test successful");
                    } else {
                        log.error("Database connection test failed");
                    }
                })
                .onErrorResume(error -> {
                    log.error("Database connection test error", error);
                    return Mono.just(false);
                });
    }

    /**
     * PostgreSQL version string, as reported by version().
     */
    public Mono<String> serverVersion() {
        return databaseClient.sql("SELECT version() AS version")
                .map(row -> row.get("version", String.class))
                .one()
                .doOnError(error -> log.error("Failed to read database version", error));
    }

    /**
     * Enable the pgvector extension. Needed once per database.
     */
    public Mono<Void> enableVectorExtension() {
        return databaseClient.sql("CREATE EXTENSION IF NOT EXISTS vector")
                .then()
                .doOnSuccess(ignored -> log.info("pgvector extension enabled"))
                .doOnError(error -> log.error("Failed to enable pgvector extension", error));
    }
}
