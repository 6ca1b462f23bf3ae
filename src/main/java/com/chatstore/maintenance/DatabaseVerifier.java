package com.chatstore.maintenance;

import com.chatstore.config.DatabasePool;
import com.chatstore.maintenance.VerificationReport.Check;
import io.r2dbc.spi.Connection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Read-only diagnostics confirming the schema the data-access layer expects.
 *
 * Failures never propagate: each one becomes a failed check in the report.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseVerifier {

    public static final List<String> REQUIRED_TABLES = List.of(
            "chat_sessions",
            "chat_messages",
            "document_embeddings",
            "user_text_selections");

    static final int MIN_INDEXES = 8;
    static final int MIN_SESSION_COLUMNS = 6;

    private static final String COLUMNS_SQL = """
            SELECT column_name, data_type
            FROM information_schema.columns
            WHERE table_name = $1
            """;

    private final DatabasePool databasePool;
    private final SchemaInventory schemaInventory;

    public Mono<VerificationReport> verify() {
        return Mono.usingWhen(databasePool.connectDirect(),
                        this::runChecks,
                        Connection::close)
                .onErrorResume(error -> {
                    log.error("Database connection failed", error);
                    return Mono.just(new VerificationReport(List.of(
                            Check.fail("connection", String.valueOf(error.getMessage())).asCritical())));
                })
                .doOnNext(this::logReport);
    }

    private Mono<VerificationReport> runChecks(Connection connection) {
        return Flux.concat(
                        Mono.just(Check.pass("connection", "Connected successfully").asCritical()),
                        guard("server version", false, () -> versionCheck(connection)),
                        guard("pgvector extension", true, () -> extensionCheck(connection)),
                        Flux.defer(() -> tableChecks(connection)),
                        guard("index count", false, () -> indexCountCheck(connection)),
                        guard("vector index", true, () -> vectorIndexCheck(connection)),
                        guard("chat_sessions structure", false, () -> sessionColumnsCheck(connection)),
                        guard("document_embeddings vector column", false, () -> vectorColumnCheck(connection)),
                        guard("insert/delete", false, () -> writeProbe(connection)))
                .collectList()
                .map(VerificationReport::new);
    }

    private Mono<Check> versionCheck(Connection connection) {
        return Flux.from(connection.createStatement("SELECT version() AS version").execute())
                .flatMap(result -> result.map((row, metadata) -> row.get("version", String.class)))
                .next()
                .map(version -> Check.pass("server version", version.split(",")[0]));
    }

    private Mono<Check> extensionCheck(Connection connection) {
        return schemaInventory.vectorExtensionVersion(connection)
                .map(version -> Check.pass("pgvector extension", "version " + version))
                .defaultIfEmpty(Check.fail("pgvector extension", "not installed, run migrations"));
    }

    private Flux<Check> tableChecks(Connection connection) {
        return schemaInventory.tables(connection)
                .flatMapIterable(existing -> REQUIRED_TABLES.stream()
                        .map(table -> existing.contains(table)
                                ? Check.pass("table " + table, "present")
                                : Check.fail("table " + table, "missing, run migrations"))
                        .map(Check::asCritical)
                        .toList())
                .onErrorResume(error -> Flux.just(Check.fail("tables", String.valueOf(error.getMessage())).asCritical()));
    }

    private Mono<Check> indexCountCheck(Connection connection) {
        return schemaInventory.indexes(connection)
                .map(indexes -> indexes.size() >= MIN_INDEXES
                        ? Check.pass("index count", "found " + indexes.size() + " indexes")
                        : Check.fail("index count", "expected at least " + MIN_INDEXES + ", found " + indexes.size()));
    }

    private Mono<Check> vectorIndexCheck(Connection connection) {
        return schemaInventory.indexes(connection)
                .map(indexes -> indexes.stream().anyMatch(index -> SchemaInventory.VECTOR_INDEX.equals(index.getName()))
                        ? Check.pass("vector index", SchemaInventory.VECTOR_INDEX + " exists")
                        : Check.fail("vector index", SchemaInventory.VECTOR_INDEX + " missing"));
    }

    private Mono<Check> sessionColumnsCheck(Connection connection) {
        return columnTypes(connection, "chat_sessions")
                .map(types -> types.size() >= MIN_SESSION_COLUMNS
                        ? Check.pass("chat_sessions structure", types.size() + " columns")
                        : Check.fail("chat_sessions structure", "only " + types.size() + " columns"));
    }

    private Mono<Check> vectorColumnCheck(Connection connection) {
        return columnTypes(connection, "document_embeddings")
                .map(types -> types.contains("USER-DEFINED")
                        ? Check.pass("document_embeddings vector column", "present")
                        : Check.fail("document_embeddings vector column", "missing"));
    }

    private Mono<List<String>> columnTypes(Connection connection, String table) {
        return Flux.from(connection.createStatement(COLUMNS_SQL).bind("$1", table).execute())
                .flatMap(result -> result.map((row, metadata) -> row.get("data_type", String.class)))
                .collectList();
    }

    // Inserts a throwaway session and deletes it again
    private Mono<Check> writeProbe(Connection connection) {
        return Flux.from(connection.createStatement(
                                "INSERT INTO chat_sessions (user_agent, current_page) VALUES ('Test', '/test') RETURNING session_id")
                        .execute())
                .flatMap(result -> result.map((row, metadata) -> row.get("session_id", UUID.class)))
                .single()
                .flatMap(sessionId -> Flux.from(connection.createStatement("DELETE FROM chat_sessions WHERE session_id = $1")
                                .bind("$1", sessionId)
                                .execute())
                        .flatMap(result -> Mono.from(result.getRowsUpdated()))
                        .then())
                .thenReturn(Check.pass("insert/delete", "insert and delete work"));
    }

    private Mono<Check> guard(String name, boolean critical, Supplier<Mono<Check>> check) {
        return Mono.defer(check)
                .defaultIfEmpty(Check.fail(name, "no result"))
                .onErrorResume(error -> Mono.just(Check.fail(name, String.valueOf(error.getMessage()))))
                .map(result -> critical ? result.asCritical() : result);
    }

    private void logReport(VerificationReport report) {
        for (Check check : report.getChecks()) {
            if (check.isPassed()) {
                log.info("[PASS] {}: {}", check.getName(), check.getDetail());
            } else {
                log.warn("[FAIL] {}: {}", check.getName(), check.getDetail());
            }
        }
        if (report.isHealthy()) {
            log.info("Database is properly configured");
        } else {
            log.warn("Database needs configuration ({} failed checks), run the migrations", report.failedCount());
        }
    }
}
