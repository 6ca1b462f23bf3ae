package com.chatstore.maintenance;

import io.r2dbc.spi.Connection;
import lombok.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Catalog queries describing what the migrations created in the public schema.
 */
@Component
public class SchemaInventory {

    /**
     * Prefix shared by every index the migrations create.
     */
    public static final String INDEX_PREFIX = "idx_";

    public static final String VECTOR_INDEX = "idx_document_embeddings_vector";

    private static final String TABLES_SQL = """
            SELECT tablename
            FROM pg_tables
            WHERE schemaname = 'public'
            ORDER BY tablename
            """;

    private static final String VECTOR_EXTENSION_SQL = """
            SELECT extversion
            FROM pg_extension
            WHERE extname = 'vector'
            """;

    private static final String INDEXES_SQL = """
            SELECT indexname, tablename
            FROM pg_indexes
            WHERE schemaname = 'public'
            AND indexname LIKE 'idx_%'
            ORDER BY tablename, indexname
            """;

    public Mono<List<String>> tables(Connection connection) {
        return Mono.defer(() -> Flux.from(connection.createStatement(TABLES_SQL).execute())
                .flatMap(result -> result.map((row, metadata) -> row.get("tablename", String.class)))
                .collectList());
    }

    /**
     * Installed pgvector version, or empty when the extension is missing.
     */
    public Mono<String> vectorExtensionVersion(Connection connection) {
        return Mono.defer(() -> Flux.from(connection.createStatement(VECTOR_EXTENSION_SQL).execute())
                .flatMap(result -> result.map((row, metadata) -> row.get("extversion", String.class)))
                .next());
    }

    public Mono<List<IndexInfo>> indexes(Connection connection) {
        return Mono.defer(() -> Flux.from(connection.createStatement(INDEXES_SQL).execute())
                .flatMap(result -> result.map((row, metadata) -> new IndexInfo(
                        row.get("indexname", String.class),
                        row.get("tablename", String.class))))
                .collectList());
    }

    @Value
    public static class IndexInfo {
        String name;
        String table;

        @Override
        public String toString() {
            return name + " on " + table;
        }
    }
}
