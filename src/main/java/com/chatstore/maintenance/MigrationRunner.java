package com.chatstore.maintenance;

import com.chatstore.config.DatabasePool;
import com.chatstore.config.MigrationProperties;
import io.r2dbc.spi.Connection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternUtils;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import org.springframework.r2dbc.connection.init.ScriptUtils;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Applies the ordered *.sql schema scripts on a single direct connection.
 *
 * Each file is sent as one script, so dollar-quoted function bodies are
 * passed through intact. The run stops at the first failing file.
 */
@Slf4j
@Component
public class MigrationRunner {

    private final DatabasePool databasePool;
    private final MigrationProperties migrationProperties;
    private final SchemaInventory schemaInventory;
    private final ResourcePatternResolver resourcePatternResolver;

    public MigrationRunner(DatabasePool databasePool, MigrationProperties migrationProperties,
                           SchemaInventory schemaInventory, ResourceLoader resourceLoader) {
        this.databasePool = databasePool;
        this.migrationProperties = migrationProperties;
        this.schemaInventory = schemaInventory;
        this.resourcePatternResolver = ResourcePatternUtils.getResourcePatternResolver(resourceLoader);
    }

    /**
     * Find migration scripts, sorted by file name.
     */
    public List<Resource> discoverMigrations() {
        String location = migrationProperties.getLocation();
        String pattern = (location.endsWith("/") ? location : location + "/") + "*.sql";
        try {
            return Arrays.stream(resourcePatternResolver.getResources(pattern))
                    .filter(Resource::exists)
                    .sorted(Comparator.comparing(resource -> Objects.requireNonNullElse(resource.getFilename(), "")))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list migrations in " + location, e);
        }
    }

    /**
     * Run all migrations and collect the resulting schema inventory.
     */
    public Mono<MigrationReport> run() {
        return Mono.defer(() -> {
            List<Resource> scripts = discoverMigrations();
            log.info("Starting database migrations from {}", migrationProperties.getLocation());
            if (scripts.isEmpty()) {
                log.warn("No migration files found");
            } else {
                log.info("Found {} migration file(s)", scripts.size());
            }
            return Mono.usingWhen(databasePool.connectDirect(),
                    connection -> migrate(connection, scripts),
                    Connection::close);
        }).doOnNext(this::logReport);
    }

    private Mono<MigrationReport> migrate(Connection connection, List<Resource> scripts) {
        MigrationReport.MigrationReportBuilder report = MigrationReport.builder()
                .discoveredScripts(scripts.size());

        return Flux.fromIterable(scripts)
                .concatMap(script -> apply(connection, script))
                .takeUntil(result -> !result.isSuccess())
                .doOnNext(report::result)
                .then(schemaInventory.tables(connection))
                .doOnNext(report::tables)
                .then(schemaInventory.vectorExtensionVersion(connection))
                .doOnNext(report::vectorExtensionVersion)
                .then(schemaInventory.indexes(connection))
                .doOnNext(report::indexes)
                .then(Mono.fromSupplier(report::build));
    }

    private Mono<MigrationReport.ScriptResult> apply(Connection connection, Resource script) {
        String fileName = script.getFilename();
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(script);
        populator.setSeparator(ScriptUtils.EOF_STATEMENT_SEPARATOR);

        return Mono.fromRunnable(() -> log.info("Running migration: {}", fileName))
                .then(populator.populate(connection))
                .thenReturn(MigrationReport.ScriptResult.applied(fileName))
                .doOnNext(result -> log.info("Successfully applied: {}", fileName))
                .onErrorResume(error -> {
                    log.error("Failed to apply {}", fileName, error);
                    return Mono.just(MigrationReport.ScriptResult.failed(fileName, error.getMessage()));
                });
    }

    private void logReport(MigrationReport report) {
        report.getResults().stream()
                .filter(result -> !result.isSuccess())
                .findFirst()
                .ifPresent(failed -> log.error("Migration {} failed, stopping: {}", failed.getFileName(), failed.getError()));

        log.info("Tables ({}):", report.getTables().size());
        report.getTables().forEach(table -> log.info("  {}", table));

        if (report.getVectorExtensionVersion() != null) {
            log.info("pgvector extension enabled (version {})", report.getVectorExtensionVersion());
        } else {
            log.warn("pgvector extension not found");
        }

        log.info("Indexes ({}):", report.getIndexes().size());
        report.getIndexes().forEach(index -> log.info("  {}", index));

        log.info("Applied {}/{} migration(s)", report.appliedCount(), report.getDiscoveredScripts());
    }
}
