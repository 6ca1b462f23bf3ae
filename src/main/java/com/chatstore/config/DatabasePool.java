package com.chatstore.config;

import com.chatstore.exception.DatabaseConfigurationException;
import com.chatstore.util.DatabaseUrlUtil;
import io.r2dbc.pool.ConnectionPool;
import io.r2dbc.pool.ConnectionPoolConfiguration;
import io.r2dbc.spi.Connection;
import io.r2dbc.spi.ConnectionFactories;
import io.r2dbc.spi.ConnectionFactory;
import io.r2dbc.spi.ConnectionFactoryMetadata;
import io.r2dbc.spi.ConnectionFactoryOptions;
import io.r2dbc.spi.Option;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Process-wide pool of database connections.
 *
 * The pool is created on the first {@link #open()} (or the first connection
 * request) and lives until {@link #close()}, after which the next request
 * creates a fresh pool. Because this handle is itself a {@link ConnectionFactory},
 * {@code DatabaseClient} and the transaction manager bind to it rather than to a
 * particular pool instance.
 */
@Slf4j
@Component
public class DatabasePool implements ConnectionFactory, DisposableBean {

    static final Option<Duration> STATEMENT_TIMEOUT = Option.valueOf("statementTimeout");

    private static final ConnectionFactoryMetadata METADATA = () -> "PostgreSQL";

    private final DatabaseProperties properties;

    private ConnectionPool pool;

    public DatabasePool(DatabaseProperties properties) {
        this.properties = properties;
    }

    /**
     * Get or create the connection pool.
     *
     * @return The live pool
     * @throws DatabaseConfigurationException if no connection URL is configured
     */
    public synchronized ConnectionPool open() {
        if (pool == null || pool.isDisposed()) {
            ConnectionFactoryOptions options = connectionOptions();
            try {
                ConnectionPoolConfiguration configuration = ConnectionPoolConfiguration
                        .builder(ConnectionFactories.get(options))
                        .initialSize(properties.getMinPoolSize())
                        .minIdle(properties.getMinPoolSize())
                        .maxSize(properties.getMaxPoolSize())
                        .maxAcquireTime(properties.getConnectTimeout())
                        .maxCreateConnectionTime(properties.getConnectTimeout())
                        .name("chatstore")
                        .build();
                pool = new ConnectionPool(configuration);
            } catch (RuntimeException e) {
                log.error("Failed to create database connection pool", e);
                throw e;
            }
            log.info("Database connection pool created (min={}, max={}, host={})",
                    properties.getMinPoolSize(), properties.getMaxPoolSize(),
                    DatabaseUrlUtil.describe(properties.getUrl()));
        }
        return pool;
    }

    /**
     * Dispose the pool if it exists. A later request recreates it.
     */
    public Mono<Void> close() {
        ConnectionPool current;
        synchronized (this) {
            current = pool;
            pool = null;
        }
        if (current == null) {
            return Mono.empty();
        }
        return current.disposeLater()
                .doOnSuccess(ignored -> log.info("Database connection pool closed"));
    }

    public synchronized boolean isOpen() {
        return pool != null && !pool.isDisposed();
    }

    /**
     * Open a single connection outside the pool, for maintenance work that
     * should not compete with request traffic.
     */
    public Mono<Connection> connectDirect() {
        return Mono.defer(() -> Mono.from(ConnectionFactories.get(connectionOptions()).create()));
    }

    @Override
    public Mono<Connection> create() {
        return Mono.defer(() -> open().create());
    }

    @Override
    public ConnectionFactoryMetadata getMetadata() {
        return METADATA;
    }

    @Override
    public void destroy() {
        close().block(properties.getConnectTimeout());
    }

    ConnectionFactoryOptions connectionOptions() {
        String url = DatabaseUrlUtil.toR2dbcUrl(properties.getUrl());
        try {
            return ConnectionFactoryOptions.parse(url).mutate()
                    .option(ConnectionFactoryOptions.CONNECT_TIMEOUT, properties.getConnectTimeout())
                    .option(STATEMENT_TIMEOUT, properties.getCommandTimeout())
                    .build();
        } catch (IllegalArgumentException e) {
            throw new DatabaseConfigurationException("Invalid database URL for host " + DatabaseUrlUtil.describe(url), e);
        }
    }
}
