package com.chatstore.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.binding.BindMarkersFactory;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Database configuration for the reactive PostgreSQL connection.
 *
 * All data access goes through the {@link DatabasePool} handle so that the
 * underlying pool can be closed and recreated without rewiring beans.
 */
@Configuration
@EnableTransactionManagement
@EnableConfigurationProperties({DatabaseProperties.class, MigrationProperties.class})
public class DatabaseConfig {

    /**
     * Named parameters are rewritten to PostgreSQL's $1, $2 markers. Declared
     * explicitly so building the client does not open the pool.
     */
    @Bean
    public DatabaseClient databaseClient(DatabasePool databasePool) {
        return DatabaseClient.builder()
                .connectionFactory(databasePool)
                .bindMarkers(BindMarkersFactory.indexed("$", 1))
                .namedParameters(true)
                .build();
    }

    @Bean
    public ReactiveTransactionManager transactionManager(DatabasePool databasePool) {
        return new R2dbcTransactionManager(databasePool);
    }
}
