package com.chatstore.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection settings for the chat store database.
 *
 * The URL is normally supplied through the DATABASE_URL environment variable.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "chatstore.database")
public class DatabaseProperties {

    @NotBlank(message = "DATABASE_URL environment variable is not set")
    private String url;

    @Min(0)
    private int minPoolSize = 2;

    @Min(1)
    private int maxPoolSize = 10;

    @NotNull
    private Duration commandTimeout = Duration.ofSeconds(60);

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(30);
}
