package com.chatstore.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Where schema migration scripts are read from.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "chatstore.migrations")
public class MigrationProperties {

    /**
     * Spring resource location of the directory holding the ordered *.sql files,
     * e.g. classpath:db/migration/ or file:database/migrations/.
     */
    @NotBlank
    private String location = "classpath:db/migration/";
}
