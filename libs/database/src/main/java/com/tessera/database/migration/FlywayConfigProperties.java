package com.tessera.database.migration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized Flyway configuration for the event log database.
 *
 * <p>Bean Validation ({@code @Validated}) makes a missing URL or location fail at startup rather
 * than at migration time.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * tessera:
 *   flyway:
 *     eventlog:
 *       url: jdbc:postgresql://localhost:5432/tessera
 *       username: tessera
 *       password: tessera_dev_password
 *       locations: classpath:db/migration/tessera
 *       enabled: true
 * }</pre>
 *
 * @param eventlog the database holding the event log
 */
@Validated
@ConfigurationProperties(prefix = "tessera.flyway")
public record FlywayConfigProperties(@NotNull @Valid DatabaseConfig eventlog) {

    /** Default location of the event log migrations. */
    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/tessera";

    /**
     * Connection and migration settings for one database.
     *
     * @param url JDBC connection URL
     * @param username database username
     * @param password database password
     * @param locations Flyway migration locations, defaults to {@link #DEFAULT_LOCATIONS}
     * @param enabled whether to migrate this database on startup
     */
    public record DatabaseConfig(
            @NotBlank String url,
            @NotBlank String username,
            String password,
            String locations,
            boolean enabled) {

        public DatabaseConfig {
            if (locations == null || locations.isBlank()) {
                locations = DEFAULT_LOCATIONS;
            }
        }
    }
}
