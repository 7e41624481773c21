package com.tessera.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Flyway configuration for the event log database.
 *
 * <p>WHY a dedicated bean instead of Spring Boot's Flyway auto-configuration: the migration
 * credentials are separate from the application's pooled {@code DataSource}, so schema changes can
 * run with a more privileged account. Services importing this class should disable the
 * auto-configured one:
 *
 * <pre>{@code
 * spring:
 *   flyway:
 *     enabled: false
 * }</pre>
 *
 * <p>Beans that read or write the event log should ask for the {@link #EVENTLOG_FLYWAY_BEAN} bean
 * (optionally, since migration can be disabled) so they are created after the schema exists.
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(prefix = "tessera.flyway.eventlog", name = "enabled", havingValue = "true")
public class FlywayMigrationConfig {

    /** Bean name for the event log Flyway instance. */
    public static final String EVENTLOG_FLYWAY_BEAN = "eventlogFlyway";

    /** Creates the event log Flyway instance and migrates it when the context starts. */
    @Bean(name = EVENTLOG_FLYWAY_BEAN, initMethod = "migrate")
    public Flyway eventlogFlyway(FlywayConfigProperties properties) {
        return createFlyway(properties.eventlog());
    }

    /** Builds an unmigrated Flyway instance for one database. */
    public static Flyway createFlyway(FlywayConfigProperties.DatabaseConfig config) {
        DataSource dataSource =
                DataSourceBuilder.create()
                        .url(config.url())
                        .username(config.username())
                        .password(config.password())
                        .build();

        return Flyway.configure()
                .dataSource(dataSource)
                .locations(config.locations())
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }
}
