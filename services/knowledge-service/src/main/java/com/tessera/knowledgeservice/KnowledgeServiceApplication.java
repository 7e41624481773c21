package com.tessera.knowledgeservice;

import com.tessera.database.migration.FlywayMigrationConfig;
import com.tessera.knowledgeservice.config.PipelineProperties;
import com.tessera.knowledgeservice.config.RealtimeProperties;
import com.tessera.knowledgeservice.config.ServiceProperties;
import com.tessera.knowledgeservice.config.WebhookProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

/**
 * Tessera knowledge service: accepts commands, webhooks and AI insights over HTTP and runs them
 * through the event pipeline.
 *
 * <p>The event log database is migrated by {@link FlywayMigrationConfig} (Boot's own Flyway
 * auto-configuration stays off), and the pipeline is wired in {@code config.PipelineConfig}.
 */
@SpringBootApplication
@Import(FlywayMigrationConfig.class)
@EnableConfigurationProperties({
    ServiceProperties.class,
    PipelineProperties.class,
    WebhookProperties.class,
    RealtimeProperties.class
})
public class KnowledgeServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(KnowledgeServiceApplication.class, args);
        log.info("Tessera knowledge service started");
    }
}
