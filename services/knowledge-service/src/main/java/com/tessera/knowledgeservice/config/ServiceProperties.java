package com.tessera.knowledgeservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of the running service, bound from {@code tessera.service.*}.
 *
 * <pre>
 * tessera:
 *   service:
 *     name: knowledge-service
 *     environment: production
 *     description: Tessera command pipeline
 * </pre>
 *
 * @param name used in logs and as the {@code service} tag on every meter. Required.
 * @param environment deployment environment, {@code development} when unset
 * @param description shown by {@code /api/v1/info}
 */
@ConfigurationProperties(prefix = "tessera.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment, String description) {

    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
