package com.tessera.knowledgeservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Webhook ingestion, bound from {@code tessera.webhooks.*}.
 *
 * @param secret shared secret callers send in {@code X-Webhook-Secret}. Required.
 * @param maxItems largest accepted batch, 100 when unset
 */
@ConfigurationProperties(prefix = "tessera.webhooks")
@Validated
public record WebhookProperties(@NotBlank String secret, int maxItems) {

    public WebhookProperties {
        if (maxItems <= 0) {
            maxItems = 100;
        }
    }

    @Override
    public String toString() {
        return "WebhookProperties[secret=****, maxItems=" + maxItems + "]";
    }
}
