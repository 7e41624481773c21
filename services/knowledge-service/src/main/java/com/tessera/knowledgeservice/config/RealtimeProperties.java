package com.tessera.knowledgeservice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Real-time push, bound from {@code tessera.realtime.*}. Without a URL, notifications are only
 * logged.
 *
 * @param url base URL of the real-time service
 */
@ConfigurationProperties(prefix = "tessera.realtime")
public record RealtimeProperties(String url) {

    public boolean enabled() {
        return url != null && !url.isBlank();
    }
}
