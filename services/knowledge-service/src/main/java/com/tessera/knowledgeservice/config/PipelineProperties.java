package com.tessera.knowledgeservice.config;

import com.tessera.pipeline.execution.RetryPolicy;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Pipeline tuning, bound from {@code tessera.pipeline.*}.
 *
 * <p>WHY {@code dispatcherThreads = 0}: handlers then run on the submitting thread, so a command
 * has reached its final phase when the HTTP call returns. Tests rely on that.
 *
 * @param eventStore {@code jdbc} (default) or {@code memory}
 * @param dispatcherThreads handler pool size; 0 runs handlers inline
 * @param retry worker retry policy
 * @param insightTokenTtl lifetime of insight submission tokens
 * @param objectBaseUrl base URL of stored object links
 */
@ConfigurationProperties(prefix = "tessera.pipeline")
@Validated
public record PipelineProperties(
        String eventStore,
        @Min(0) int dispatcherThreads,
        Retry retry,
        Duration insightTokenTtl,
        String objectBaseUrl) {

    public PipelineProperties {
        if (eventStore == null || eventStore.isBlank()) {
            eventStore = "jdbc";
        }
        if (retry == null) {
            retry = new Retry(0, null, 0, null);
        }
        if (insightTokenTtl == null) {
            insightTokenTtl = Duration.ofMinutes(15);
        }
        if (objectBaseUrl == null || objectBaseUrl.isBlank()) {
            objectBaseUrl = "memory://objects";
        }
    }

    /** Unset fields fall back to {@link RetryPolicy#defaults()}. */
    public record Retry(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {

        public RetryPolicy toPolicy() {
            RetryPolicy defaults = RetryPolicy.defaults();
            return new RetryPolicy(
                    maxAttempts > 0 ? maxAttempts : defaults.maxAttempts(),
                    initialBackoff != null ? initialBackoff : defaults.initialBackoff(),
                    multiplier >= 1.0 ? multiplier : defaults.multiplier(),
                    maxBackoff != null ? maxBackoff : defaults.maxBackoff());
        }
    }
}
