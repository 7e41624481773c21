package com.tessera.knowledgeservice.insight;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InsightTokenRegistry")
class InsightTokenRegistryTest {

    /** A clock the test moves by hand. */
    static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration by) {
            now = now.plus(by);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final InsightTokenRegistry registry = new InsightTokenRegistry(clock, Duration.ofMinutes(5));

    @Test
    @DisplayName("resolves an issued token to its user and request")
    void resolvesIssuedToken() {
        InsightToken token = registry.issue("user-1", "req-1");

        assertThat(registry.resolve(token.value()))
                .hasValueSatisfying(
                        resolved -> {
                            assertThat(resolved.userId()).isEqualTo("user-1");
                            assertThat(resolved.requestId()).isEqualTo("req-1");
                            assertThat(resolved.expiresAt()).isEqualTo(Instant.parse("2026-03-01T10:05:00Z"));
                        });
    }

    @Test
    @DisplayName("issues a different value every time")
    void uniqueValues() {
        assertThat(registry.issue("user-1", "req-1").value())
                .isNotEqualTo(registry.issue("user-1", "req-1").value());
    }

    @Test
    @DisplayName("stops resolving a token once it expires")
    void expires() {
        InsightToken token = registry.issue("user-1", "req-1");

        clock.advance(Duration.ofMinutes(4));
        assertThat(registry.resolve(token.value())).isPresent();

        clock.advance(Duration.ofMinutes(1));
        assertThat(registry.resolve(token.value())).isEmpty();
    }

    @Test
    @DisplayName("does not resolve unknown or null values")
    void unknownValues() {
        assertThat(registry.resolve("nope")).isEmpty();
        assertThat(registry.resolve(null)).isEmpty();
    }

    @Test
    @DisplayName("purges expired tokens only")
    void purge() {
        registry.issue("user-1", "old");
        clock.advance(Duration.ofMinutes(3));
        InsightToken fresh = registry.issue("user-1", "new");
        clock.advance(Duration.ofMinutes(3));

        assertThat(registry.purgeExpired()).isEqualTo(1);
        assertThat(registry.resolve(fresh.value())).isPresent();
    }

    @Test
    @DisplayName("requires a user and a request id")
    void requiresIds() {
        assertThatThrownBy(() -> registry.issue(" ", "req")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.issue("user", null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("never prints the token value")
    void masked() {
        InsightToken token = registry.issue("user-1", "req-1");

        assertThat(token.toString()).doesNotContain(token.value());
    }
}
