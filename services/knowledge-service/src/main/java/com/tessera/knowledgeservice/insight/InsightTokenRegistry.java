package com.tessera.knowledgeservice.insight;

import com.tessera.knowledgeservice.config.PipelineProperties;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Issues and resolves {@link InsightToken}s. Tokens live in memory and expire after a fixed TTL. */
@Component
public class InsightTokenRegistry {

    private static final Logger log = LoggerFactory.getLogger(InsightTokenRegistry.class);

    private static final int TOKEN_BYTES = 32;

    private final Map<String, InsightToken> tokens = new ConcurrentHashMap<>();
    private final SecureRandom random = new SecureRandom();
    private final Clock clock;
    private final Duration ttl;

    @Autowired
    public InsightTokenRegistry(Clock clock, PipelineProperties properties) {
        this(clock, properties.insightTokenTtl());
    }

    InsightTokenRegistry(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    public InsightToken issue(String userId, String requestId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be null or blank");
        }
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        String value = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        var token = new InsightToken(value, userId, requestId, clock.instant().plus(ttl));
        tokens.put(value, token);
        log.info(
                "Issued insight token for request {} (user {}) until {}",
                requestId,
                userId,
                token.expiresAt());
        return token;
    }

    /** The live token with this value; expired tokens are dropped on lookup. */
    public Optional<InsightToken> resolve(String value) {
        if (value == null) {
            return Optional.empty();
        }
        InsightToken token = tokens.get(value);
        if (token == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (token.isExpiredAt(now)) {
            tokens.remove(value, token);
            return Optional.empty();
        }
        return Optional.of(token);
    }

    /** Drops expired tokens. */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = tokens.size();
        tokens.values().removeIf(t -> t.isExpiredAt(now));
        return before - tokens.size();
    }
}
