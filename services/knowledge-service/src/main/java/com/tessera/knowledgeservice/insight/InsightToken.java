package com.tessera.knowledgeservice.insight;

import java.time.Instant;

/**
 * A short-lived credential an intelligence service uses to submit insights for one request.
 *
 * @param value opaque bearer value
 * @param userId user the insights act for
 * @param requestId request the insights answer; submissions must carry it as correlation id
 * @param expiresAt end of validity
 */
public record InsightToken(String value, String userId, String requestId, Instant expiresAt) {

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "InsightToken[****, userId=" + userId + ", requestId=" + requestId + "]";
    }
}
