package com.tessera.knowledgeservice.insight;

import com.tessera.knowledgeservice.infrastructure.web.RequestHeaders;
import com.tessera.knowledgeservice.infrastructure.web.UnauthorizedException;
import com.tessera.security.BearerToken;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Insight submission by external intelligence services. */
@RestController
@RequestMapping("/api/v1/insights")
public class InsightController {

    private final InsightTokenRegistry tokens;
    private final InsightService insights;

    public InsightController(InsightTokenRegistry tokens, InsightService insights) {
        this.tokens = tokens;
        this.insights = insights;
    }

    public record TokenRequest(@NotBlank String requestId) {}

    public record TokenResponse(String token, String requestId, Instant expiresAt) {}

    /** Issues a token scoped to one request of the calling user. */
    @PostMapping("/tokens")
    @ResponseStatus(HttpStatus.CREATED)
    public TokenResponse issueToken(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @Valid @RequestBody TokenRequest request) {
        InsightToken token = tokens.issue(userId, request.requestId());
        return new TokenResponse(token.value(), token.requestId(), token.expiresAt());
    }

    @PostMapping
    public InsightResult submit(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody InsightSubmission insight) {
        InsightToken token =
                BearerToken.fromHeader(authorization)
                        .flatMap(bearer -> tokens.resolve(bearer.value()))
                        .orElseThrow(
                                () -> new UnauthorizedException("Missing, unknown or expired insight token"));
        return insights.submit(token, insight);
    }
}
