package com.tessera.knowledgeservice.webhook;

import com.tessera.knowledgeservice.config.WebhookProperties;
import com.tessera.knowledgeservice.infrastructure.web.RequestHeaders;
import com.tessera.knowledgeservice.infrastructure.web.UnauthorizedException;
import com.tessera.security.BearerToken;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Batch ingestion for automation tools, authenticated by a shared secret. */
@RestController
@RequestMapping("/api/v1/webhooks")
public class WebhookController {

    private final WebhookIngestionService ingestion;
    private final WebhookProperties properties;

    public WebhookController(WebhookIngestionService ingestion, WebhookProperties properties) {
        this.ingestion = ingestion;
        this.properties = properties;
    }

    public record IngestRequest(List<WebhookIngestionService.WebhookItem> items) {}

    @PostMapping("/ingest")
    public Map<String, Object> ingest(
            @RequestHeader(value = RequestHeaders.WEBHOOK_SECRET, required = false) String secret,
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestBody IngestRequest request) {
        if (!BearerToken.secretsEqual(secret, properties.secret())) {
            throw new UnauthorizedException("Invalid webhook secret");
        }
        List<WebhookItemResult> results = ingestion.ingest(userId, request.items());
        return Map.of("results", results);
    }
}
