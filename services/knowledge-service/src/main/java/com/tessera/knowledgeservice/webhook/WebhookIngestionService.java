package com.tessera.knowledgeservice.webhook;

import com.tessera.eventmodel.EventInput;
import com.tessera.eventmodel.EventSource;
import com.tessera.eventmodel.EventTypeName;
import com.tessera.eventmodel.SchemaValidationException;
import com.tessera.knowledgeservice.config.WebhookProperties;
import com.tessera.observability.MetricFactory;
import com.tessera.observability.SensitiveDataRedactor;
import com.tessera.pipeline.publish.CommandSubmitter;
import com.tessera.pipeline.publish.SubmissionReceipt;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns a batch of externally produced items into {@code AUTOMATION} commands.
 *
 * <p>Items are independent: each gets its own correlation id, and a malformed item is reported in
 * its result without affecting the rest of the batch.
 */
@Service
public class WebhookIngestionService {

    private static final Logger log = LoggerFactory.getLogger(WebhookIngestionService.class);

    private final CommandSubmitter submitter;
    private final WebhookProperties properties;
    private final MetricFactory metrics;
    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    public WebhookIngestionService(
            CommandSubmitter submitter, WebhookProperties properties, MetricFactory metrics) {
        this.submitter = submitter;
        this.properties = properties;
        this.metrics = metrics;
    }

    /** One item of a webhook batch. */
    public record WebhookItem(
            String type, String subjectId, String subjectType, Map<String, Object> data) {}

    /**
     * @throws IllegalArgumentException when the batch is empty or larger than the configured maximum
     */
    public List<WebhookItemResult> ingest(String userId, List<WebhookItem> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("Webhook batch must contain at least one item");
        }
        if (items.size() > properties.maxItems()) {
            throw new IllegalArgumentException(
                    "Webhook batch of "
                            + items.size()
                            + " items exceeds the limit of "
                            + properties.maxItems());
        }

        List<WebhookItemResult> results = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            WebhookItemResult result = ingestOne(i, userId, items.get(i));
            metrics.counter("webhooks.items", "Webhook items received", "status", result.status())
                    .increment();
            results.add(result);
        }
        long accepted =
                results.stream().filter(r -> WebhookItemResult.ACCEPTED.equals(r.status())).count();
        log.info("Webhook batch from {}: {} of {} items accepted", userId, accepted, items.size());
        return results;
    }

    private WebhookItemResult ingestOne(int index, String userId, WebhookItem item) {
        if (item == null) {
            return WebhookItemResult.rejected(index, "item must not be null");
        }
        Optional<EventTypeName> type = EventTypeName.tryParse(item.type());
        if (type.isEmpty()) {
            return WebhookItemResult.rejected(index, "malformed event type: " + item.type());
        }
        EventInput input =
                EventInput.of(type.get(), userId, item.data() == null ? Map.of() : item.data())
                        .withSubject(item.subjectId(), item.subjectType())
                        .withSource(EventSource.AUTOMATION);
        try {
            SubmissionReceipt receipt = submitter.submit(input);
            return WebhookItemResult.accepted(index, receipt.id());
        } catch (SchemaValidationException | IllegalArgumentException e) {
            log.warn(
                    "Webhook item {} rejected: {} (data={})",
                    index,
                    e.getMessage(),
                    redactor.redact(input.data()));
            return WebhookItemResult.rejected(index, e.getMessage());
        }
    }
}
