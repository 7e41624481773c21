package com.tessera.pipeline.notification;

import com.tessera.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Posts messages to the real-time service's room broadcast endpoint, {@code
 * /rooms/user_<userId>/broadcast} and, when the message carries a request id, {@code
 * /rooms/request_<requestId>/broadcast}.
 */
public class HttpRealtimeNotifier implements RealtimeNotifier {

    private static final Logger log = LoggerFactory.getLogger(HttpRealtimeNotifier.class);

    private final RestClient client;
    private final Counter failures;

    /**
     * @param builder client builder; its base URL is set to {@code realtimeUrl}
     * @param realtimeUrl base URL of the real-time service
     */
    public HttpRealtimeNotifier(RestClient.Builder builder, String realtimeUrl, MetricFactory metrics) {
        this.client = builder.baseUrl(realtimeUrl).build();
        this.failures =
                metrics.counter("notifications.failures", "Real-time pushes that could not be delivered");
    }

    @Override
    public NotificationOutcome notify(RealtimeMessage message) {
        List<String> rooms = new ArrayList<>(2);
        if (message.userId() != null) {
            rooms.add("user_" + message.userId());
        }
        if (message.requestId() != null) {
            rooms.add("request_" + message.requestId());
        }
        if (rooms.isEmpty()) {
            return NotificationOutcome.SKIPPED;
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", message.type());
        body.put("data", message.data());

        for (String room : rooms) {
            try {
                client.post()
                        .uri("/rooms/{room}/broadcast", room)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(body)
                        .retrieve()
                        .toBodilessEntity();
            } catch (RestClientException e) {
                failures.increment();
                log.warn("Real-time push of {} to {} failed: {}", message.type(), room, e.getMessage());
                return NotificationOutcome.FAILED;
            }
        }
        return NotificationOutcome.DELIVERED;
    }
}
