package com.tessera.pipeline.notification;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A push to connected clients.
 *
 * @param userId room {@code user_<userId>} receives it
 * @param requestId room {@code request_<requestId>} also receives it when present
 * @param type message type, usually the event type
 * @param data message body
 */
public record RealtimeMessage(String userId, String requestId, String type, Map<String, Object> data) {

    public RealtimeMessage {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
