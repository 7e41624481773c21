package com.tessera.eventmodel;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.eventmodel.payload.EventPayload;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link PayloadSchema} backed by a payload record. Unknown fields are rejected, field types are
 * enforced by Jackson and the record's own {@code violations()} supplies the semantic checks.
 */
public final class RecordPayloadSchema<T extends EventPayload> implements PayloadSchema<T> {

    // unknown fields are reported by parse() itself so that all of them show up at once
    private static final ObjectMapper CONVERTER =
            EventSerializer.objectMapper()
                    .copy()
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS);

    private final Class<T> payloadType;
    private final Set<String> fields;

    private RecordPayloadSchema(Class<T> payloadType) {
        if (!payloadType.isRecord()) {
            throw new IllegalArgumentException(payloadType.getName() + " is not a record");
        }
        this.payloadType = payloadType;
        this.fields =
                Arrays.stream(payloadType.getRecordComponents())
                        .map(RecordComponent::getName)
                        .collect(Collectors.toUnmodifiableSet());
    }

    public static <T extends EventPayload> RecordPayloadSchema<T> of(Class<T> payloadType) {
        return new RecordPayloadSchema<>(payloadType);
    }

    @Override
    public Class<T> payloadType() {
        return payloadType;
    }

    @Override
    public T parse(String eventType, Map<String, Object> raw) {
        var errors = new ArrayList<String>();
        Map<String, Object> data = raw == null ? Map.of() : raw;

        data.keySet().stream()
                .filter(key -> !fields.contains(key))
                .sorted()
                .forEach(key -> errors.add("unknown field: " + key));

        T payload = null;
        try {
            payload = CONVERTER.convertValue(data, payloadType);
        } catch (IllegalArgumentException e) {
            errors.add("malformed data: " + rootMessage(e));
        }
        if (payload != null) {
            errors.addAll(payload.violations());
        }
        if (!errors.isEmpty()) {
            throw new SchemaValidationException(eventType, errors);
        }
        return payload;
    }

    /** Lenient conversion used when restoring stored events: no field or semantic checks. */
    T restore(Map<String, Object> raw) {
        return CONVERTER.convertValue(raw == null ? Map.of() : raw, payloadType);
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        String message = root.getMessage();
        int newline = message == null ? -1 : message.indexOf('\n');
        return newline < 0 ? String.valueOf(message) : message.substring(0, newline);
    }

    @Override
    public String toString() {
        return "RecordPayloadSchema[" + payloadType.getSimpleName() + "]";
    }
}
