package com.tessera.eventmodel;

import com.tessera.eventmodel.payload.EventPayload;
import java.util.ArrayList;

/**
 * Structural checks on an {@link EventEnvelope}. Payload checks live in {@link SchemaRegistry}.
 * A missing {@code userId} is not a structural error: the permission governor records it as a
 * denial so the attempt stays in the audit trail.
 *
 * <p>WHY manual validation over Bean Validation: returns all errors at once in a {@link
 * ValidationResult} and keeps the event model free of annotation processing.
 */
public final class EventValidator {

    private EventValidator() {
        // utility class
    }

    public static ValidationResult validate(EventEnvelope event) {
        var errors = new ArrayList<String>();

        if (event.id() == null) {
            errors.add("id must not be null");
        }
        if (event.type() == null) {
            errors.add("type must not be null");
        }
        if (isBlank(event.subjectId())) {
            errors.add("subjectId must not be null or blank");
        }
        if (event.source() == null) {
            errors.add("source must not be null");
        }
        if (event.timestamp() == null) {
            errors.add("timestamp must not be null");
        }
        if (isBlank(event.correlationId())) {
            errors.add("correlationId must not be null or blank");
        }
        EventPayload data = event.data();
        if (data == null) {
            errors.add("data must not be null");
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
