package com.tessera.pipeline.dispatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tessera.eventmodel.EventTypeName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("EventTypePattern")
class EventTypePatternTest {

    @ParameterizedTest(name = "{0} vs {1} -> {2}")
    @CsvSource({
        "entities.create.validated, entities.create.validated, true",
        "entities.create.validated, entities.update.validated, false",
        "*.*.requested, documents.delete.requested, true",
        "*.*.requested, documents.delete.denied, false",
        "entities.*.validated, entities.delete.validated, true",
        "entities.*.validated, documents.delete.validated, false",
        "*, threads.merge.completed, true"
    })
    void matches(String pattern, String type, boolean expected) {
        assertThat(EventTypePattern.parse(pattern).matches(EventTypeName.parse(type))).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "entities", "entities.create", "a.b.c.d", "entities..validated"})
    void rejectsMalformed(String pattern) {
        assertThatThrownBy(() -> EventTypePattern.parse(pattern))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
