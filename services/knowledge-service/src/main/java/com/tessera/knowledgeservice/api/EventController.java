package com.tessera.knowledgeservice.api;

import com.tessera.eventstore.EventStore;
import com.tessera.eventstore.UnknownEventException;
import java.util.List;
import java.util.UUID;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Read access to the event log. */
@RestController
@RequestMapping("/api/v1")
public class EventController {

    private final EventStore events;

    public EventController(EventStore events) {
        this.events = events;
    }

    @GetMapping("/events/{id}")
    public EventView event(@PathVariable UUID id) {
        return events.findById(id).map(EventView::of).orElseThrow(() -> new UnknownEventException(id));
    }

    /** The aggregate's stream, version order. Unknown aggregates have an empty stream. */
    @GetMapping("/aggregates/{subjectId}/events")
    public List<EventView> aggregate(@PathVariable String subjectId) {
        return events.getAggregateStream(subjectId).stream().map(EventView::of).toList();
    }

    @GetMapping("/correlations/{correlationId}/events")
    public List<EventView> correlated(@PathVariable String correlationId) {
        return events.getCorrelatedEvents(correlationId).stream().map(EventView::of).toList();
    }
}
