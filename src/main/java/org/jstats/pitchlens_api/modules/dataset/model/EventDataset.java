package org.jstats.pitchlens_api.modules.dataset.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jstats.pitchlens_api.core.error.OrphanedRecordException;

import java.util.List;
import java.util.Optional;

public final class EventDataset extends Dataset<Event, EventDataset> {

    @JsonCreator
    public EventDataset(@JsonProperty("metadata") Metadata metadata,
                        @JsonProperty("records") List<Event> records) {
        super(metadata, records);
    }

    @Override
    public EventDataset withRecords(Metadata metadata, List<Event> records) {
        return new EventDataset(metadata, records);
    }

    @Override
    protected EventDataset self() {
        return this;
    }

    public List<Event> events() {
        return records();
    }

    public Optional<Event> findEventById(String eventId) {
        return findRecordById(eventId);
    }

    /**
     * Resolves the related event ids of {@code event} through this dataset's index.
     *
     * @throws OrphanedRecordException when {@code event} does not belong to this dataset, or one of its
     *                                 related ids is not in it
     */
    public List<Event> getRelatedEvents(Event event) {
        if (!isAttached(event)) {
            throw OrphanedRecordException.detached(event.eventId());
        }
        return event.relatedEventIds().stream()
                .map(id -> findEventById(id)
                        .orElseThrow(() -> OrphanedRecordException.unknownReference(event.eventId(), id)))
                .toList();
    }

    public Optional<Event> getRelatedEvent(Event event, EventType type) {
        return getRelatedEvents(event).stream()
                .filter(related -> related.eventType() == type)
                .findFirst();
    }

    public <E extends Event> Optional<E> getRelatedEvent(Event event, Class<E> type) {
        return getRelatedEvents(event).stream()
                .filter(type::isInstance)
                .map(type::cast)
                .findFirst();
    }
}
