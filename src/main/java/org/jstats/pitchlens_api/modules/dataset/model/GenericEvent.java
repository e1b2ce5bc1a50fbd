package org.jstats.pitchlens_api.modules.dataset.model;

import org.jstats.pitchlens_api.modules.geometry.model.Point;

import java.util.function.UnaryOperator;

/**
 * An event the normalized vocabulary has no type for.
 *
 * @param header    shared attributes
 * @param eventName the provider's own name for the event
 */
public record GenericEvent(EventHeader header, String eventName) implements Event {

    @Override
    public EventType eventType() {
        return EventType.GENERIC;
    }

    @Override
    public GenericEvent withHeader(EventHeader header) {
        return new GenericEvent(header, eventName);
    }

    @Override
    public GenericEvent mapPoints(UnaryOperator<Point> mapper) {
        return new GenericEvent(header.mapCoordinates(mapper), eventName);
    }
}
