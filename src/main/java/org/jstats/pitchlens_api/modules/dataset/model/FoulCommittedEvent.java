package org.jstats.pitchlens_api.modules.dataset.model;

import org.jstats.pitchlens_api.modules.geometry.model.Point;

import java.util.function.UnaryOperator;

public record FoulCommittedEvent(EventHeader header) implements Event {

    @Override
    public EventType eventType() {
        return EventType.FOUL_COMMITTED;
    }

    @Override
    public FoulCommittedEvent withHeader(EventHeader header) {
        return new FoulCommittedEvent(header);
    }

    @Override
    public FoulCommittedEvent mapPoints(UnaryOperator<Point> mapper) {
        return new FoulCommittedEvent(header.mapCoordinates(mapper));
    }
}
