package org.jstats.pitchlens_api.modules.dataset.model;

import org.jstats.pitchlens_api.modules.geometry.model.Point;

import java.util.function.UnaryOperator;

public record RecoveryEvent(EventHeader header) implements Event {

    @Override
    public EventType eventType() {
        return EventType.RECOVERY;
    }

    @Override
    public RecoveryEvent withHeader(EventHeader header) {
        return new RecoveryEvent(header);
    }

    @Override
    public RecoveryEvent mapPoints(UnaryOperator<Point> mapper) {
        return new RecoveryEvent(header.mapCoordinates(mapper));
    }
}
