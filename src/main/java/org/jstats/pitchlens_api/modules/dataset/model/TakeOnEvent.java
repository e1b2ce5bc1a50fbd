package org.jstats.pitchlens_api.modules.dataset.model;

import org.jspecify.annotations.Nullable;
import org.jstats.pitchlens_api.modules.geometry.model.Point;

import java.util.function.UnaryOperator;

public record TakeOnEvent(EventHeader header, @Nullable TakeOnResult result) implements Event {

    @Override
    public EventType eventType() {
        return EventType.TAKE_ON;
    }

    @Override
    public TakeOnEvent withHeader(EventHeader header) {
        return new TakeOnEvent(header, result);
    }

    @Override
    public TakeOnEvent mapPoints(UnaryOperator<Point> mapper) {
        return new TakeOnEvent(header.mapCoordinates(mapper), result);
    }
}
