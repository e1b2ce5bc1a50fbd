package org.jstats.pitchlens_api.modules.dataset.model;

import org.jstats.pitchlens_api.modules.geometry.model.Point;

import java.util.function.UnaryOperator;

public record BallOutEvent(EventHeader header) implements Event {

    @Override
    public EventType eventType() {
        return EventType.BALL_OUT;
    }

    @Override
    public BallOutEvent withHeader(EventHeader header) {
        return new BallOutEvent(header);
    }

    @Override
    public BallOutEvent mapPoints(UnaryOperator<Point> mapper) {
        return new BallOutEvent(header.mapCoordinates(mapper));
    }
}
