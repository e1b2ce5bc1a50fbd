package org.jstats.pitchlens_api.modules.dataset.model;

import org.jstats.pitchlens_api.modules.geometry.model.Point;

import java.util.function.UnaryOperator;

public record PlayerOnEvent(EventHeader header) implements Event {

    @Override
    public EventType eventType() {
        return EventType.PLAYER_ON;
    }

    @Override
    public PlayerOnEvent withHeader(EventHeader header) {
        return new PlayerOnEvent(header);
    }

    @Override
    public PlayerOnEvent mapPoints(UnaryOperator<Point> mapper) {
        return new PlayerOnEvent(header.mapCoordinates(mapper));
    }
}
