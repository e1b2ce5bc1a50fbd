package org.jstats.pitchlens_api.modules.dataset.model;

import org.jstats.pitchlens_api.modules.geometry.model.Point;

import java.util.function.UnaryOperator;

public record PlayerOffEvent(EventHeader header) implements Event {

    @Override
    public EventType eventType() {
        return EventType.PLAYER_OFF;
    }

    @Override
    public PlayerOffEvent withHeader(EventHeader header) {
        return new PlayerOffEvent(header);
    }

    @Override
    public PlayerOffEvent mapPoints(UnaryOperator<Point> mapper) {
        return new PlayerOffEvent(header.mapCoordinates(mapper));
    }
}
