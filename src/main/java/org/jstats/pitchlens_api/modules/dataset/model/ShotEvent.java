package org.jstats.pitchlens_api.modules.dataset.model;

import org.jspecify.annotations.Nullable;
import org.jstats.pitchlens_api.modules.geometry.model.Point;

import java.util.function.UnaryOperator;

/**
 * @param header            shared attributes; coordinates are where the shot was taken
 * @param result            outcome of the shot
 * @param resultCoordinates where the ball ended up
 */
public record ShotEvent(
        EventHeader header,
        @Nullable ShotResult result,
        @Nullable Point resultCoordinates
) implements Event {

    @Override
    public EventType eventType() {
        return EventType.SHOT;
    }

    @Override
    public ShotEvent withHeader(EventHeader header) {
        return new ShotEvent(header, result, resultCoordinates);
    }

    @Override
    public ShotEvent mapPoints(UnaryOperator<Point> mapper) {
        return new ShotEvent(header.mapCoordinates(mapper), result, DataRecord.mapNullable(resultCoordinates, mapper));
    }
}
