package org.jstats.pitchlens_api.modules.dataset.model;

import org.jspecify.annotations.Nullable;
import org.jstats.pitchlens_api.modules.geometry.model.Point;

import java.util.function.UnaryOperator;

/**
 * @param header         shared attributes; coordinates are where the carry started
 * @param result         outcome of the carry
 * @param endTimestamp   when the carry ended, seconds since period start
 * @param endCoordinates where the carry ended
 */
public record CarryEvent(
        EventHeader header,
        @Nullable CarryResult result,
        @Nullable Double endTimestamp,
        @Nullable Point endCoordinates
) implements Event {

    @Override
    public EventType eventType() {
        return EventType.CARRY;
    }

    @Override
    public CarryEvent withHeader(EventHeader header) {
        return new CarryEvent(header, result, endTimestamp, endCoordinates);
    }

    @Override
    public CarryEvent mapPoints(UnaryOperator<Point> mapper) {
        return new CarryEvent(header.mapCoordinates(mapper), result, endTimestamp,
                DataRecord.mapNullable(endCoordinates, mapper));
    }
}
