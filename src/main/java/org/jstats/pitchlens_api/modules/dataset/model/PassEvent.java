package org.jstats.pitchlens_api.modules.dataset.model;

import org.jspecify.annotations.Nullable;
import org.jstats.pitchlens_api.modules.geometry.model.Point;

import java.util.function.UnaryOperator;

/**
 * @param header              shared attributes; coordinates are where the pass started
 * @param result              outcome of the pass
 * @param receiveTimestamp    when the ball arrived, seconds since period start
 * @param receiverPlayer      intended or actual receiver
 * @param receiverCoordinates where the ball arrived
 */
public record PassEvent(
        EventHeader header,
        @Nullable PassResult result,
        @Nullable Double receiveTimestamp,
        @Nullable Player receiverPlayer,
        @Nullable Point receiverCoordinates
) implements Event {

    @Override
    public EventType eventType() {
        return EventType.PASS;
    }

    @Override
    public PassEvent withHeader(EventHeader header) {
        return new PassEvent(header, result, receiveTimestamp, receiverPlayer, receiverCoordinates);
    }

    @Override
    public PassEvent mapPoints(UnaryOperator<Point> mapper) {
        return new PassEvent(header.mapCoordinates(mapper), result, receiveTimestamp, receiverPlayer,
                DataRecord.mapNullable(receiverCoordinates, mapper));
    }
}
