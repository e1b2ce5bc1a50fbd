package org.jstats.pitchlens_api.modules.dataset.model;

import org.jspecify.annotations.Nullable;
import org.jstats.pitchlens_api.modules.geometry.model.Point;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A tracking snapshot of ball and player positions.
 *
 * @param frameId            provider frame number
 * @param period             period of the frame
 * @param timestamp          seconds since the start of the period
 * @param ballOwningTeam     team in possession, when known
 * @param ballState          whether the ball was in play
 * @param ballCoordinates    ball position, {@code null} when the ball was not tracked
 * @param playersCoordinates positions of the tracked players, keyed by player id
 * @param state              derived match state
 */
public record Frame(
        long frameId,
        Period period,
        double timestamp,
        @Nullable Team ballOwningTeam,
        @Nullable BallState ballState,
        @Nullable Point ballCoordinates,
        Map<String, Point> playersCoordinates,
        Map<String, Object> state
) implements DataRecord<Frame> {

    public Frame {
        Objects.requireNonNull(period, "period");
        playersCoordinates = playersCoordinates == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(playersCoordinates));
        state = state == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(state));
    }

    @Override
    public String recordId() {
        return Long.toString(frameId);
    }

    @Override
    public @Nullable Team team() {
        return null;
    }

    @Override
    public Frame withState(Map<String, Object> state) {
        return new Frame(frameId, period, timestamp, ballOwningTeam, ballState, ballCoordinates, playersCoordinates, state);
    }

    @Override
    public Frame mapPoints(UnaryOperator<Point> mapper) {
        var players = new LinkedHashMap<String, Point>(playersCoordinates.size() * 2);
        playersCoordinates.forEach((playerId, point) -> players.put(playerId, DataRecord.mapNullable(point, mapper)));
        return new Frame(frameId, period, timestamp, ballOwningTeam, ballState,
                DataRecord.mapNullable(ballCoordinates, mapper), players, state);
    }
}
