package org.jstats.pitchlens_api.modules.dataset.model;

import org.jspecify.annotations.Nullable;
import org.jstats.pitchlens_api.modules.geometry.model.Point;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Attributes every event carries, whatever its type.
 *
 * @param eventId         identifier given by the provider
 * @param period          period in which the event happened
 * @param timestamp       seconds since the start of the period
 * @param team            team executing the event
 * @param player          player executing the event
 * @param ballOwningTeam  team in possession at the time of the event
 * @param ballState       whether the ball was in play
 * @param coordinates     where the event happened, {@code null} when unknown
 * @param relatedEventIds identifiers of related events in the same dataset
 * @param qualifiers      extra information about the event
 * @param state           derived match state, see {@code StateAnnotator}
 */
public record EventHeader(
        String eventId,
        Period period,
        double timestamp,
        @Nullable Team team,
        @Nullable Player player,
        @Nullable Team ballOwningTeam,
        @Nullable BallState ballState,
        @Nullable Point coordinates,
        List<String> relatedEventIds,
        List<Qualifier> qualifiers,
        Map<String, Object> state
) {
    public EventHeader {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(period, "period");
        relatedEventIds = relatedEventIds == null ? List.of() : List.copyOf(relatedEventIds);
        qualifiers = qualifiers == null ? List.of() : List.copyOf(qualifiers);
        state = state == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(state));
    }

    public static EventHeader of(String eventId, Period period, double timestamp,
                                 @Nullable Team team, @Nullable Point coordinates) {
        return new EventHeader(eventId, period, timestamp, team, null, team, BallState.ALIVE, coordinates,
                List.of(), List.of(), Map.of());
    }

    public EventHeader withPlayer(@Nullable Player player) {
        return new EventHeader(eventId, period, timestamp, team, player, ballOwningTeam, ballState, coordinates,
                relatedEventIds, qualifiers, state);
    }

    public EventHeader withBallOwningTeam(@Nullable Team ballOwningTeam) {
        return new EventHeader(eventId, period, timestamp, team, player, ballOwningTeam, ballState, coordinates,
                relatedEventIds, qualifiers, state);
    }

    public EventHeader withRelatedEventIds(List<String> relatedEventIds) {
        return new EventHeader(eventId, period, timestamp, team, player, ballOwningTeam, ballState, coordinates,
                relatedEventIds, qualifiers, state);
    }

    public EventHeader withQualifiers(List<Qualifier> qualifiers) {
        return new EventHeader(eventId, period, timestamp, team, player, ballOwningTeam, ballState, coordinates,
                relatedEventIds, qualifiers, state);
    }

    public EventHeader withState(Map<String, Object> state) {
        return new EventHeader(eventId, period, timestamp, team, player, ballOwningTeam, ballState, coordinates,
                relatedEventIds, qualifiers, state);
    }

    public EventHeader mapCoordinates(UnaryOperator<Point> mapper) {
        return new EventHeader(eventId, period, timestamp, team, player, ballOwningTeam, ballState,
                DataRecord.mapNullable(coordinates, mapper), relatedEventIds, qualifiers, state);
    }
}
