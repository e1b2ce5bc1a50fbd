package org.jstats.pitchlens_api.modules.dataset.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.jspecify.annotations.Nullable;
import org.jstats.pitchlens_api.modules.geometry.model.Point;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An on-ball action or match incident. Each event type is its own record carrying only the
 * attributes relevant to it; the shared attributes live in the {@link EventHeader}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "eventType")
@JsonSubTypes({
        @JsonSubTypes.Type(value = GenericEvent.class, name = "GENERIC"),
        @JsonSubTypes.Type(value = PassEvent.class, name = "PASS"),
        @JsonSubTypes.Type(value = ShotEvent.class, name = "SHOT"),
        @JsonSubTypes.Type(value = TakeOnEvent.class, name = "TAKE_ON"),
        @JsonSubTypes.Type(value = CarryEvent.class, name = "CARRY"),
        @JsonSubTypes.Type(value = SubstitutionEvent.class, name = "SUBSTITUTION"),
        @JsonSubTypes.Type(value = CardEvent.class, name = "CARD"),
        @JsonSubTypes.Type(value = PlayerOnEvent.class, name = "PLAYER_ON"),
        @JsonSubTypes.Type(value = PlayerOffEvent.class, name = "PLAYER_OFF"),
        @JsonSubTypes.Type(value = RecoveryEvent.class, name = "RECOVERY"),
        @JsonSubTypes.Type(value = BallOutEvent.class, name = "BALL_OUT"),
        @JsonSubTypes.Type(value = FoulCommittedEvent.class, name = "FOUL_COMMITTED"),
        @JsonSubTypes.Type(value = FormationChangeEvent.class, name = "FORMATION_CHANGE")
})
public sealed interface Event extends DataRecord<Event> permits GenericEvent, PassEvent, ShotEvent, TakeOnEvent,
        CarryEvent, SubstitutionEvent, CardEvent, PlayerOnEvent, PlayerOffEvent, RecoveryEvent, BallOutEvent,
        FoulCommittedEvent, FormationChangeEvent {

    EventHeader header();

    EventType eventType();

    Event withHeader(EventHeader header);

    default String eventName() {
        return eventType().eventName();
    }

    /**
     * Outcome of the event, {@code null} for event types without one or when the provider did not report it.
     */
    default @Nullable ResultType result() {
        return null;
    }

    default String eventId() {
        return header().eventId();
    }

    @Override
    default String recordId() {
        return header().eventId();
    }

    @Override
    default Period period() {
        return header().period();
    }

    @Override
    default double timestamp() {
        return header().timestamp();
    }

    @Override
    default @Nullable Team team() {
        return header().team();
    }

    default @Nullable Player player() {
        return header().player();
    }

    @Override
    default @Nullable Team ballOwningTeam() {
        return header().ballOwningTeam();
    }

    @Override
    default @Nullable BallState ballState() {
        return header().ballState();
    }

    default @Nullable Point coordinates() {
        return header().coordinates();
    }

    default List<String> relatedEventIds() {
        return header().relatedEventIds();
    }

    default List<Qualifier> qualifiers() {
        return header().qualifiers();
    }

    @Override
    default Map<String, Object> state() {
        return header().state();
    }

    @Override
    default Event withState(Map<String, Object> state) {
        return withHeader(header().withState(state));
    }

    /**
     * Value of the first enum qualifier of the given kind.
     */
    default <E extends Enum<E>> Optional<E> qualifierValue(QualifierKind kind, Class<E> type) {
        return qualifiers().stream()
                .filter(q -> q.kind() == kind)
                .filter(EnumQualifier.class::isInstance)
                .map(q -> ((EnumQualifier) q).value())
                .filter(type::isInstance)
                .map(type::cast)
                .findFirst();
    }

    default boolean hasFlag(QualifierKind kind) {
        return qualifiers().stream()
                .anyMatch(q -> q instanceof FlagQualifier flag && flag.kind() == kind && flag.value());
    }

    default Optional<SetPieceType> setPieceType() {
        return qualifierValue(QualifierKind.SET_PIECE, SetPieceType.class);
    }
}
