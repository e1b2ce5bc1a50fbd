package org.jstats.pitchlens_api.modules.dataset.model;

import org.jstats.pitchlens_api.modules.geometry.model.Point;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * The header's player leaves the pitch, {@code replacementPlayer} comes on.
 */
public record SubstitutionEvent(EventHeader header, Player replacementPlayer) implements Event {

    public SubstitutionEvent {
        Objects.requireNonNull(replacementPlayer, "replacementPlayer");
    }

    @Override
    public EventType eventType() {
        return EventType.SUBSTITUTION;
    }

    @Override
    public SubstitutionEvent withHeader(EventHeader header) {
        return new SubstitutionEvent(header, replacementPlayer);
    }

    @Override
    public SubstitutionEvent mapPoints(UnaryOperator<Point> mapper) {
        return new SubstitutionEvent(header.mapCoordinates(mapper), replacementPlayer);
    }
}
