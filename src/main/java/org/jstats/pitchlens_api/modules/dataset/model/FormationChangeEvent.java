package org.jstats.pitchlens_api.modules.dataset.model;

import org.jstats.pitchlens_api.modules.geometry.model.Point;

import java.util.function.UnaryOperator;

/**
 * The header's team switches to {@code formationType}.
 */
public record FormationChangeEvent(EventHeader header, FormationType formationType) implements Event {

    @Override
    public EventType eventType() {
        return EventType.FORMATION_CHANGE;
    }

    @Override
    public FormationChangeEvent withHeader(EventHeader header) {
        return new FormationChangeEvent(header, formationType);
    }

    @Override
    public FormationChangeEvent mapPoints(UnaryOperator<Point> mapper) {
        return new FormationChangeEvent(header.mapCoordinates(mapper), formationType);
    }
}
