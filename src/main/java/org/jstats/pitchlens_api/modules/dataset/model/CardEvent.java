package org.jstats.pitchlens_api.modules.dataset.model;

import org.jstats.pitchlens_api.modules.geometry.model.Point;

import java.util.Objects;
import java.util.function.UnaryOperator;

public record CardEvent(EventHeader header, CardType cardType) implements Event {

    public CardEvent {
        Objects.requireNonNull(cardType, "cardType");
    }

    @Override
    public EventType eventType() {
        return EventType.CARD;
    }

    @Override
    public CardEvent withHeader(EventHeader header) {
        return new CardEvent(header, cardType);
    }

    @Override
    public CardEvent mapPoints(UnaryOperator<Point> mapper) {
        return new CardEvent(header.mapCoordinates(mapper), cardType);
    }
}
