package org.jstats.pitchlens_api.modules.dataset.model;

import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * Tag of a qualifier. Flag kinds carry a boolean, the others a constant of {@link #valueType()}.
 */
public enum QualifierKind {
    SET_PIECE(SetPieceType.class),
    PASS(PassType.class),
    BODY_PART(BodyPart.class),
    CARD(CardType.class),
    GOALKEEPER_ACTION(GoalkeeperAction.class),
    COUNTER_ATTACK(null);

    private final @Nullable Class<? extends Enum<?>> valueType;

    QualifierKind(@Nullable Class<? extends Enum<?>> valueType) {
        this.valueType = valueType;
    }

    public @Nullable Class<? extends Enum<?>> valueType() {
        return valueType;
    }

    public boolean isFlag() {
        return valueType == null;
    }

    public String attributeName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
