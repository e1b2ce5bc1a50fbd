package org.jstats.pitchlens_api.modules.dataset.model;

public enum BodyPart {
    RIGHT_FOOT,
    LEFT_FOOT,
    HEAD,
    // goalkeeper only
    BOTH_HANDS,
    CHEST,
    LEFT_HAND,
    RIGHT_HAND,
    DROP_KICK,
    KEEPER_ARM,
    OTHER,
    // dummy: the player let the ball run through on purpose
    NO_TOUCH
}
