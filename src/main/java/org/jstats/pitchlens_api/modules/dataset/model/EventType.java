package org.jstats.pitchlens_api.modules.dataset.model;

import java.util.Locale;

public enum EventType {
    GENERIC,
    PASS,
    SHOT,
    TAKE_ON,
    CARRY,
    SUBSTITUTION,
    CARD,
    PLAYER_ON,
    PLAYER_OFF,
    RECOVERY,
    BALL_OUT,
    FOUL_COMMITTED,
    FORMATION_CHANGE;

    public String eventName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
