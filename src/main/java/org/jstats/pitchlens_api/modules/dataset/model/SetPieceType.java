package org.jstats.pitchlens_api.modules.dataset.model;

public enum SetPieceType {
    GOAL_KICK,
    FREE_KICK,
    THROW_IN,
    CORNER_KICK,
    PENALTY,
    KICK_OFF
}
