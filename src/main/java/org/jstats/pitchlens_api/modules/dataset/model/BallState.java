package org.jstats.pitchlens_api.modules.dataset.model;

public enum BallState {
    ALIVE,
    DEAD
}
