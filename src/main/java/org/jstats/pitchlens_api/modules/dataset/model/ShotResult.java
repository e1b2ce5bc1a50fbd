package org.jstats.pitchlens_api.modules.dataset.model;

public enum ShotResult implements ResultType {
    GOAL,
    OFF_TARGET,
    POST,
    BLOCKED,
    SAVED,
    OWN_GOAL;

    @Override
    public boolean isSuccess() {
        return this == GOAL;
    }
}
