package org.jstats.pitchlens_api.modules.dataset.model;

public enum CarryResult implements ResultType {
    COMPLETE,
    INCOMPLETE;

    @Override
    public boolean isSuccess() {
        return this == COMPLETE;
    }
}
