package org.jstats.pitchlens_api.modules.dataset.model;

public enum TakeOnResult implements ResultType {
    COMPLETE,
    INCOMPLETE,
    OUT;

    @Override
    public boolean isSuccess() {
        return this == COMPLETE;
    }
}
