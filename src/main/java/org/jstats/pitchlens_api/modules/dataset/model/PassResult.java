package org.jstats.pitchlens_api.modules.dataset.model;

public enum PassResult implements ResultType {
    COMPLETE,
    INCOMPLETE,
    OUT,
    OFFSIDE;

    @Override
    public boolean isSuccess() {
        return this == COMPLETE;
    }
}
