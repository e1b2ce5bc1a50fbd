package org.jstats.pitchlens_api.modules.dataset.model;

public enum Ground {
    HOME,
    AWAY;

    public Ground opponent() {
        return this == HOME ? AWAY : HOME;
    }
}
