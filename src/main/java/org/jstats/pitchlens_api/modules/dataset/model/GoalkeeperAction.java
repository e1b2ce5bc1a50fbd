package org.jstats.pitchlens_api.modules.dataset.model;

public enum GoalkeeperAction {
    REFLEX,
    SAVE_ATTEMPT
}
