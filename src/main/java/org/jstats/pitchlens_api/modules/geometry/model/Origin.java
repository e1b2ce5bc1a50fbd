package org.jstats.pitchlens_api.modules.geometry.model;

public enum Origin {
    TOP_LEFT,
    BOTTOM_LEFT,
    CENTER
}
