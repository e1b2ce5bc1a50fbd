package org.jstats.pitchlens_api.modules.geometry.model;

/**
 * Which way the y-axis grows, independent of attacking direction.
 */
public enum VerticalOrientation {
    /** y grows from the top touchline downwards, as on a screen. */
    TOP_TO_BOTTOM,
    /** y grows from the bottom touchline upwards, as on a chart. */
    BOTTOM_TO_TOP
}
