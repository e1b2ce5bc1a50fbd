package org.jstats.pitchlens_api.modules.geometry.model;

/**
 * A location on the pitch in the units of the owning dataset's coordinate system.
 * An unknown location is represented by a {@code null} point, never by a sentinel value.
 *
 * @param x position along the length of the pitch
 * @param y position along the width of the pitch
 */
public record Point(double x, double y) {
}
