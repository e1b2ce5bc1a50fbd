package org.jstats.pitchlens_api.modules.geometry.model;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * The playable rectangle in a coordinate system's units.
 *
 * @param x      bounds along the pitch length
 * @param y      bounds along the pitch width
 * @param length physical length in metres, when known
 * @param width  physical width in metres, when known
 */
public record PitchDimensions(Dimension x, Dimension y, @Nullable Double length, @Nullable Double width) {

    public PitchDimensions {
        Objects.requireNonNull(x, "x dimension");
        Objects.requireNonNull(y, "y dimension");
    }

    public static PitchDimensions of(double xMin, double xMax, double yMin, double yMax) {
        return new PitchDimensions(new Dimension(xMin, xMax), new Dimension(yMin, yMax), null, null);
    }

    public PitchDimensions withPhysicalSize(double length, double width) {
        return new PitchDimensions(x, y, length, width);
    }

    /**
     * Bounds equality; the informational physical size is ignored.
     */
    public boolean sameBounds(PitchDimensions other) {
        return x.equals(other.x) && y.equals(other.y);
    }
}
