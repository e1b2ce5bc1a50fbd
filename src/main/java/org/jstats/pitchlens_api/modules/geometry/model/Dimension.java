package org.jstats.pitchlens_api.modules.geometry.model;

import org.jstats.pitchlens_api.core.error.ConfigurationException;

/**
 * Closed interval of one pitch axis.
 *
 * @param min lower bound
 * @param max upper bound, strictly greater than {@code min}
 */
public record Dimension(double min, double max) {

    public Dimension {
        if (!Double.isFinite(min) || !Double.isFinite(max)) {
            throw new ConfigurationException("Dimension bounds must be finite, got [%s, %s]".formatted(min, max));
        }
        if (max <= min) {
            throw new ConfigurationException("Dimension must satisfy min < max, got [%s, %s]".formatted(min, max));
        }
    }

    public double length() {
        return max - min;
    }

    /**
     * Reflects {@code value} about the midpoint of this interval.
     */
    public double reflect(double value) {
        return min + max - value;
    }

    /**
     * Position of {@code value} in this interval as a fraction; 0 at {@code min}, 1 at {@code max}.
     */
    public double toUnit(double value) {
        return (value - min) / length();
    }

    public double fromUnit(double fraction) {
        return min + fraction * length();
    }
}
