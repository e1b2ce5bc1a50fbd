package org.jstats.pitchlens_api.modules.geometry.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * How raw numbers map to physical pitch positions.
 * <p>
 * The provider name is a label only: two systems are equal when their pitch bounds, vertical
 * orientation and origin match, whichever provider they came from.
 */
public final class CoordinateSystem {

    private final String provider;
    private final PitchDimensions pitchDimensions;
    private final VerticalOrientation verticalOrientation;
    private final Origin origin;

    @JsonCreator
    public CoordinateSystem(
            @JsonProperty("provider") String provider,
            @JsonProperty("pitchDimensions") PitchDimensions pitchDimensions,
            @JsonProperty("verticalOrientation") VerticalOrientation verticalOrientation,
            @JsonProperty("origin") Origin origin) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.pitchDimensions = Objects.requireNonNull(pitchDimensions, "pitchDimensions");
        this.verticalOrientation = Objects.requireNonNull(verticalOrientation, "verticalOrientation");
        this.origin = Objects.requireNonNull(origin, "origin");
    }

    @JsonProperty
    public String provider() {
        return provider;
    }

    @JsonProperty
    public PitchDimensions pitchDimensions() {
        return pitchDimensions;
    }

    @JsonProperty
    public VerticalOrientation verticalOrientation() {
        return verticalOrientation;
    }

    @JsonProperty
    public Origin origin() {
        return origin;
    }

    public CoordinateSystem withPitchDimensions(PitchDimensions dimensions) {
        return new CoordinateSystem("custom", dimensions, verticalOrientation, origin);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CoordinateSystem that)) return false;
        return pitchDimensions.sameBounds(that.pitchDimensions)
                && verticalOrientation == that.verticalOrientation
                && origin == that.origin;
    }

    @Override
    public int hashCode() {
        return Objects.hash(pitchDimensions.x(), pitchDimensions.y(), verticalOrientation, origin);
    }

    @Override
    public String toString() {
        return "CoordinateSystem[%s x=[%s, %s] y=[%s, %s] %s %s]".formatted(
                provider,
                pitchDimensions.x().min(), pitchDimensions.x().max(),
                pitchDimensions.y().min(), pitchDimensions.y().max(),
                verticalOrientation, origin);
    }
}
