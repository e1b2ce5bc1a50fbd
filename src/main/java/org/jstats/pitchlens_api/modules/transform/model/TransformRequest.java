package org.jstats.pitchlens_api.modules.transform.model;

import org.jspecify.annotations.Nullable;
import org.jstats.pitchlens_api.modules.geometry.model.CoordinateSystem;
import org.jstats.pitchlens_api.modules.geometry.model.PitchDimensions;
import org.jstats.pitchlens_api.modules.orientation.model.Orientation;

/**
 * Target of a transform. At least one target must be given; a coordinate system and a pitch
 * dimensions override exclude each other.
 *
 * @param toCoordinateSystem target coordinate system
 * @param toOrientation      target orientation, keeps the dataset's orientation when {@code null}
 * @param toPitchDimensions  only rescale to these bounds, keeping the vertical orientation and origin
 */
public record TransformRequest(
        @Nullable CoordinateSystem toCoordinateSystem,
        @Nullable Orientation toOrientation,
        @Nullable PitchDimensions toPitchDimensions
) {
    public static TransformRequest to(CoordinateSystem coordinateSystem) {
        return new TransformRequest(coordinateSystem, null, null);
    }

    public static TransformRequest to(Orientation orientation) {
        return new TransformRequest(null, orientation, null);
    }

    public static TransformRequest to(CoordinateSystem coordinateSystem, Orientation orientation) {
        return new TransformRequest(coordinateSystem, orientation, null);
    }

    public static TransformRequest rescale(PitchDimensions pitchDimensions) {
        return new TransformRequest(null, null, pitchDimensions);
    }

    public boolean isEmpty() {
        return toCoordinateSystem == null && toOrientation == null && toPitchDimensions == null;
    }
}
