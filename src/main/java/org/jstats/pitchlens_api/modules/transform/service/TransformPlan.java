package org.jstats.pitchlens_api.modules.transform.service;

import org.jstats.pitchlens_api.modules.dataset.model.DataRecord;
import org.jstats.pitchlens_api.modules.geometry.model.CoordinateSystem;
import org.jstats.pitchlens_api.modules.geometry.model.Dimension;
import org.jstats.pitchlens_api.modules.geometry.model.Point;
import org.jstats.pitchlens_api.modules.orientation.MirrorDecision;
import org.jstats.pitchlens_api.modules.orientation.OrientationResolver;
import org.jstats.pitchlens_api.modules.orientation.model.Orientation;

/**
 * A validated, immutable mapping from one coordinate system and orientation to another.
 * <p>
 * {@link #apply} depends on nothing but its argument, so records can be mapped in any order or concurrently.
 */
public final class TransformPlan {

    private final CoordinateSystem fromSystem;
    private final CoordinateSystem toSystem;
    private final Orientation fromOrientation;
    private final Orientation toOrientation;
    private final OrientationResolver resolver;
    private final boolean rescale;
    private final boolean verticalFlip;

    TransformPlan(CoordinateSystem fromSystem,
                  CoordinateSystem toSystem,
                  Orientation fromOrientation,
                  Orientation toOrientation,
                  OrientationResolver resolver) {
        this.fromSystem = fromSystem;
        this.toSystem = toSystem;
        this.fromOrientation = fromOrientation;
        this.toOrientation = toOrientation;
        this.resolver = resolver;
        this.rescale = !fromSystem.pitchDimensions().sameBounds(toSystem.pitchDimensions());
        this.verticalFlip = resolver.needsVerticalFlip(fromSystem, toSystem);
    }

    public CoordinateSystem fromSystem() {
        return fromSystem;
    }

    public CoordinateSystem toSystem() {
        return toSystem;
    }

    public Orientation fromOrientation() {
        return fromOrientation;
    }

    public Orientation toOrientation() {
        return toOrientation;
    }

    /**
     * Whether no record can change under this plan.
     */
    public boolean isIdentity() {
        return !rescale && !verticalFlip && fromOrientation == toOrientation;
    }

    public <R extends DataRecord<R>> R apply(R record) {
        if (isIdentity()) {
            return record;
        }
        var decision = new MirrorDecision(resolver.needsFlip(fromOrientation, toOrientation, record), verticalFlip);
        if (!decision.any() && !rescale) {
            return record;
        }
        // one decision for every point of the record: a pass start and end must move together
        return record.mapPoints(point -> map(point, decision));
    }

    /**
     * Reflect about the source pitch, rescale into the target bounds, then apply the target's y convention.
     */
    public Point map(Point point, MirrorDecision decision) {
        Dimension fromX = fromSystem.pitchDimensions().x();
        Dimension fromY = fromSystem.pitchDimensions().y();
        Dimension toX = toSystem.pitchDimensions().x();
        Dimension toY = toSystem.pitchDimensions().y();

        double x = point.x();
        double y = point.y();
        if (decision.flip()) {
            x = fromX.reflect(x);
            y = fromY.reflect(y);
        }
        if (rescale) {
            x = toX.fromUnit(fromX.toUnit(x));
            y = toY.fromUnit(fromY.toUnit(y));
        }
        if (decision.verticalFlip()) {
            y = toY.reflect(y);
        }
        return new Point(x, y);
    }

    @Override
    public String toString() {
        return "TransformPlan[%s/%s -> %s/%s]".formatted(fromSystem, fromOrientation, toSystem, toOrientation);
    }
}
