package org.jstats.pitchlens_api.modules.orientation;

import org.jspecify.annotations.NullMarked;
import org.jstats.pitchlens_api.core.error.ConfigurationException;
import org.jstats.pitchlens_api.core.error.OrientationException;
import org.jstats.pitchlens_api.modules.dataset.model.DataRecord;
import org.jstats.pitchlens_api.modules.geometry.model.CoordinateSystem;
import org.jstats.pitchlens_api.modules.orientation.model.Orientation;
import org.springframework.stereotype.Component;

/**
 * Decides, per record, whether reaching a target orientation and coordinate system requires a reflection.
 * <p>
 * Stateless: a decision depends only on the two conventions and the record's own context.
 */
@Component
@NullMarked
public class OrientationResolver {

    /**
     * Rejects orientation pairs no record could ever be resolved for. Called once before a transform starts.
     *
     * @throws ConfigurationException when exactly one side is {@link Orientation#NOT_SET}
     */
    public void validate(Orientation from, Orientation to) {
        if (from == to) {
            return;
        }
        if (from == Orientation.NOT_SET) {
            throw new ConfigurationException("Cannot transform to %s: dataset orientation is not set".formatted(to));
        }
        if (to == Orientation.NOT_SET) {
            throw new ConfigurationException("Cannot transform to an unset orientation");
        }
    }

    /**
     * Whether the attacking direction of {@code record} differs between the two orientations.
     *
     * @throws OrientationException when an orientation needs context the record does not carry
     */
    public boolean needsFlip(Orientation from, Orientation to, DataRecord<?> record) {
        if (from == to) {
            return false;
        }
        try {
            var attackingDirection = record.period().attackingDirection();
            int fromFactor = from.orientationFactor(attackingDirection, record.ballOwningTeam(), record.team());
            int toFactor = to.orientationFactor(attackingDirection, record.ballOwningTeam(), record.team());
            return fromFactor != toFactor;
        } catch (OrientationException ex) {
            throw new OrientationException(
                    "Cannot resolve %s -> %s: %s".formatted(from, to, ex.getMessage()), record.recordId(), ex);
        }
    }

    public boolean needsVerticalFlip(CoordinateSystem from, CoordinateSystem to) {
        return from.verticalOrientation() != to.verticalOrientation();
    }
}
