package org.jstats.pitchlens_api.modules.dataset.model;

import org.jspecify.annotations.Nullable;
import org.jstats.pitchlens_api.modules.geometry.model.Point;

import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * One element of a dataset: an {@link Event} or a tracking {@link Frame}.
 * <p>
 * Records are immutable. {@link #withState} and {@link #mapPoints} return new instances.
 *
 * @param <R> the concrete record family
 */
public sealed interface DataRecord<R extends DataRecord<R>> permits Event, Frame {

    String recordId();

    Period period();

    /**
     * Seconds since the start of the period.
     */
    double timestamp();

    /**
     * The team executing the action, {@code null} when the record is not an action.
     */
    @Nullable Team team();

    @Nullable Team ballOwningTeam();

    @Nullable BallState ballState();

    /**
     * Derived match state keyed by state builder key. Read-only.
     */
    Map<String, Object> state();

    R withState(Map<String, Object> state);

    /**
     * Applies {@code mapper} to every known spatial attribute of this record. Unknown locations stay unknown.
     */
    R mapPoints(UnaryOperator<Point> mapper);

    static @Nullable Point mapNullable(@Nullable Point point, UnaryOperator<Point> mapper) {
        return point == null ? null : mapper.apply(point);
    }
}
