package org.jstats.pitchlens_api.modules.state;

import org.jstats.pitchlens_api.modules.dataset.model.DataRecord;
import org.jstats.pitchlens_api.modules.dataset.model.Metadata;

/**
 * Folds an ordered record sequence into a per-record state snapshot.
 * <p>
 * Implementations hold no state of their own: the running value is threaded through the reduce
 * methods by {@link StateAnnotator}, and must be immutable since it is attached to records as is.
 *
 * @param <S> state value type
 */
public interface StateBuilder<S> {

    /**
     * Key the state is attached under in every record's state map.
     */
    String key();

    S initialState(Metadata metadata);

    /**
     * Applies the effect of {@code record} that the record itself should already see,
     * like the goal counted in the score attached to the goal.
     */
    S reduceBefore(S state, DataRecord<?> record);

    /**
     * Applies the effect of {@code record} that only later records should see,
     * like a substituted player leaving the lineup after the substitution.
     */
    default S reduceAfter(S state, DataRecord<?> record) {
        return state;
    }
}
