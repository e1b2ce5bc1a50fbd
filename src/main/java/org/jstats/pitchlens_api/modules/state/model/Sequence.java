package org.jstats.pitchlens_api.modules.state.model;

import org.jspecify.annotations.Nullable;
import org.jstats.pitchlens_api.modules.dataset.model.Team;

/**
 * A phase of uninterrupted play by one team.
 *
 * @param sequenceId increasing sequence number, 0 before the first sequence
 * @param team       team in control of the sequence, {@code null} between sequences
 */
public record Sequence(int sequenceId, @Nullable Team team) {

    public Sequence next(@Nullable Team team) {
        return new Sequence(sequenceId + 1, team);
    }

    /**
     * Ends the sequence; the next one to open takes the following id.
     */
    public Sequence close() {
        return new Sequence(sequenceId, null);
    }
}
