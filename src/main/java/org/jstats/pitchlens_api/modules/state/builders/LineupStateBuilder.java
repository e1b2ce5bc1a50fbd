package org.jstats.pitchlens_api.modules.state.builders;

import org.jstats.pitchlens_api.modules.dataset.model.CardEvent;
import org.jstats.pitchlens_api.modules.dataset.model.DataRecord;
import org.jstats.pitchlens_api.modules.dataset.model.Metadata;
import org.jstats.pitchlens_api.modules.dataset.model.PlayerOffEvent;
import org.jstats.pitchlens_api.modules.dataset.model.PlayerOnEvent;
import org.jstats.pitchlens_api.modules.dataset.model.SubstitutionEvent;
import org.jstats.pitchlens_api.modules.state.StateBuilder;
import org.jstats.pitchlens_api.modules.state.model.Lineup;

/**
 * Players on the pitch. Changes take effect after the event causing them, so a substitution
 * still lists the player going off.
 */
public class LineupStateBuilder implements StateBuilder<Lineup> {

    public static final String KEY = "lineup";

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public Lineup initialState(Metadata metadata) {
        return Lineup.of(metadata.startingPlayers());
    }

    @Override
    public Lineup reduceBefore(Lineup state, DataRecord<?> record) {
        return state;
    }

    @Override
    public Lineup reduceAfter(Lineup state, DataRecord<?> record) {
        if (record instanceof SubstitutionEvent substitution) {
            var next = substitution.player() != null ? state.remove(substitution.player()) : state;
            return next.add(substitution.replacementPlayer());
        }
        if (record instanceof PlayerOffEvent off && off.player() != null) {
            return state.remove(off.player());
        }
        if (record instanceof PlayerOnEvent on && on.player() != null) {
            return state.add(on.player());
        }
        if (record instanceof CardEvent card && card.cardType().sendsOff() && card.player() != null) {
            return state.remove(card.player());
        }
        return state;
    }
}
