package org.jstats.pitchlens_api.modules.state.builders;

import org.jstats.pitchlens_api.modules.dataset.model.BallOutEvent;
import org.jstats.pitchlens_api.modules.dataset.model.CarryEvent;
import org.jstats.pitchlens_api.modules.dataset.model.DataRecord;
import org.jstats.pitchlens_api.modules.dataset.model.Event;
import org.jstats.pitchlens_api.modules.dataset.model.FoulCommittedEvent;
import org.jstats.pitchlens_api.modules.dataset.model.Metadata;
import org.jstats.pitchlens_api.modules.dataset.model.PassEvent;
import org.jstats.pitchlens_api.modules.dataset.model.RecoveryEvent;
import org.jstats.pitchlens_api.modules.dataset.model.ShotEvent;
import org.jstats.pitchlens_api.modules.state.StateBuilder;
import org.jstats.pitchlens_api.modules.state.model.Sequence;

import java.util.Objects;

/**
 * Numbers phases of play. A pass, carry or recovery opens a new sequence when another team
 * takes over or play restarts from a set piece; a ball out, foul or shot closes the sequence
 * once the event itself has been attributed to it.
 */
public class SequenceStateBuilder implements StateBuilder<Sequence> {

    public static final String KEY = "sequence";

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public Sequence initialState(Metadata metadata) {
        return new Sequence(0, null);
    }

    @Override
    public Sequence reduceBefore(Sequence state, DataRecord<?> record) {
        if (record instanceof Event event && opensSequence(event)
                && (!Objects.equals(state.team(), event.team()) || event.setPieceType().isPresent())) {
            return state.next(event.team());
        }
        return state;
    }

    @Override
    public Sequence reduceAfter(Sequence state, DataRecord<?> record) {
        if (record instanceof Event event && closesSequence(event)) {
            return state.close();
        }
        return state;
    }

    private static boolean opensSequence(Event event) {
        return event instanceof PassEvent || event instanceof CarryEvent || event instanceof RecoveryEvent;
    }

    private static boolean closesSequence(Event event) {
        return event instanceof BallOutEvent || event instanceof FoulCommittedEvent || event instanceof ShotEvent;
    }
}
