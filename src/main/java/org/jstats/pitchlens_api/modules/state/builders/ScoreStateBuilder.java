package org.jstats.pitchlens_api.modules.state.builders;

import org.jstats.pitchlens_api.modules.dataset.model.DataRecord;
import org.jstats.pitchlens_api.modules.dataset.model.Metadata;
import org.jstats.pitchlens_api.modules.dataset.model.ShotEvent;
import org.jstats.pitchlens_api.modules.dataset.model.ShotResult;
import org.jstats.pitchlens_api.modules.state.StateBuilder;
import org.jstats.pitchlens_api.modules.state.model.Score;

/**
 * Running score. A goal is part of the score attached to the goal itself.
 */
public class ScoreStateBuilder implements StateBuilder<Score> {

    public static final String KEY = "score";

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public Score initialState(Metadata metadata) {
        return Score.ZERO;
    }

    @Override
    public Score reduceBefore(Score state, DataRecord<?> record) {
        if (!(record instanceof ShotEvent shot) || shot.team() == null) {
            return state;
        }
        var ground = shot.team().ground();
        if (shot.result() == ShotResult.GOAL) {
            return state.goalFor(ground);
        }
        if (shot.result() == ShotResult.OWN_GOAL) {
            return state.goalFor(ground.opponent());
        }
        return state;
    }
}
