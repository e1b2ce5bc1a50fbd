package org.jstats.pitchlens_api.modules.state.builders;

import org.jstats.pitchlens_api.modules.dataset.model.DataRecord;
import org.jstats.pitchlens_api.modules.dataset.model.FormationChangeEvent;
import org.jstats.pitchlens_api.modules.dataset.model.FormationType;
import org.jstats.pitchlens_api.modules.dataset.model.Ground;
import org.jstats.pitchlens_api.modules.dataset.model.Metadata;
import org.jstats.pitchlens_api.modules.dataset.model.Team;
import org.jstats.pitchlens_api.modules.state.StateBuilder;
import org.jstats.pitchlens_api.modules.state.model.Formation;

public class FormationStateBuilder implements StateBuilder<Formation> {

    public static final String KEY = "formation";

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public Formation initialState(Metadata metadata) {
        return new Formation(startingFormation(metadata, Ground.HOME), startingFormation(metadata, Ground.AWAY));
    }

    @Override
    public Formation reduceBefore(Formation state, DataRecord<?> record) {
        if (record instanceof FormationChangeEvent change && change.team() != null) {
            return state.with(change.team().ground(), change.formationType());
        }
        return state;
    }

    private static FormationType startingFormation(Metadata metadata, Ground ground) {
        return metadata.team(ground)
                .map(Team::startingFormation)
                .orElse(FormationType.UNKNOWN);
    }
}
