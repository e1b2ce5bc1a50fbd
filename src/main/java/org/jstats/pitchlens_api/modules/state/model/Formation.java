package org.jstats.pitchlens_api.modules.state.model;

import org.jstats.pitchlens_api.modules.dataset.model.FormationType;
import org.jstats.pitchlens_api.modules.dataset.model.Ground;

/**
 * Current formation of both teams.
 */
public record Formation(FormationType home, FormationType away) {

    public Formation with(Ground ground, FormationType formation) {
        return ground == Ground.HOME ? new Formation(formation, away) : new Formation(home, formation);
    }
}
