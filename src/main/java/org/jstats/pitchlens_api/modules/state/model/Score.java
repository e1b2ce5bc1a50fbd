package org.jstats.pitchlens_api.modules.state.model;

import org.jstats.pitchlens_api.modules.dataset.model.Ground;

/**
 * Running score.
 *
 * @param home goals of the home team
 * @param away goals of the away team
 */
public record Score(int home, int away) {

    public static final Score ZERO = new Score(0, 0);

    public Score goalFor(Ground ground) {
        return ground == Ground.HOME ? new Score(home + 1, away) : new Score(home, away + 1);
    }

    @Override
    public String toString() {
        return home + "-" + away;
    }
}
