package org.jstats.pitchlens_api.modules.orientation.model;

import org.jspecify.annotations.Nullable;
import org.jstats.pitchlens_api.core.error.OrientationException;
import org.jstats.pitchlens_api.modules.dataset.model.AttackingDirection;
import org.jstats.pitchlens_api.modules.dataset.model.Ground;
import org.jstats.pitchlens_api.modules.dataset.model.Team;

/**
 * Convention fixing which team attacks towards increasing x.
 */
public enum Orientation {

    /** The team in possession plays left to right; flips whenever possession changes. */
    BALL_OWNING_TEAM,
    /** The team executing the action plays left to right. */
    ACTION_EXECUTING_TEAM,
    /** Home plays left to right in periods attacked HOME_AWAY, and switches with the period. */
    HOME_TEAM,
    /** Away plays left to right in periods attacked HOME_AWAY, and switches with the period. */
    AWAY_TEAM,
    /** Home plays left to right for the whole match. */
    FIXED_HOME_AWAY,
    /** Away plays left to right for the whole match. */
    FIXED_AWAY_HOME,
    NOT_SET;

    /**
     * Tells which side plays left to right for a record under this orientation.
     *
     * @return -1 when the home team attacks towards increasing x, 1 when the away team does
     * @throws OrientationException when the record lacks the context this orientation depends on
     */
    public int orientationFactor(@Nullable AttackingDirection attackingDirection,
                                 @Nullable Team ballOwningTeam,
                                 @Nullable Team actionExecutingTeam) {
        return switch (this) {
            case FIXED_HOME_AWAY -> -1;
            case FIXED_AWAY_HOME -> 1;
            case HOME_TEAM -> directionFactor(attackingDirection);
            case AWAY_TEAM -> -directionFactor(attackingDirection);
            case BALL_OWNING_TEAM -> groundFactor(ballOwningTeam, "ball-owning team");
            case ACTION_EXECUTING_TEAM -> groundFactor(actionExecutingTeam, "action-executing team");
            case NOT_SET -> throw new OrientationException("Orientation is not set");
        };
    }

    private static int directionFactor(@Nullable AttackingDirection direction) {
        if (direction == AttackingDirection.HOME_AWAY) return -1;
        if (direction == AttackingDirection.AWAY_HOME) return 1;
        throw new OrientationException("Attacking direction of the period is not set");
    }

    private static int groundFactor(@Nullable Team team, String role) {
        if (team == null) {
            throw new OrientationException("No " + role + " known");
        }
        return team.ground() == Ground.HOME ? -1 : 1;
    }
}
