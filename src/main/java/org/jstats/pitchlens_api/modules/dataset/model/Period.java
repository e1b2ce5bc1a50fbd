package org.jstats.pitchlens_api.modules.dataset.model;

/**
 * @param id                 1-based period number
 * @param startTimestamp     start in seconds
 * @param endTimestamp       end in seconds
 * @param attackingDirection direction of play during this period
 */
public record Period(
        int id,
        double startTimestamp,
        double endTimestamp,
        AttackingDirection attackingDirection
) {
    public Period {
        if (attackingDirection == null) {
            attackingDirection = AttackingDirection.NOT_SET;
        }
    }
}
