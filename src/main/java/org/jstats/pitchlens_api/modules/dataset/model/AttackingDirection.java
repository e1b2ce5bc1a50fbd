package org.jstats.pitchlens_api.modules.dataset.model;

/**
 * Physical direction of play during a period, as reported by the provider.
 */
public enum AttackingDirection {
    /** Home attacks towards increasing x. */
    HOME_AWAY,
    /** Away attacks towards increasing x. */
    AWAY_HOME,
    NOT_SET
}
