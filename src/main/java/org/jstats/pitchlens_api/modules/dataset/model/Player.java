package org.jstats.pitchlens_api.modules.dataset.model;

import org.jspecify.annotations.Nullable;

/**
 * @param playerId provider identifier
 * @param teamId   identifier of the player's team
 * @param name     display name
 * @param jerseyNo shirt number, when known
 * @param starting whether the player is in the starting eleven
 */
public record Player(
        String playerId,
        String teamId,
        String name,
        @Nullable Integer jerseyNo,
        boolean starting
) {
    @Override
    public String toString() {
        return name;
    }
}
