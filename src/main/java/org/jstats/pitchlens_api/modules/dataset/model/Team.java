package org.jstats.pitchlens_api.modules.dataset.model;

import org.jspecify.annotations.Nullable;

/**
 * @param teamId            provider identifier
 * @param name              display name
 * @param ground            home or away
 * @param startingFormation formation at kick-off, when the provider reports it
 */
public record Team(
        String teamId,
        String name,
        Ground ground,
        @Nullable FormationType startingFormation
) {
    public Team(String teamId, String name, Ground ground) {
        this(teamId, name, ground, null);
    }

    @Override
    public String toString() {
        return name;
    }
}
