package org.jstats.pitchlens_api.modules.dataset.model;

import org.jspecify.annotations.Nullable;
import org.jstats.pitchlens_api.modules.geometry.model.CoordinateSystem;
import org.jstats.pitchlens_api.modules.orientation.model.Orientation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Dataset-level description shared by all records.
 *
 * @param provider         where the data came from
 * @param teams            participating teams
 * @param players          all players of both squads
 * @param periods          periods of the match in order
 * @param coordinateSystem coordinate system every record is expressed in
 * @param orientation      attacking-direction convention every record follows
 * @param frameRate        frames per second for tracking data
 */
public record Metadata(
        String provider,
        List<Team> teams,
        List<Player> players,
        List<Period> periods,
        CoordinateSystem coordinateSystem,
        Orientation orientation,
        @Nullable Double frameRate
) {
    public Metadata {
        Objects.requireNonNull(coordinateSystem, "coordinateSystem");
        Objects.requireNonNull(orientation, "orientation");
        teams = teams == null ? List.of() : List.copyOf(teams);
        players = players == null ? List.of() : List.copyOf(players);
        periods = periods == null ? List.of() : List.copyOf(periods);
    }

    public Optional<Team> team(Ground ground) {
        return teams.stream().filter(t -> t.ground() == ground).findFirst();
    }

    public Optional<Team> team(String teamId) {
        return teams.stream().filter(t -> t.teamId().equals(teamId)).findFirst();
    }

    public List<Player> startingPlayers() {
        return players.stream().filter(Player::starting).toList();
    }

    public Metadata withCoordinates(CoordinateSystem coordinateSystem, Orientation orientation) {
        return new Metadata(provider, teams, players, periods, coordinateSystem, orientation, frameRate);
    }
}
