package org.jstats.pitchlens_api.modules.state.model;

import org.jstats.pitchlens_api.modules.dataset.model.Player;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Players on the pitch.
 */
public record Lineup(Set<Player> players) {

    public Lineup {
        players = Set.copyOf(players);
    }

    public static Lineup of(Collection<Player> players) {
        return new Lineup(Set.copyOf(players));
    }

    public boolean contains(Player player) {
        return players.contains(player);
    }

    public Lineup add(Player player) {
        var next = new HashSet<>(players);
        next.add(player);
        return new Lineup(next);
    }

    public Lineup remove(Player player) {
        var next = new HashSet<>(players);
        next.remove(player);
        return new Lineup(next);
    }
}
