package org.jstats.pitchlens_api.support;

import org.jstats.pitchlens_api.modules.dataset.model.AttackingDirection;
import org.jstats.pitchlens_api.modules.dataset.model.BallState;
import org.jstats.pitchlens_api.modules.dataset.model.Event;
import org.jstats.pitchlens_api.modules.dataset.model.EventDataset;
import org.jstats.pitchlens_api.modules.dataset.model.EventHeader;
import org.jstats.pitchlens_api.modules.dataset.model.FormationType;
import org.jstats.pitchlens_api.modules.dataset.model.Frame;
import org.jstats.pitchlens_api.modules.dataset.model.Ground;
import org.jstats.pitchlens_api.modules.dataset.model.Metadata;
import org.jstats.pitchlens_api.modules.dataset.model.PassEvent;
import org.jstats.pitchlens_api.modules.dataset.model.PassResult;
import org.jstats.pitchlens_api.modules.dataset.model.Period;
import org.jstats.pitchlens_api.modules.dataset.model.Player;
import org.jstats.pitchlens_api.modules.dataset.model.ShotEvent;
import org.jstats.pitchlens_api.modules.dataset.model.ShotResult;
import org.jstats.pitchlens_api.modules.dataset.model.Team;
import org.jstats.pitchlens_api.modules.dataset.model.TrackingDataset;
import org.jstats.pitchlens_api.modules.geometry.model.CoordinateSystem;
import org.jstats.pitchlens_api.modules.geometry.model.Point;
import org.jstats.pitchlens_api.modules.geometry.registry.CoordinateSystemRegistry;
import org.jstats.pitchlens_api.modules.orientation.model.Orientation;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Small hand-made match used across tests: statsbomb coordinates (120 x 80), home attacking
 * left to right in the first half.
 */
public final class TestDatasets {

    public static final Team HOME = new Team("t-home", "Home FC", Ground.HOME, FormationType.F_4_4_2);
    public static final Team AWAY = new Team("t-away", "Away United", Ground.AWAY, FormationType.F_4_3_3);

    public static final Player HOME_KEEPER = new Player("p-h1", HOME.teamId(), "Home Keeper", 1, true);
    public static final Player HOME_STRIKER = new Player("p-h9", HOME.teamId(), "Home Striker", 9, true);
    public static final Player HOME_SUB = new Player("p-h12", HOME.teamId(), "Home Sub", 12, false);
    public static final Player AWAY_KEEPER = new Player("p-a1", AWAY.teamId(), "Away Keeper", 1, true);
    public static final Player AWAY_DEFENDER = new Player("p-a4", AWAY.teamId(), "Away Defender", 4, true);
    public static final Player AWAY_SUB = new Player("p-a14", AWAY.teamId(), "Away Sub", 14, false);

    public static final Period FIRST_HALF = new Period(1, 0, 2700, AttackingDirection.HOME_AWAY);
    public static final Period SECOND_HALF = new Period(2, 0, 2700, AttackingDirection.AWAY_HOME);
    public static final Period UNKNOWN_DIRECTION = new Period(1, 0, 2700, AttackingDirection.NOT_SET);

    private TestDatasets() {
    }

    public static CoordinateSystem statsbomb() {
        return CoordinateSystemRegistry.withDefaults().forProvider("statsbomb");
    }

    public static CoordinateSystem kloppy() {
        return CoordinateSystemRegistry.withDefaults().forProvider("kloppy");
    }

    public static Metadata metadata(CoordinateSystem coordinateSystem, Orientation orientation) {
        return new Metadata("test", List.of(HOME, AWAY),
                List.of(HOME_KEEPER, HOME_STRIKER, HOME_SUB, AWAY_KEEPER, AWAY_DEFENDER, AWAY_SUB),
                List.of(FIRST_HALF, SECOND_HALF), coordinateSystem, orientation, null);
    }

    public static Metadata metadata() {
        return metadata(statsbomb(), Orientation.HOME_TEAM);
    }

    public static EventDataset events(Event... events) {
        return new EventDataset(metadata(), Arrays.asList(events));
    }

    public static EventDataset events(Metadata metadata, Event... events) {
        return new EventDataset(metadata, Arrays.asList(events));
    }

    public static EventHeader header(String id, Period period, Team team, Player player, Point coordinates) {
        return EventHeader.of(id, period, 10, team, coordinates).withPlayer(player);
    }

    public static PassEvent pass(String id, Team team, Point from, Point to) {
        return pass(id, FIRST_HALF, team, from, to);
    }

    public static PassEvent pass(String id, Period period, Team team, Point from, Point to) {
        var player = team == HOME ? HOME_STRIKER : AWAY_DEFENDER;
        return new PassEvent(header(id, period, team, player, from), PassResult.COMPLETE, 11.0, null, to);
    }

    public static ShotEvent shot(String id, Team team, ShotResult result) {
        var player = team == HOME ? HOME_STRIKER : AWAY_DEFENDER;
        return new ShotEvent(header(id, FIRST_HALF, team, player, new Point(100, 40)), result, null);
    }

    public static Frame frame(long frameId, Period period, Team ballOwner, Point ball, Map<String, Point> players) {
        return new Frame(frameId, period, frameId * 0.04, ballOwner, BallState.ALIVE, ball, players, Map.of());
    }

    public static TrackingDataset tracking(Orientation orientation, Frame... frames) {
        return new TrackingDataset(metadata(statsbomb(), orientation), Arrays.asList(frames));
    }
}
