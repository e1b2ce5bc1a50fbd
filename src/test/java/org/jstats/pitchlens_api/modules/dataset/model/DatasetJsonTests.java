package org.jstats.pitchlens_api.modules.dataset.model;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jstats.pitchlens_api.core.config.JacksonConfig;
import org.jstats.pitchlens_api.modules.geometry.model.Point;
import org.jstats.pitchlens_api.modules.orientation.model.Orientation;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.json.JsonTest;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.Map;

import static org.jstats.pitchlens_api.support.TestDatasets.*;
import static org.junit.jupiter.api.Assertions.*;

@JsonTest
@Import(JacksonConfig.class)
class DatasetJsonTests {

    @Autowired
    ObjectMapper mapper;

    @Test
    void eventDataset_survivesJsonWithEveryEventType() throws Exception {
        var corner = new EnumQualifier(QualifierKind.SET_PIECE, SetPieceType.CORNER_KICK);
        var counter = new FlagQualifier(QualifierKind.COUNTER_ATTACK, true);
        var dataset = events(
                new GenericEvent(EventHeader.of("0", FIRST_HALF, 0, null, null), "kick-off whistle"),
                new PassEvent(header("1", FIRST_HALF, HOME, HOME_KEEPER, new Point(5, 40))
                        .withQualifiers(List.of(corner, counter)), PassResult.COMPLETE, 2.5, HOME_STRIKER, new Point(60, 30)),
                new CarryEvent(header("2", FIRST_HALF, HOME, HOME_STRIKER, new Point(60, 30)),
                        CarryResult.COMPLETE, 4.0, new Point(75, 30)),
                new TakeOnEvent(header("3", FIRST_HALF, HOME, HOME_STRIKER, new Point(75, 30)), TakeOnResult.INCOMPLETE),
                new RecoveryEvent(header("4", FIRST_HALF, AWAY, AWAY_DEFENDER, new Point(76, 31))),
                new FoulCommittedEvent(header("5", FIRST_HALF, AWAY, AWAY_DEFENDER, new Point(76, 31))),
                new CardEvent(header("6", FIRST_HALF, AWAY, AWAY_DEFENDER, null), CardType.FIRST_YELLOW),
                new ShotEvent(header("7", FIRST_HALF, HOME, HOME_STRIKER, new Point(100, 40))
                        .withRelatedEventIds(List.of("1")), ShotResult.POST, new Point(120, 36)),
                new BallOutEvent(EventHeader.of("8", FIRST_HALF, 9, null, new Point(120, 36))),
                new SubstitutionEvent(header("9", SECOND_HALF, HOME, HOME_STRIKER, null), HOME_SUB),
                new PlayerOffEvent(header("10", SECOND_HALF, AWAY, AWAY_KEEPER, null)),
                new PlayerOnEvent(header("11", SECOND_HALF, AWAY, AWAY_SUB, null)),
                new FormationChangeEvent(EventHeader.of("12", SECOND_HALF, 70, AWAY, null), FormationType.F_3_5_2));

        var json = mapper.writeValueAsString(dataset);
        var read = mapper.readValue(json, EventDataset.class);

        assertEquals(dataset.records(), read.records());
        assertEquals(dataset.metadata(), read.metadata());
        assertTrue(json.contains("\"eventType\":\"FORMATION_CHANGE\""));
    }

    @Test
    void trackingDataset_survivesJson() throws Exception {
        var dataset = tracking(Orientation.BALL_OWNING_TEAM,
                frame(1, FIRST_HALF, HOME, new Point(60, 40), Map.of(HOME_STRIKER.playerId(), new Point(61, 40))),
                frame(2, FIRST_HALF, null, null, Map.of()));

        var read = mapper.readValue(mapper.writeValueAsString(dataset), TrackingDataset.class);

        assertEquals(dataset.frames(), read.frames());
        assertNull(read.frames().get(1).ballCoordinates());
    }

    @Test
    void substitutionWithoutReplacement_isRejected() {
        var dataset = events(new SubstitutionEvent(header("1", SECOND_HALF, HOME, HOME_STRIKER, null), HOME_SUB));
        ObjectNode tree = mapper.valueToTree(dataset);
        ((ObjectNode) tree.path("records").get(0)).remove("replacementPlayer");

        assertThrows(JsonMappingException.class, () -> mapper.readValue(tree.toString(), EventDataset.class));
        assertThrows(NullPointerException.class,
                () -> new SubstitutionEvent(header("1", SECOND_HALF, HOME, HOME_STRIKER, null), null));
    }

    @Test
    void cardWithoutCardType_isRejected() {
        var dataset = events(new CardEvent(header("1", FIRST_HALF, AWAY, AWAY_DEFENDER, null), CardType.RED));
        ObjectNode tree = mapper.valueToTree(dataset);
        ((ObjectNode) tree.path("records").get(0)).remove("cardType");

        assertThrows(JsonMappingException.class, () -> mapper.readValue(tree.toString(), EventDataset.class));
    }

    @Test
    void enumQualifier_resolvesValueByName() throws Exception {
        var qualifier = mapper.readValue("""
                {"type":"enum","kind":"SET_PIECE","value":"CORNER_KICK"}
                """, Qualifier.class);

        assertEquals(new EnumQualifier(QualifierKind.SET_PIECE, SetPieceType.CORNER_KICK), qualifier);
        assertThrows(JsonMappingException.class, () -> mapper.readValue("""
                {"type":"enum","kind":"SET_PIECE","value":"DROP_GOAL"}
                """, Qualifier.class));
    }

    @Test
    void unknownFormationLabel_fallsBackToUnknown() throws Exception {
        var team = mapper.readValue("""
                {"teamId":"t","name":"T","ground":"HOME","startingFormation":"F_9_0_1"}
                """, Team.class);

        assertEquals(FormationType.UNKNOWN, team.startingFormation());
    }
}
