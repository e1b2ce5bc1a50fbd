package org.jstats.pitchlens_api.modules.dataset.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jstats.pitchlens_api.core.config.JacksonConfig;
import org.jstats.pitchlens_api.core.config.PitchLensConfig;
import org.jstats.pitchlens_api.modules.dataset.model.ShotResult;
import org.jstats.pitchlens_api.modules.dataset.model.SubstitutionEvent;
import org.jstats.pitchlens_api.modules.geometry.model.Point;
import org.jstats.pitchlens_api.modules.geometry.registry.CoordinateSystemRegistry;
import org.jstats.pitchlens_api.modules.orientation.OrientationResolver;
import org.jstats.pitchlens_api.modules.orientation.model.Orientation;
import org.jstats.pitchlens_api.modules.state.StateAnnotator;
import org.jstats.pitchlens_api.modules.transform.service.DatasetTransformer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItems;
import static org.jstats.pitchlens_api.support.TestDatasets.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DatasetController.class)
@Import({
        PitchLensConfig.class,
        JacksonConfig.class,
        CoordinateSystemRegistry.class,
        OrientationResolver.class,
        DatasetTransformer.class,
        StateAnnotator.class
})
class DatasetControllerTests {

    @Autowired
    MockMvc mvc;

    @Autowired
    ObjectMapper mapper;

    String threePasses() throws Exception {
        return mapper.writeValueAsString(events(
                pass("1", HOME, new Point(10, 40), null),
                pass("2", AWAY, new Point(60, 40), null),
                pass("3", HOME, new Point(110, 40), new Point(120, 0))));
    }

    @Test
    void transformEvents_toProvider() throws Exception {
        mvc.perform(post("/api/datasets/events/transform")
                        .param("coordinates", "kloppy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(threePasses()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metadata.coordinateSystem.provider").value("kloppy"))
                .andExpect(jsonPath("$.records[0].header.coordinates.x").value(closeTo(0.083, 1e-3)))
                .andExpect(jsonPath("$.records[1].header.coordinates.x").value(closeTo(0.5, 1e-9)))
                .andExpect(jsonPath("$.records[2].receiverCoordinates.x").value(closeTo(1.0, 1e-9)))
                .andExpect(jsonPath("$.records[2].eventType").value("PASS"));
    }

    @Test
    void transformEvents_toOrientationAndPitchBounds() throws Exception {
        mvc.perform(post("/api/datasets/events/transform")
                        .param("orientation", "BALL_OWNING_TEAM")
                        .param("xMin", "0").param("xMax", "105")
                        .param("yMin", "0").param("yMax", "68")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(threePasses()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metadata.orientation").value("BALL_OWNING_TEAM"))
                .andExpect(jsonPath("$.metadata.coordinateSystem.provider").value("custom"))
                .andExpect(jsonPath("$.records[0].header.coordinates.x").value(closeTo(8.75, 1e-9)))
                .andExpect(jsonPath("$.records[1].header.coordinates.x").value(closeTo(52.5, 1e-9)));
    }

    @Test
    void partialPitchBounds_isBadRequest() throws Exception {
        mvc.perform(post("/api/datasets/events/transform")
                        .param("xMin", "0").param("xMax", "105")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(threePasses()))
                .andExpect(status().isBadRequest())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
                .andExpect(jsonPath("$.title").value("Invalid Configuration"));
    }

    @Test
    void unknownProvider_isBadRequest() throws Exception {
        mvc.perform(post("/api/datasets/events/transform")
                        .param("coordinates", "acme")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(threePasses()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value(containsString("acme")));
    }

    @Test
    void unknownOrientation_isBadRequest() throws Exception {
        mvc.perform(post("/api/datasets/events/transform")
                        .param("orientation", "SIDEWAYS")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(threePasses()))
                .andExpect(status().isBadRequest());
    }

    @Test
    void missingBallOwner_isUnprocessable() throws Exception {
        var body = mapper.writeValueAsString(tracking(Orientation.BALL_OWNING_TEAM,
                frame(1, FIRST_HALF, HOME, new Point(1, 1), Map.of()),
                frame(2, FIRST_HALF, null, new Point(1, 1), Map.of())));

        mvc.perform(post("/api/datasets/tracking/transform")
                        .param("orientation", "FIXED_HOME_AWAY")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.title").value("Unresolvable Orientation"))
                .andExpect(jsonPath("$.recordId").value("2"));
    }

    @Test
    void transformTracking_mapsBallAndPlayers() throws Exception {
        var body = mapper.writeValueAsString(tracking(Orientation.HOME_TEAM,
                frame(1, SECOND_HALF, HOME, new Point(30, 20), Map.of(HOME_STRIKER.playerId(), new Point(0, 0)))));

        mvc.perform(post("/api/datasets/tracking/transform")
                        .param("orientation", "FIXED_HOME_AWAY")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.records[0].ballCoordinates.x").value(closeTo(90.0, 1e-9)))
                .andExpect(jsonPath("$.records[0].playersCoordinates['p-h9'].y").value(closeTo(80.0, 1e-9)));
    }

    @Test
    void addState_attachesScore() throws Exception {
        var body = mapper.writeValueAsString(events(
                pass("1", HOME, new Point(10, 40), null),
                shot("2", HOME, ShotResult.GOAL)));

        mvc.perform(post("/api/datasets/events/state")
                        .param("builders", "score,sequence")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.records[0].header.state.score.home").value(0))
                .andExpect(jsonPath("$.records[1].header.state.score.home").value(1))
                .andExpect(jsonPath("$.records[1].header.state.sequence.sequenceId").value(1));
    }

    @Test
    void addState_unknownBuilder_isBadRequest() throws Exception {
        mvc.perform(post("/api/datasets/events/state")
                        .param("builders", "score,xg")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(threePasses()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value(containsString("xg")));
    }

    @Test
    void addState_substitutionWithoutReplacement_isBadRequest() throws Exception {
        ObjectNode body = mapper.valueToTree(events(
                pass("1", HOME, new Point(10, 40), null),
                new SubstitutionEvent(header("2", SECOND_HALF, HOME, HOME_STRIKER, null), HOME_SUB)));
        ((ObjectNode) body.path("records").get(1)).remove("replacementPlayer");

        mvc.perform(post("/api/datasets/events/state")
                        .param("builders", "lineup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body.toString()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Bad Request"))
                .andExpect(jsonPath("$.detail").value(containsString("replacementPlayer")));
    }

    @Test
    void degenerateDimensionInBody_isBadRequest() throws Exception {
        var body = threePasses().replace("\"max\":120.0", "\"max\":0.0");

        mvc.perform(post("/api/datasets/events/transform")
                        .param("coordinates", "kloppy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest());
    }

    @Test
    void coordinateSystems_listsProviders() throws Exception {
        mvc.perform(get("/api/datasets/coordinate-systems"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").value(hasItems("statsbomb", "opta", "tracab")));
    }

    @Test
    void coordinateSystem_describesPhysicalProvider() throws Exception {
        mvc.perform(get("/api/datasets/coordinate-systems/tracab")
                        .param("pitchLength", "100")
                        .param("pitchWidth", "64"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pitchDimensions.x.min").value(closeTo(-5000.0, 1e-9)))
                .andExpect(jsonPath("$.verticalOrientation").value("BOTTOM_TO_TOP"))
                .andExpect(jsonPath("$.origin").value("CENTER"));
    }
}
