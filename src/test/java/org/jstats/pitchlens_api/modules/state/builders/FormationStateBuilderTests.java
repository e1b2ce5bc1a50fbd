package org.jstats.pitchlens_api.modules.state.builders;

import org.jstats.pitchlens_api.modules.dataset.model.EventHeader;
import org.jstats.pitchlens_api.modules.dataset.model.FormationChangeEvent;
import org.jstats.pitchlens_api.modules.dataset.model.FormationType;
import org.jstats.pitchlens_api.modules.dataset.model.Metadata;
import org.jstats.pitchlens_api.modules.dataset.model.Team;
import org.jstats.pitchlens_api.modules.dataset.model.Ground;
import org.jstats.pitchlens_api.modules.state.StateBuilderRegistry;
import org.jstats.pitchlens_api.modules.state.model.Formation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.jstats.pitchlens_api.support.TestDatasets.*;
import static org.junit.jupiter.api.Assertions.*;

class FormationStateBuilderTests {

    @Test
    void formationChangeIsVisibleOnTheChangeItself() {
        var dataset = events(
                pass("1", HOME, null, null),
                new FormationChangeEvent(EventHeader.of("2", FIRST_HALF, 60, AWAY, null), FormationType.F_5_4_1),
                pass("3", HOME, null, null));

        var result = dataset.addState(StateBuilderRegistry.defaults(), FormationStateBuilder.KEY);

        assertEquals(new Formation(FormationType.F_4_4_2, FormationType.F_4_3_3), result.get(0).state().get("formation"));
        assertEquals(new Formation(FormationType.F_4_4_2, FormationType.F_5_4_1), result.get(1).state().get("formation"));
        assertEquals(new Formation(FormationType.F_4_4_2, FormationType.F_5_4_1), result.get(2).state().get("formation"));
    }

    @Test
    void unknownStartingFormation_isUnknown() {
        var metadata = metadata();
        var withoutFormations = new Metadata(metadata.provider(),
                List.of(new Team("h", "H", Ground.HOME), new Team("a", "A", Ground.AWAY)),
                metadata.players(), metadata.periods(), metadata.coordinateSystem(), metadata.orientation(), null);

        var result = events(withoutFormations, pass("1", HOME, null, null))
                .addState(StateBuilderRegistry.defaults(), FormationStateBuilder.KEY);

        assertEquals(new Formation(FormationType.UNKNOWN, FormationType.UNKNOWN), result.get(0).state().get("formation"));
    }
}
