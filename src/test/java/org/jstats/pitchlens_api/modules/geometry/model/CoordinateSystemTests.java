package org.jstats.pitchlens_api.modules.geometry.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CoordinateSystemTests {

    @Test
    void equality_ignoresProviderLabelAndPhysicalSize() {
        var a = new CoordinateSystem("statsbomb", PitchDimensions.of(0, 120, 0, 80),
                VerticalOrientation.TOP_TO_BOTTOM, Origin.TOP_LEFT);
        var b = new CoordinateSystem("custom", PitchDimensions.of(0, 120, 0, 80).withPhysicalSize(105, 68),
                VerticalOrientation.TOP_TO_BOTTOM, Origin.TOP_LEFT);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void differentVerticalOrientation_isNotEqual() {
        var a = new CoordinateSystem("x", PitchDimensions.of(0, 100, 0, 100),
                VerticalOrientation.TOP_TO_BOTTOM, Origin.TOP_LEFT);
        var b = new CoordinateSystem("x", PitchDimensions.of(0, 100, 0, 100),
                VerticalOrientation.BOTTOM_TO_TOP, Origin.TOP_LEFT);

        assertNotEquals(a, b);
    }

    @Test
    void withPitchDimensions_keepsConventions() {
        var opta = new CoordinateSystem("opta", PitchDimensions.of(0, 100, 0, 100),
                VerticalOrientation.BOTTOM_TO_TOP, Origin.BOTTOM_LEFT);

        var custom = opta.withPitchDimensions(PitchDimensions.of(0, 105, 0, 68));

        assertEquals("custom", custom.provider());
        assertEquals(VerticalOrientation.BOTTOM_TO_TOP, custom.verticalOrientation());
        assertEquals(Origin.BOTTOM_LEFT, custom.origin());
        assertEquals(105, custom.pitchDimensions().x().max());
    }
}
