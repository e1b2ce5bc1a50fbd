package org.jstats.pitchlens_api.modules.geometry.registry;

import org.jstats.pitchlens_api.modules.geometry.model.CoordinateSystem;
import org.jstats.pitchlens_api.modules.geometry.model.Origin;
import org.jstats.pitchlens_api.modules.geometry.model.PitchDimensions;
import org.jstats.pitchlens_api.modules.geometry.model.VerticalOrientation;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.function.BiFunction;

import static org.jstats.pitchlens_api.modules.geometry.model.Origin.BOTTOM_LEFT;
import static org.jstats.pitchlens_api.modules.geometry.model.Origin.CENTER;
import static org.jstats.pitchlens_api.modules.geometry.model.Origin.TOP_LEFT;
import static org.jstats.pitchlens_api.modules.geometry.model.VerticalOrientation.BOTTOM_TO_TOP;
import static org.jstats.pitchlens_api.modules.geometry.model.VerticalOrientation.TOP_TO_BOTTOM;

/**
 * Coordinate conventions of the data providers we know about.
 * Providers measuring in physical units need the pitch length and width (metres).
 */
public enum Provider {

    KLOPPY("kloppy", TOP_TO_BOTTOM, TOP_LEFT, false, (l, w) -> PitchDimensions.of(0, 1, 0, 1)),
    METRICA("metrica", TOP_TO_BOTTOM, TOP_LEFT, false, (l, w) -> PitchDimensions.of(0, 1, 0, 1)),
    STATSBOMB("statsbomb", TOP_TO_BOTTOM, TOP_LEFT, false, (l, w) -> PitchDimensions.of(0, 120, 0, 80)),
    OPTA("opta", BOTTOM_TO_TOP, BOTTOM_LEFT, false, (l, w) -> PitchDimensions.of(0, 100, 0, 100)),
    WYSCOUT("wyscout", TOP_TO_BOTTOM, TOP_LEFT, false, (l, w) -> PitchDimensions.of(0, 100, 0, 100)),
    DATAFACTORY("datafactory", TOP_TO_BOTTOM, CENTER, false, (l, w) -> PitchDimensions.of(-1, 1, -1, 1)),
    // centimetres
    TRACAB("tracab", BOTTOM_TO_TOP, CENTER, true,
            (l, w) -> PitchDimensions.of(-l * 50, l * 50, -w * 50, w * 50).withPhysicalSize(l, w)),
    SECOND_SPECTRUM("secondspectrum", BOTTOM_TO_TOP, CENTER, true,
            (l, w) -> PitchDimensions.of(-l / 2, l / 2, -w / 2, w / 2).withPhysicalSize(l, w)),
    SKILLCORNER("skillcorner", BOTTOM_TO_TOP, CENTER, true,
            (l, w) -> PitchDimensions.of(-l / 2, l / 2, -w / 2, w / 2).withPhysicalSize(l, w)),
    SPORTEC("sportec", BOTTOM_TO_TOP, BOTTOM_LEFT, true,
            (l, w) -> PitchDimensions.of(0, l, 0, w).withPhysicalSize(l, w));

    private final String id;
    private final VerticalOrientation verticalOrientation;
    private final Origin origin;
    private final boolean physicalUnits;
    private final BiFunction<Double, Double, PitchDimensions> dimensions;

    Provider(String id,
             VerticalOrientation verticalOrientation,
             Origin origin,
             boolean physicalUnits,
             BiFunction<Double, Double, PitchDimensions> dimensions) {
        this.id = id;
        this.verticalOrientation = verticalOrientation;
        this.origin = origin;
        this.physicalUnits = physicalUnits;
        this.dimensions = dimensions;
    }

    public String id() {
        return id;
    }

    public boolean physicalUnits() {
        return physicalUnits;
    }

    CoordinateSystem coordinateSystem(double pitchLength, double pitchWidth) {
        return new CoordinateSystem(id, dimensions.apply(pitchLength, pitchWidth), verticalOrientation, origin);
    }

    /**
     * Case-insensitive lookup that ignores dashes, underscores and blanks ("Second-Spectrum").
     */
    public static Optional<Provider> fromId(String raw) {
        var key = normalize(raw);
        return Arrays.stream(values())
                .filter(p -> p.id.equals(key))
                .findFirst();
    }

    private static String normalize(String raw) {
        return raw.trim().toLowerCase(Locale.ROOT).replaceAll("[-_\\s]", "");
    }
}
