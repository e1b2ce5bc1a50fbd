package org.jstats.pitchlens_api.modules.geometry.registry;

import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.pitchlens_api.core.config.PitchLensProperties;
import org.jstats.pitchlens_api.core.error.ConfigurationException;
import org.jstats.pitchlens_api.modules.geometry.model.CoordinateSystem;
import org.jstats.pitchlens_api.modules.geometry.model.Origin;
import org.jstats.pitchlens_api.modules.geometry.model.PitchDimensions;
import org.jstats.pitchlens_api.modules.geometry.model.VerticalOrientation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Maps provider identifiers, or explicit dimensions, to coordinate systems.
 */
@Component
@NullMarked
public class CoordinateSystemRegistry {

    private static final Logger log = LoggerFactory.getLogger(CoordinateSystemRegistry.class);

    private final double defaultLength;
    private final double defaultWidth;

    public CoordinateSystemRegistry(PitchLensProperties properties) {
        this.defaultLength = properties.pitch().defaultLength();
        this.defaultWidth = properties.pitch().defaultWidth();
        if (defaultLength <= 0 || defaultWidth <= 0) {
            throw new ConfigurationException("Default pitch size must be positive, got %s x %s"
                    .formatted(defaultLength, defaultWidth));
        }
    }

    public static CoordinateSystemRegistry withDefaults() {
        return new CoordinateSystemRegistry(PitchLensProperties.defaults());
    }

    public CoordinateSystem forProvider(String providerId) {
        return forProvider(providerId, null, null);
    }

    /**
     * @param providerId  provider identifier, e.g. {@code statsbomb} or {@code tracab}
     * @param pitchLength physical length in metres; only used by providers with physical units
     * @param pitchWidth  physical width in metres; only used by providers with physical units
     * @throws ConfigurationException for unknown providers or a non-positive pitch size
     */
    public CoordinateSystem forProvider(String providerId, @Nullable Double pitchLength, @Nullable Double pitchWidth) {
        var provider = Provider.fromId(providerId)
                .orElseThrow(() -> new ConfigurationException(
                        "Unknown coordinate system '%s'. Known: %s".formatted(providerId, providers())));

        if (!provider.physicalUnits()) {
            return provider.coordinateSystem(1, 1);
        }

        double length = pitchLength != null ? pitchLength : defaultLength;
        double width = pitchWidth != null ? pitchWidth : defaultWidth;
        if (length <= 0 || width <= 0) {
            throw new ConfigurationException("Pitch size must be positive, got %s x %s".formatted(length, width));
        }
        if ((pitchLength == null || pitchWidth == null) && log.isDebugEnabled()) {
            log.debug("No pitch size given for {}, using {} x {}", provider.id(), length, width);
        }
        return provider.coordinateSystem(length, width);
    }

    public CoordinateSystem custom(PitchDimensions dimensions, VerticalOrientation verticalOrientation, Origin origin) {
        return new CoordinateSystem("custom", dimensions, verticalOrientation, origin);
    }

    public List<String> providers() {
        return Arrays.stream(Provider.values()).map(Provider::id).toList();
    }
}
