package org.jstats.pitchlens_api.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "pitchlens")
public record PitchLensProperties(
        @DefaultValue Pitch pitch,
        @DefaultValue Transform transform) {

    /**
     * Physical pitch size assumed for providers measured in metres or centimetres when the
     * caller does not supply one.
     */
    public record Pitch(
            @DefaultValue("105") double defaultLength,
            @DefaultValue("68") double defaultWidth) {
    }

    /**
     * Datasets with at least {@code parallelThreshold} records are transformed on a parallel stream.
     */
    public record Transform(
            @DefaultValue("10000") int parallelThreshold) {
    }

    public static PitchLensProperties defaults() {
        return new PitchLensProperties(new Pitch(105, 68), new Transform(10_000));
    }
}
