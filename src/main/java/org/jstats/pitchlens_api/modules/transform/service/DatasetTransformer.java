package org.jstats.pitchlens_api.modules.transform.service;

import org.jspecify.annotations.NullMarked;
import org.jstats.pitchlens_api.core.config.PitchLensProperties;
import org.jstats.pitchlens_api.core.error.ConfigurationException;
import org.jstats.pitchlens_api.modules.dataset.model.DataRecord;
import org.jstats.pitchlens_api.modules.dataset.model.Dataset;
import org.jstats.pitchlens_api.modules.dataset.model.Metadata;
import org.jstats.pitchlens_api.modules.orientation.OrientationResolver;
import org.jstats.pitchlens_api.modules.transform.model.TransformRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StopWatch;

import java.util.List;

/**
 * Re-expresses datasets in another coordinate system and/or orientation.
 */
@Service
@NullMarked
public class DatasetTransformer {

    private static final Logger log = LoggerFactory.getLogger(DatasetTransformer.class);

    private final OrientationResolver resolver;
    private final int parallelThreshold;

    public DatasetTransformer(OrientationResolver resolver, PitchLensProperties properties) {
        this.resolver = resolver;
        this.parallelThreshold = properties.transform().parallelThreshold();
    }

    public static DatasetTransformer withDefaults() {
        return new DatasetTransformer(new OrientationResolver(), PitchLensProperties.defaults());
    }

    /**
     * Validates {@code request} against the dataset metadata and builds the per-record mapping.
     * Nothing is transformed yet, so every configuration problem surfaces here.
     *
     * @throws ConfigurationException when the request is empty or contradicting, or the orientations cannot be reconciled
     */
    public TransformPlan plan(Metadata source, TransformRequest request) {
        if (request.isEmpty()) {
            throw new ConfigurationException("Transform needs a target coordinate system, orientation or pitch dimensions");
        }
        if (request.toCoordinateSystem() != null && request.toPitchDimensions() != null) {
            throw new ConfigurationException("Specify either a target coordinate system or pitch dimensions, not both");
        }

        var fromSystem = source.coordinateSystem();
        var toSystem = fromSystem;
        if (request.toCoordinateSystem() != null) {
            toSystem = request.toCoordinateSystem();
        } else if (request.toPitchDimensions() != null) {
            toSystem = fromSystem.withPitchDimensions(request.toPitchDimensions());
        }

        var fromOrientation = source.orientation();
        var toOrientation = request.toOrientation() != null ? request.toOrientation() : fromOrientation;
        resolver.validate(fromOrientation, toOrientation);

        return new TransformPlan(fromSystem, toSystem, fromOrientation, toOrientation, resolver);
    }

    /**
     * Maps every spatial attribute of every record and returns a dataset carrying the target metadata.
     * Either all records are transformed or an exception is thrown; no partially transformed dataset escapes.
     *
     * @throws ConfigurationException                                        see {@link #plan}
     * @throws org.jstats.pitchlens_api.core.error.OrientationException when a record lacks the context an orientation needs
     */
    public <R extends DataRecord<R>, D extends Dataset<R, D>> D transform(D dataset, TransformRequest request) {
        var plan = plan(dataset.metadata(), request);

        var watch = new StopWatch("transform");
        watch.start();

        var source = dataset.records();
        var stream = source.size() >= parallelThreshold ? source.parallelStream() : source.stream();
        List<R> transformed = stream.map(record -> plan.apply(record)).toList();

        watch.stop();
        if (log.isDebugEnabled()) {
            log.debug("Transformed {} records with {} in {} ms", transformed.size(), plan, watch.getTotalTimeMillis());
        }

        var metadata = dataset.metadata().withCoordinates(plan.toSystem(), plan.toOrientation());
        return dataset.withRecords(metadata, transformed);
    }
}
