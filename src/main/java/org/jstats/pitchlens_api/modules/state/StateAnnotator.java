package org.jstats.pitchlens_api.modules.state;

import org.jspecify.annotations.NullMarked;
import org.jstats.pitchlens_api.modules.dataset.model.DataRecord;
import org.jstats.pitchlens_api.modules.dataset.model.Dataset;
import org.jstats.pitchlens_api.modules.dataset.model.Metadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StopWatch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/**
 * Attaches derived match state to every record in a single ordered pass.
 */
@Service
@NullMarked
public class StateAnnotator {

    private static final Logger log = LoggerFactory.getLogger(StateAnnotator.class);

    private final StateBuilderRegistry registry;

    public StateAnnotator(StateBuilderRegistry registry) {
        this.registry = registry;
    }

    /**
     * Runs the requested builders over the records in order. The state attached to the n-th record
     * reflects exactly the first n records. Existing state of other builders is kept; running a
     * builder again replaces its previous value.
     *
     * @throws org.jstats.pitchlens_api.core.error.ConfigurationException for unknown, repeated or
     *                                                                    missing keys, before any record is read
     */
    public <R extends DataRecord<R>, D extends Dataset<R, D>> D addState(D dataset, String... builderKeys) {
        var builders = registry.resolve(builderKeys);

        var watch = new StopWatch("addState");
        watch.start();

        List<Pass<?>> passes = new ArrayList<>(builders.size());
        for (StateBuilder<?> builder : builders) {
            passes.add(Pass.start(builder, dataset.metadata()));
        }

        var annotated = new ArrayList<R>(dataset.size());
        for (R record : dataset.records()) {
            var state = new LinkedHashMap<>(record.state());
            for (Pass<?> pass : passes) {
                state.put(pass.key(), pass.advance(record));
            }
            annotated.add(record.withState(state));
        }

        watch.stop();
        if (log.isDebugEnabled()) {
            log.debug("Added state {} to {} records in {} ms",
                    String.join(",", builderKeys), annotated.size(), watch.getTotalTimeMillis());
        }
        return dataset.withRecords(dataset.metadata(), annotated);
    }

    // Running context of one builder; lives for one addState call only.
    private static final class Pass<S> {

        private final StateBuilder<S> builder;
        private S current;

        private Pass(StateBuilder<S> builder, S initial) {
            this.builder = builder;
            this.current = initial;
        }

        static <S> Pass<S> start(StateBuilder<S> builder, Metadata metadata) {
            return new Pass<>(builder, requireState(builder, builder.initialState(metadata)));
        }

        String key() {
            return builder.key();
        }

        S advance(DataRecord<?> record) {
            current = requireState(builder, builder.reduceBefore(current, record));
            S snapshot = current;
            current = requireState(builder, builder.reduceAfter(current, record));
            return snapshot;
        }

        private static <S> S requireState(StateBuilder<S> builder, S state) {
            return Objects.requireNonNull(state, () -> "State builder '" + builder.key() + "' produced no state");
        }
    }
}
