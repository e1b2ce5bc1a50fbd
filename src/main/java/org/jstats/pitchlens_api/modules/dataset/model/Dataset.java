package org.jstats.pitchlens_api.modules.dataset.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jstats.pitchlens_api.modules.state.StateAnnotator;
import org.jstats.pitchlens_api.modules.state.StateBuilderRegistry;
import org.jstats.pitchlens_api.modules.transform.model.TransformRequest;
import org.jstats.pitchlens_api.modules.transform.service.DatasetTransformer;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Ordered, indexed and immutable sequence of records plus the metadata describing them.
 * <p>
 * Every operation returns a new dataset; a dataset and its records are never modified in place.
 *
 * @param <R> record type
 * @param <D> concrete dataset type, returned by the derived-dataset operations
 */
public abstract class Dataset<R extends DataRecord<R>, D extends Dataset<R, D>> {

    private final Metadata metadata;
    private final List<R> records;
    private final Map<String, R> index;

    protected Dataset(Metadata metadata, List<R> records) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.records = records == null ? List.of() : List.copyOf(records);
        this.index = new HashMap<>(this.records.size() * 2);
        for (R record : this.records) {
            if (index.putIfAbsent(record.recordId(), record) != null) {
                throw new IllegalArgumentException("Duplicate record id " + record.recordId());
            }
        }
    }

    /**
     * Builds a dataset of the same kind. Used by every derived-dataset operation.
     */
    public abstract D withRecords(Metadata metadata, List<R> records);

    protected abstract D self();

    @JsonProperty
    public Metadata metadata() {
        return metadata;
    }

    @JsonProperty
    public List<R> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public R get(int position) {
        return records.get(position);
    }

    public Optional<R> findRecordById(String recordId) {
        return Optional.ofNullable(index.get(recordId));
    }

    /**
     * Whether this exact record (not an older or transformed copy of it) belongs to this dataset.
     */
    public boolean isAttached(R record) {
        return index.get(record.recordId()) == record;
    }

    public Optional<R> find(Predicate<? super R> predicate) {
        return records.stream().filter(predicate).findFirst();
    }

    public D filter(Predicate<? super R> predicate) {
        return withRecords(metadata, records.stream().filter(predicate).toList());
    }

    /**
     * Re-expresses the dataset in another coordinate system and/or orientation, using the default
     * transformer settings. Configured settings such as the parallel threshold apply only through
     * {@link #transform(DatasetTransformer, TransformRequest)}.
     */
    public D transform(TransformRequest request) {
        return transform(DatasetTransformer.withDefaults(), request);
    }

    /**
     * @see DatasetTransformer#transform(Dataset, TransformRequest)
     */
    public D transform(DatasetTransformer transformer, TransformRequest request) {
        return transformer.transform(self(), request);
    }

    /**
     * Attaches the state of the given builders to every record.
     *
     * @see StateAnnotator#addState(Dataset, String...)
     */
    public D addState(StateBuilderRegistry registry, String... builderKeys) {
        return new StateAnnotator(registry).addState(self(), builderKeys);
    }

    @Override
    public String toString() {
        return "%s[provider=%s, records=%d, %s, %s]".formatted(getClass().getSimpleName(), metadata.provider(),
                records.size(), metadata.coordinateSystem(), metadata.orientation());
    }
}
