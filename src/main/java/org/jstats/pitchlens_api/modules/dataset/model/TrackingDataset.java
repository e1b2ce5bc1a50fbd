package org.jstats.pitchlens_api.modules.dataset.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public final class TrackingDataset extends Dataset<Frame, TrackingDataset> {

    @JsonCreator
    public TrackingDataset(@JsonProperty("metadata") Metadata metadata,
                           @JsonProperty("records") List<Frame> records) {
        super(metadata, records);
    }

    @Override
    public TrackingDataset withRecords(Metadata metadata, List<Frame> records) {
        return new TrackingDataset(metadata, records);
    }

    @Override
    protected TrackingDataset self() {
        return this;
    }

    public List<Frame> frames() {
        return records();
    }
}
