package org.jstats.pitchlens_api.core.error;

public class OrphanedRecordException extends PitchLensException {

    public final String recordId;

    public OrphanedRecordException(String message, String recordId) {
        super(message);
        this.recordId = recordId;
    }

    public static OrphanedRecordException detached(String recordId) {
        return new OrphanedRecordException("Record %s is not attached to this dataset".formatted(recordId), recordId);
    }

    public static OrphanedRecordException unknownReference(String recordId, String relatedId) {
        return new OrphanedRecordException(
                "Record %s refers to %s which does not exist in this dataset".formatted(recordId, relatedId), relatedId);
    }
}
