package org.jstats.pitchlens_api.core.error;

import org.jspecify.annotations.Nullable;

/**
 * A record lacks the context (ball owner, executing team, attacking direction) an orientation
 * needs. Aborts the whole transform.
 */
public class OrientationException extends PitchLensException {

    public final @Nullable String recordId;

    public OrientationException(String message) {
        super(message);
        this.recordId = null;
    }

    public OrientationException(String message, String recordId, Throwable cause) {
        super(message + " (record " + recordId + ")", cause);
        this.recordId = recordId;
    }
}
