package org.jstats.pitchlens_api.core.error;

/**
 * Base type of every failure raised while transforming or annotating a dataset.
 * All of them are deterministic: retrying with the same input reproduces the error.
 */
public abstract class PitchLensException extends RuntimeException {

    protected PitchLensException(String message) {
        super(message);
    }

    protected PitchLensException(String message, Throwable cause) {
        super(message, cause);
    }
}
