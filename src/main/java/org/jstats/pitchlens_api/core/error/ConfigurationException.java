package org.jstats.pitchlens_api.core.error;

/**
 * Invalid setup: degenerate pitch dimensions, unknown coordinate system, unknown or colliding
 * state builder key, contradicting transform targets. Always raised before any record is touched.
 */
public class ConfigurationException extends PitchLensException {

    public ConfigurationException(String message) {
        super(message);
    }
}
