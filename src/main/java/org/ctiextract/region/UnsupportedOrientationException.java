package org.ctiextract.region;

import org.ctiextract.ExtractionException;

/**
 * Thrown when a readout-corner tag is not one of the four canonical corners, or when an
 * instrument lookup has no corner for a quadrant.
 */
public class UnsupportedOrientationException extends ExtractionException {

    /**
     * @param message Description including the rejected tag
     */
    public UnsupportedOrientationException(String message) {
        super(message);
    }

    /**
     * @param message Description including the rejected tag
     * @param cause The underlying parse failure
     */
    public UnsupportedOrientationException(String message, Throwable cause) {
        super(message, cause);
    }
}
