package org.ctiextract.region;

import org.ctiextract.ExtractionException;

/**
 * Thrown when a declared or derived region violates {@code y0 < y1} / {@code x0 < x1}, has a
 * negative coordinate, or lies outside the grid it is applied to.
 */
public class InvalidRegionException extends ExtractionException {

    /**
     * @param message Description including the offending coordinates
     */
    public InvalidRegionException(String message) {
        super(message);
    }

    /**
     * @param message Description including the offending coordinates
     * @param cause The underlying failure
     */
    public InvalidRegionException(String message, Throwable cause) {
        super(message, cause);
    }
}
