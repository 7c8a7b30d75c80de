package org.ctiextract.grid;

import org.ctiextract.ExtractionException;

/**
 * Thrown when two grids that must be aligned (values and mask, source and accumulator, data and
 * layout) differ in shape.
 */
public class ShapeMismatchException extends ExtractionException {

    /**
     * @param message Description including both shapes
     */
    public ShapeMismatchException(String message) {
        super(message);
    }
}
