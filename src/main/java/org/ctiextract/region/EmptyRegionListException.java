package org.ctiextract.region;

import org.ctiextract.ExtractionException;

/**
 * Thrown by operations whose result is undefined without at least one region, for example
 * stacking zero patches or cropping a calibration frame that keeps no charge-injection region.
 * <p>
 * Operations that are well defined on an empty list (deriving regions, slicing patches,
 * scattering) accept it and return an empty result instead.
 */
public class EmptyRegionListException extends ExtractionException {

    /**
     * @param message Description of the operation that needed regions
     */
    public EmptyRegionListException(String message) {
        super(message);
    }
}
