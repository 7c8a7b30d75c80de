package org.ctiextract.region;

/**
 * Which edge of a region an {@link ExtractionWindow} is measured from.
 */
public enum EdgeAnchor {

    /** The edge closest to the readout register (first pixel response, FPR). */
    LEADING,

    /** The edge away from the readout register, where deferred charge trails appear (EPER). */
    TRAILING
}
