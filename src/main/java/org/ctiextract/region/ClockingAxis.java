package org.ctiextract.region;

/**
 * The two clocking directions of a CCD.
 * <p>
 * The axes are fixed by the detector wiring and are never swapped by any transform.
 */
public enum ClockingAxis {

    /** Row-wise direction: charge moves one row at a time towards the serial register. */
    PARALLEL,

    /** Column-wise direction: a row is clocked pixel by pixel through the serial register. */
    SERIAL;

    /**
     * @return The axis perpendicular to this one.
     */
    public ClockingAxis orthogonal() {
        return this == PARALLEL ? SERIAL : PARALLEL;
    }
}
