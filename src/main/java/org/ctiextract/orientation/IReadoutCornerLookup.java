package org.ctiextract.orientation;

import org.ctiextract.region.ReadoutCorner;

/**
 * Instrument metadata seam: resolves the readout corner of a detector quadrant.
 * <p>
 * Implementations typically wrap a table keyed by quadrant letter or CCD id, for example
 * {@code "E" -> (1, 0)}.
 */
public interface IReadoutCornerLookup {

    /**
     * @param quadrantId The quadrant identifier.
     * @return The corner of that quadrant nearest the readout electronics.
     * @throws org.ctiextract.region.UnsupportedOrientationException if the quadrant is unknown.
     */
    ReadoutCorner cornerFor(String quadrantId);
}
