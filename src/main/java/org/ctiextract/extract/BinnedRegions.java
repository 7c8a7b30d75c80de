package org.ctiextract.extract;

import java.util.Optional;

import org.ctiextract.region.ExtractionWindow;
import org.ctiextract.region.Region1D;

/**
 * Locates the charge-injected pixels inside a binned 1D profile, given the window that produced it.
 */
public final class BinnedRegions {

    private BinnedRegions() {
    }

    /**
     * For a profile of leading-edge pixels: everything from the region's near edge on. A window
     * starting before the region ({@code start < 0}) puts {@code -start} uninjected pixels first.
     *
     * @param window The extraction window.
     * @param binnedLength Length of the binned profile.
     * @return The injected part of the profile, empty if the window ends before the region.
     */
    public static Optional<Region1D> fprRegionFrom(ExtractionWindow window, int binnedLength) {
        if (window.getForm() != ExtractionWindow.Form.PIXELS) {
            return Optional.of(new Region1D(0, binnedLength));
        }
        int start = window.getStart();
        int end = window.getEnd();
        if (end <= 0) {
            return Optional.empty();
        }
        return Optional.of(new Region1D(start < 0 ? -start : 0, end - start));
    }

    /**
     * For a profile of trailing pixels (or any non-injected structure): only the pixels a window
     * with {@code start < 0} pulls in from the region itself.
     *
     * @param window The extraction window.
     * @return The injected part of the profile, empty if there is none.
     */
    public static Optional<Region1D> eperRegionFrom(ExtractionWindow window) {
        if (window.getForm() != ExtractionWindow.Form.PIXELS || window.getStart() >= 0) {
            return Optional.empty();
        }
        int start = window.getStart();
        return Optional.of(new Region1D(0, Math.min(-start, window.getEnd() - start)));
    }
}
