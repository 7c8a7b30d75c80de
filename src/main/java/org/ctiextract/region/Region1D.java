package org.ctiextract.region;

import java.util.Optional;

/**
 * A contiguous range of a 1D line in pixel coordinates, {@code [x0, x1)}.
 *
 * @param x0 First pixel (inclusive)
 * @param x1 Last pixel (exclusive)
 */
public record Region1D(int x0, int x1) {

    /**
     * @throws InvalidRegionException if a coordinate is negative or the range is empty.
     */
    public Region1D {
        if (x0 < 0 || x1 < 0) {
            throw new InvalidRegionException("A coordinate of region (" + x0 + ", " + x1 + ") is negative");
        }
        if (x0 >= x1) {
            throw new InvalidRegionException("Region (" + x0 + ", " + x1 + ") has x0 >= x1");
        }
    }

    public int totalPixels() {
        return x1 - x0;
    }

    /**
     * Derives the leading-edge (FPR) sub-region, measured from {@code x0}.
     *
     * @param window The window.
     * @return The derived region.
     */
    public Region1D leadingRegionFrom(ExtractionWindow window) {
        int[] span = window.resolve(EdgeAnchor.LEADING, x0, x1, 0);
        return new Region1D(span[0], span[1]);
    }

    /**
     * Derives the trailing-edge (EPER) sub-region, measured from {@code x1}.
     *
     * @param window The window.
     * @param trailingSpace Pixels between {@code x1} and the next region or the line end.
     * @return The derived region.
     */
    public Region1D trailingRegionFrom(ExtractionWindow window, int trailingSpace) {
        int[] span = window.resolve(EdgeAnchor.TRAILING, x0, x1, trailingSpace);
        return new Region1D(span[0], span[1]);
    }

    /**
     * @param length Length of the line.
     * @throws InvalidRegionException if the region extends past the line.
     */
    public void checkWithin(int length) {
        if (x1 > length) {
            throw new InvalidRegionException(
                "Region " + this + " lies outside a line of length " + length);
        }
    }

    /**
     * Maps this region into the coordinates of a sub-line cut out at {@code extraction}.
     *
     * @param extraction The cut-out range.
     * @return The remapped region, or empty if nothing survives the cut.
     */
    public Optional<Region1D> afterExtraction(Region1D extraction) {
        int nx0 = Math.max(x0, extraction.x0) - extraction.x0;
        int nx1 = Math.min(x1, extraction.x1) - extraction.x0;
        return nx0 < nx1 ? Optional.of(new Region1D(nx0, nx1)) : Optional.empty();
    }

    @Override
    public String toString() {
        return "(" + x0 + ", " + x1 + ")";
    }
}
