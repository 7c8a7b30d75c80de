package org.ctiextract.region;

import java.util.Optional;

/**
 * A rectangular region of a 2D frame in pixel coordinates.
 * <p>
 * Coordinates follow the convention {@code (y0, y1, x0, x1)} = (first row, last row exclusive,
 * first column, last column exclusive). Row 0 and column 0 are nearest the readout electronics
 * once a frame has been normalized, so {@code y0} / {@code x0} are the near edges along the
 * parallel / serial axes.
 *
 * @param y0 First row (inclusive)
 * @param y1 Last row (exclusive)
 * @param x0 First column (inclusive)
 * @param x1 Last column (exclusive)
 */
public record Region2D(int y0, int y1, int x0, int x1) {

    /**
     * @throws InvalidRegionException if a coordinate is negative or a range is empty.
     */
    public Region2D {
        if (y0 < 0 || y1 < 0 || x0 < 0 || x1 < 0) {
            throw new InvalidRegionException(
                "A coordinate of region " + format(y0, y1, x0, x1) + " is negative");
        }
        if (y0 >= y1) {
            throw new InvalidRegionException(
                "Region " + format(y0, y1, x0, x1) + " has y0 >= y1");
        }
        if (x0 >= x1) {
            throw new InvalidRegionException(
                "Region " + format(y0, y1, x0, x1) + " has x0 >= x1");
        }
    }

    public int totalRows() {
        return y1 - y0;
    }

    public int totalColumns() {
        return x1 - x0;
    }

    /**
     * @return {@code {totalRows, totalColumns}}.
     */
    public int[] shape() {
        return new int[]{totalRows(), totalColumns()};
    }

    /**
     * @param axis The axis.
     * @return The near edge along the axis ({@code y0} or {@code x0}).
     */
    public int start(ClockingAxis axis) {
        return axis == ClockingAxis.PARALLEL ? y0 : x0;
    }

    /**
     * @param axis The axis.
     * @return The far edge along the axis ({@code y1} or {@code x1}).
     */
    public int end(ClockingAxis axis) {
        return axis == ClockingAxis.PARALLEL ? y1 : x1;
    }

    /**
     * @param axis The axis.
     * @return The extent of the region along the axis.
     */
    public int size(ClockingAxis axis) {
        return end(axis) - start(axis);
    }

    /**
     * Returns a copy of this region with the range along {@code axis} replaced.
     *
     * @param axis The axis to replace.
     * @param start New near edge.
     * @param end New far edge (exclusive).
     * @return The new region.
     * @throws InvalidRegionException if the new range is negative or empty.
     */
    public Region2D withSpan(ClockingAxis axis, int start, int end) {
        return axis == ClockingAxis.PARALLEL
            ? new Region2D(start, end, x0, x1)
            : new Region2D(y0, y1, start, end);
    }

    /**
     * Derives the leading-edge (FPR) sub-region: the window is measured from the near edge
     * along {@code axis}. The result is not clipped to this region.
     *
     * @param axis The axis the window applies to.
     * @param window The window.
     * @return The derived region.
     * @throws InvalidRegionException if the window leaves non-negative coordinates.
     */
    public Region2D leadingRegionFrom(ClockingAxis axis, ExtractionWindow window) {
        int[] span = window.resolve(EdgeAnchor.LEADING, start(axis), end(axis), 0);
        return withSpan(axis, span[0], span[1]);
    }

    /**
     * Derives the trailing-edge (EPER) sub-region: the window is measured from the far edge
     * along {@code axis}.
     *
     * @param axis The axis the window applies to.
     * @param window The window.
     * @param trailingSpace Pixels between the far edge and the next structure along the axis,
     *                      used by {@code fromEnd} and {@code full} windows.
     * @return The derived region.
     * @throws InvalidRegionException if the resolved range is negative or empty.
     */
    public Region2D trailingRegionFrom(ClockingAxis axis, ExtractionWindow window, int trailingSpace) {
        int[] span = window.resolve(EdgeAnchor.TRAILING, start(axis), end(axis), trailingSpace);
        return withSpan(axis, span[0], span[1]);
    }

    /**
     * @param rows Rows of the frame.
     * @param columns Columns of the frame.
     * @return True if the region lies inside a frame of the given shape.
     */
    public boolean fitsWithin(int rows, int columns) {
        return y1 <= rows && x1 <= columns;
    }

    /**
     * @param rows Rows of the frame.
     * @param columns Columns of the frame.
     * @throws InvalidRegionException if the region does not lie inside the frame.
     */
    public void checkWithin(int rows, int columns) {
        if (!fitsWithin(rows, columns)) {
            throw new InvalidRegionException(
                "Region " + this + " lies outside a frame of shape (" + rows + ", " + columns + ")");
        }
    }

    /**
     * @param other Another region.
     * @return True if the two regions share at least one row.
     */
    public boolean overlapsRows(Region2D other) {
        return y0 < other.y1 && other.y0 < y1;
    }

    /**
     * @param other Another region.
     * @return True if the two regions share at least one column.
     */
    public boolean overlapsColumns(Region2D other) {
        return x0 < other.x1 && other.x0 < x1;
    }

    /**
     * Maps this region into the coordinate frame of a sub-frame cut out at {@code extraction}.
     * <p>
     * The region is intersected with the extraction region and shifted so that the extraction
     * origin becomes (0, 0).
     *
     * @param extraction The cut-out region in this region's coordinates.
     * @return The remapped region, or empty if nothing of this region survives the cut.
     */
    public Optional<Region2D> afterExtraction(Region2D extraction) {
        int ny0 = Math.max(y0, extraction.y0) - extraction.y0;
        int ny1 = Math.min(y1, extraction.y1) - extraction.y0;
        int nx0 = Math.max(x0, extraction.x0) - extraction.x0;
        int nx1 = Math.min(x1, extraction.x1) - extraction.x0;
        if (ny0 >= ny1 || nx0 >= nx1) {
            return Optional.empty();
        }
        return Optional.of(new Region2D(ny0, ny1, nx0, nx1));
    }

    /**
     * @return The coordinates as {@code {y0, y1, x0, x1}}.
     */
    public int[] toArray() {
        return new int[]{y0, y1, x0, x1};
    }

    @Override
    public String toString() {
        return format(y0, y1, x0, x1);
    }

    private static String format(int y0, int y1, int x0, int x1) {
        return "(" + y0 + ", " + y1 + ", " + x0 + ", " + x1 + ")";
    }
}
