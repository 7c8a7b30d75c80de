package org.ctiextract.region;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * The geometry of a 2D charge-injection frame: its shape, the charge-injection regions and the
 * non-photosensitive structures bordering the imaging area.
 * <p>
 * The region list order is preserved by every derived list except the row-gap quantities, which
 * walk the regions in row order. Regions may overlap; the layout only
 * requires that every declared structure fits inside the frame. Prescan and overscan structures
 * are optional and reported as {@code null} when absent.
 */
public final class Layout2D {

    private final int rows;
    private final int columns;
    private final List<Region2D> regionList;
    private final ReadoutCorner originalCorner;
    private final Region2D parallelOverscan;
    private final Region2D serialPrescan;
    private final Region2D serialOverscan;

    private Layout2D(Builder builder) {
        if (builder.rows <= 0 || builder.columns <= 0) {
            throw new InvalidRegionException(
                "Layout shape must be positive, got (" + builder.rows + ", " + builder.columns + ")");
        }
        this.rows = builder.rows;
        this.columns = builder.columns;
        this.regionList = Collections.unmodifiableList(new ArrayList<>(builder.regionList));
        this.originalCorner = Objects.requireNonNull(builder.originalCorner, "originalCorner");
        this.parallelOverscan = builder.parallelOverscan;
        this.serialPrescan = builder.serialPrescan;
        this.serialOverscan = builder.serialOverscan;

        for (Region2D region : regionList) {
            region.checkWithin(rows, columns);
        }
        checkStructure(parallelOverscan);
        checkStructure(serialPrescan);
        checkStructure(serialOverscan);
    }

    private void checkStructure(Region2D structure) {
        if (structure != null) {
            structure.checkWithin(rows, columns);
        }
    }

    /**
     * Starts a layout for a frame of the given shape.
     *
     * @param rows Number of rows (parallel direction).
     * @param columns Number of columns (serial direction).
     * @return A builder with an empty region list and the canonical readout corner.
     */
    public static Builder builder(int rows, int columns) {
        return new Builder(rows, columns);
    }

    /**
     * Shorthand for a layout with charge-injection regions only.
     *
     * @param rows Number of rows.
     * @param columns Number of columns.
     * @param regionList The charge-injection regions.
     * @return The layout.
     */
    public static Layout2D of(int rows, int columns, List<Region2D> regionList) {
        return builder(rows, columns).regionList(regionList).build();
    }

    /**
     * @return A builder pre-populated with this layout's values.
     */
    public Builder toBuilder() {
        return builder(rows, columns)
            .regionList(regionList)
            .originalCorner(originalCorner)
            .parallelOverscan(parallelOverscan)
            .serialPrescan(serialPrescan)
            .serialOverscan(serialOverscan);
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    /**
     * @return {@code {rows, columns}}.
     */
    public int[] getShape() {
        return new int[]{rows, columns};
    }

    /**
     * @param axis The axis.
     * @return The frame extent along the axis.
     */
    public int extent(ClockingAxis axis) {
        return axis == ClockingAxis.PARALLEL ? rows : columns;
    }

    public List<Region2D> getRegionList() {
        return regionList;
    }

    public ReadoutCorner getOriginalCorner() {
        return originalCorner;
    }

    /** @return The parallel overscan, or {@code null}. */
    public Region2D getParallelOverscan() {
        return parallelOverscan;
    }

    /** @return The serial prescan, or {@code null}. */
    public Region2D getSerialPrescan() {
        return serialPrescan;
    }

    /** @return The serial overscan, or {@code null}. */
    public Region2D getSerialOverscan() {
        return serialOverscan;
    }

    /**
     * Pixels between a region's far edge and the next structure along {@code axis}: the near
     * edge of the closest following region that shares rows (serial) or columns (parallel) with
     * it, or the edge of the frame.
     *
     * @param region A region of this layout.
     * @param axis The axis.
     * @return The trailing space, zero if the region touches the next structure.
     */
    public int trailingSpace(Region2D region, ClockingAxis axis) {
        final int far = region.end(axis);
        int limit = extent(axis);
        for (Region2D other : regionList) {
            boolean sharesLine = axis == ClockingAxis.PARALLEL
                ? region.overlapsColumns(other)
                : region.overlapsRows(other);
            int otherStart = other.start(axis);
            if (sharesLine && otherStart >= far && otherStart < limit) {
                limit = otherStart;
            }
        }
        return Math.max(0, limit - far);
    }

    /**
     * @return Rows between each region and the next one down the frame, in row order.
     */
    public int[] parallelRowsBetweenRegions() {
        List<Region2D> byRow = regionsByRow();
        int count = Math.max(0, byRow.size() - 1);
        int[] between = new int[count];
        for (int i = 0; i < count; i++) {
            between[i] = byRow.get(i + 1).y0() - byRow.get(i).y1();
        }
        return between;
    }

    /**
     * @return Rows between the furthest region edge and the far edge of the frame.
     * @throws EmptyRegionListException if the layout has no regions.
     */
    public int parallelRowsToArrayEdge() {
        requireRegions("parallelRowsToArrayEdge");
        int maxY1 = 0;
        for (Region2D region : regionList) {
            maxY1 = Math.max(maxY1, region.y1());
        }
        return rows - maxY1;
    }

    /**
     * @return The smallest number of rows available for parallel EPERs behind any region.
     * @throws EmptyRegionListException if the layout has no regions.
     */
    public int smallestParallelRowsBetweenRegions() {
        int smallest = parallelRowsToArrayEdge();
        for (int between : parallelRowsBetweenRegions()) {
            smallest = Math.min(smallest, between);
        }
        return smallest;
    }

    /**
     * @return Rows of the shortest region.
     * @throws EmptyRegionListException if the layout has no regions.
     */
    public int totalRowsMin() {
        requireRegions("totalRowsMin");
        int min = Integer.MAX_VALUE;
        for (Region2D region : regionList) {
            min = Math.min(min, region.totalRows());
        }
        return min;
    }

    /**
     * @return Columns of the narrowest region.
     * @throws EmptyRegionListException if the layout has no regions.
     */
    public int totalColumnsMin() {
        requireRegions("totalColumnsMin");
        int min = Integer.MAX_VALUE;
        for (Region2D region : regionList) {
            min = Math.min(min, region.totalColumns());
        }
        return min;
    }

    /**
     * The strips in front of, between and after the charge-injection regions, spanning the
     * columns of the first region. They hold the parallel EPERs (and the pre-injection rows);
     * the serial prescan and overscan are not included. Zero-height strips are skipped.
     *
     * @return The anti-regions in row order.
     * @throws EmptyRegionListException if the layout has no regions.
     */
    public List<Region2D> antiRegionList() {
        requireRegions("antiRegionList");
        final int x0 = regionList.get(0).x0();
        final int x1 = regionList.get(0).x1();
        List<Region2D> antiRegions = new ArrayList<>();
        int previousEnd = 0;
        for (Region2D region : regionsByRow()) {
            if (region.y0() > previousEnd) {
                antiRegions.add(new Region2D(previousEnd, region.y0(), x0, x1));
            }
            previousEnd = Math.max(previousEnd, region.y1());
        }
        if (rows > previousEnd) {
            antiRegions.add(new Region2D(previousEnd, rows, x0, x1));
        }
        return antiRegions;
    }

    /**
     * The corner of the frame covered by both the parallel overscan rows and the serial overscan
     * columns, which receives neither charge nor trails.
     *
     * @return The pedestal region.
     * @throws IllegalStateException if the layout lacks a parallel or serial overscan.
     */
    public Region2D pedestal() {
        if (parallelOverscan == null || serialOverscan == null) {
            throw new IllegalStateException("A pedestal needs both a parallel and a serial overscan");
        }
        return new Region2D(parallelOverscan.y0(), rows, serialOverscan.x0(), columns);
    }

    /**
     * Remaps this layout into the frame of a sub-frame cut out at {@code extraction}.
     * Structures that do not intersect the cut are dropped.
     *
     * @param extraction The cut-out region.
     * @return The layout of the cut-out, keeping the original readout corner.
     * @throws InvalidRegionException if the extraction region lies outside this frame.
     */
    public Layout2D layoutExtractedFrom(Region2D extraction) {
        extraction.checkWithin(rows, columns);
        List<Region2D> extractedRegions = new ArrayList<>();
        for (Region2D region : regionList) {
            region.afterExtraction(extraction).ifPresent(extractedRegions::add);
        }
        return builder(extraction.totalRows(), extraction.totalColumns())
            .regionList(extractedRegions)
            .originalCorner(originalCorner)
            .parallelOverscan(afterExtraction(parallelOverscan, extraction))
            .serialPrescan(afterExtraction(serialPrescan, extraction))
            .serialOverscan(afterExtraction(serialOverscan, extraction))
            .build();
    }

    private static Region2D afterExtraction(Region2D structure, Region2D extraction) {
        return structure == null ? null : structure.afterExtraction(extraction).orElse(null);
    }

    private List<Region2D> regionsByRow() {
        List<Region2D> byRow = new ArrayList<>(regionList);
        byRow.sort(Comparator.comparingInt(Region2D::y0).thenComparingInt(Region2D::y1));
        return byRow;
    }

    private void requireRegions(String operation) {
        if (regionList.isEmpty()) {
            throw new EmptyRegionListException(operation + " requires at least one charge-injection region");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Layout2D that)) return false;
        return rows == that.rows
            && columns == that.columns
            && regionList.equals(that.regionList)
            && originalCorner == that.originalCorner
            && Objects.equals(parallelOverscan, that.parallelOverscan)
            && Objects.equals(serialPrescan, that.serialPrescan)
            && Objects.equals(serialOverscan, that.serialOverscan);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rows, columns, regionList, originalCorner, parallelOverscan, serialPrescan, serialOverscan);
    }

    @Override
    public String toString() {
        return "Layout2D{shape=" + Arrays.toString(getShape())
            + ", regions=" + regionList
            + ", originalCorner=" + originalCorner
            + ", parallelOverscan=" + parallelOverscan
            + ", serialPrescan=" + serialPrescan
            + ", serialOverscan=" + serialOverscan + "}";
    }

    /**
     * Builder for {@link Layout2D}.
     */
    public static final class Builder {
        private final int rows;
        private final int columns;
        private List<Region2D> regionList = List.of();
        private ReadoutCorner originalCorner = ReadoutCorner.CANONICAL;
        private Region2D parallelOverscan;
        private Region2D serialPrescan;
        private Region2D serialOverscan;

        private Builder(int rows, int columns) {
            this.rows = rows;
            this.columns = columns;
        }

        /** Sets the charge-injection regions, in caller order. */
        public Builder regionList(List<Region2D> regionList) {
            this.regionList = List.copyOf(regionList);
            return this;
        }

        /** Sets the readout corner of the raw frame this layout was declared for. */
        public Builder originalCorner(ReadoutCorner originalCorner) {
            this.originalCorner = originalCorner;
            return this;
        }

        /** Sets the parallel overscan ({@code null} for none). */
        public Builder parallelOverscan(Region2D parallelOverscan) {
            this.parallelOverscan = parallelOverscan;
            return this;
        }

        /** Sets the serial prescan ({@code null} for none). */
        public Builder serialPrescan(Region2D serialPrescan) {
            this.serialPrescan = serialPrescan;
            return this;
        }

        /** Sets the serial overscan ({@code null} for none). */
        public Builder serialOverscan(Region2D serialOverscan) {
            this.serialOverscan = serialOverscan;
            return this;
        }

        /**
         * @return The validated layout.
         * @throws InvalidRegionException if a structure does not fit in the frame.
         */
        public Layout2D build() {
            return new Layout2D(this);
        }
    }
}
