package org.ctiextract.orientation;

import java.util.ArrayList;
import java.util.List;

import org.ctiextract.grid.Array2D;
import org.ctiextract.region.Layout2D;
import org.ctiextract.region.ReadoutCorner;
import org.ctiextract.region.Region2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reflects raw frames, regions and layouts into the canonical orientation, where index
 * {@code (0, 0)} is the pixel nearest the readout electronics, and back.
 * <p>
 * Every transform is a row flip, a column flip, both or neither. Each is its own inverse, so
 * {@code denormalize(normalize(x))} reproduces {@code x} bit for bit. Rows and columns are never
 * swapped. Region lists keep their order.
 */
public final class OrientationNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(OrientationNormalizer.class);

    private OrientationNormalizer() {
    }

    // ==================== Grids ====================

    /**
     * @param raw The frame as read out.
     * @param corner The corner of {@code raw} nearest the readout electronics.
     * @return The frame in canonical orientation.
     */
    public static Array2D normalize(Array2D raw, ReadoutCorner corner) {
        return raw.reflected(corner.flipsRows(), corner.flipsColumns());
    }

    /**
     * @param canonical A frame in canonical orientation.
     * @param corner The readout corner of the raw frame it came from.
     * @return The frame in its raw orientation.
     */
    public static Array2D denormalize(Array2D canonical, ReadoutCorner corner) {
        return canonical.reflected(corner.flipsRows(), corner.flipsColumns());
    }

    // ==================== Regions ====================

    /**
     * @param region A region of a raw frame.
     * @param rows Rows of the frame.
     * @param columns Columns of the frame.
     * @param corner The readout corner of the raw frame.
     * @return The same pixels addressed in canonical orientation.
     * @throws org.ctiextract.region.InvalidRegionException if the region lies outside the frame.
     */
    public static Region2D normalize(Region2D region, int rows, int columns, ReadoutCorner corner) {
        region.checkWithin(rows, columns);
        int y0 = region.y0();
        int y1 = region.y1();
        int x0 = region.x0();
        int x1 = region.x1();
        if (corner.flipsRows()) {
            y0 = rows - region.y1();
            y1 = rows - region.y0();
        }
        if (corner.flipsColumns()) {
            x0 = columns - region.x1();
            x1 = columns - region.x0();
        }
        return new Region2D(y0, y1, x0, x1);
    }

    /**
     * Inverse of {@link #normalize(Region2D, int, int, ReadoutCorner)}.
     */
    public static Region2D denormalize(Region2D region, int rows, int columns, ReadoutCorner corner) {
        return normalize(region, rows, columns, corner);
    }

    // ==================== Layouts ====================

    /**
     * Normalizes a layout declared in raw coordinates, using the corner it records.
     *
     * @param raw The raw layout.
     * @return The canonical layout, still recording the raw corner.
     */
    public static Layout2D normalize(Layout2D raw) {
        return normalize(raw, raw.getOriginalCorner());
    }

    /**
     * Normalizes a layout declared in raw coordinates of a frame read out at {@code corner}.
     *
     * @param raw The raw layout.
     * @param corner The readout corner of the raw frame.
     * @return The canonical layout, recording {@code corner} as its original corner.
     */
    public static Layout2D normalize(Layout2D raw, ReadoutCorner corner) {
        LOG.debug("Normalizing layout of shape ({}, {}) read out at {}", raw.getRows(), raw.getColumns(), corner);
        return reflect(raw, corner);
    }

    /**
     * Normalizes a quadrant's raw layout, taking its readout corner from instrument metadata.
     *
     * @param raw The raw layout of the quadrant.
     * @param quadrantId The quadrant identifier.
     * @param cornerLookup The instrument's corner table.
     * @return The canonical layout, recording the looked-up corner.
     * @throws org.ctiextract.region.UnsupportedOrientationException if the quadrant is unknown.
     */
    public static Layout2D normalize(Layout2D raw, String quadrantId, IReadoutCornerLookup cornerLookup) {
        return normalize(raw, cornerLookup.cornerFor(quadrantId));
    }

    /**
     * Maps a canonical layout back to the raw coordinates of the corner it records.
     *
     * @param canonical A layout produced by {@link #normalize(Layout2D, ReadoutCorner)}.
     * @return The raw layout.
     */
    public static Layout2D denormalize(Layout2D canonical) {
        return reflect(canonical, canonical.getOriginalCorner());
    }

    private static Layout2D reflect(Layout2D layout, ReadoutCorner corner) {
        int rows = layout.getRows();
        int columns = layout.getColumns();
        List<Region2D> regions = new ArrayList<>(layout.getRegionList().size());
        for (Region2D region : layout.getRegionList()) {
            regions.add(normalize(region, rows, columns, corner));
        }
        return Layout2D.builder(rows, columns)
            .regionList(regions)
            .originalCorner(corner)
            .parallelOverscan(reflectNullable(layout.getParallelOverscan(), rows, columns, corner))
            .serialPrescan(reflectNullable(layout.getSerialPrescan(), rows, columns, corner))
            .serialOverscan(reflectNullable(layout.getSerialOverscan(), rows, columns, corner))
            .build();
    }

    private static Region2D reflectNullable(Region2D region, int rows, int columns, ReadoutCorner corner) {
        return region == null ? null : normalize(region, rows, columns, corner);
    }
}
