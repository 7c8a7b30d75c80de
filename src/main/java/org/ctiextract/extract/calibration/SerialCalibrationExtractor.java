package org.ctiextract.extract.calibration;

import java.util.ArrayList;
import java.util.List;

import org.ctiextract.grid.Array2D;
import org.ctiextract.region.EmptyRegionListException;
import org.ctiextract.region.InvalidRegionException;
import org.ctiextract.region.Layout2D;
import org.ctiextract.region.Region2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Crops a frame to selected rows of every charge-injection region for fitting serial CTI.
 * <p>
 * Rows {@code [y0 + start, y0 + end)} of each region are taken at full width and stacked in
 * region order. Each region yields its own region in the new frame, so regions are never merged.
 * The serial prescan and overscan keep their columns and span the new height; the parallel
 * overscan has no counterpart and is dropped.
 */
public class SerialCalibrationExtractor implements ICalibrationExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(SerialCalibrationExtractor.class);

    private final Layout2D layout;

    /**
     * @param layout The full-frame layout, with at least one region.
     * @throws EmptyRegionListException if the layout has no regions.
     */
    public SerialCalibrationExtractor(Layout2D layout) {
        if (layout.getRegionList().isEmpty()) {
            throw new EmptyRegionListException("Serial calibration needs at least one charge-injection region");
        }
        this.layout = layout;
    }

    /**
     * @param start First row relative to each region's {@code y0}.
     * @param end End row relative to each region's {@code y0}, exclusive.
     * @return The full-width row blocks taken from each region, in region order.
     * @throws InvalidRegionException if the rows do not lie within every region.
     */
    public List<Region2D> extractionRegionListFrom(int start, int end) {
        List<Region2D> blocks = new ArrayList<>();
        for (Region2D region : layout.getRegionList()) {
            if (start < 0 || end > region.totalRows()) {
                throw new InvalidRegionException("Rows [" + start + ", " + end + ") do not lie within region "
                    + region + " of " + region.totalRows() + " rows");
            }
            blocks.add(new Region2D(region.y0() + start, region.y0() + end, 0, layout.getColumns()));
        }
        return blocks;
    }

    @Override
    public Array2D arrayFrom(Array2D grid, int start, int end) {
        grid.requireShape(layout.getRows(), layout.getColumns(), "Grid");
        List<Array2D> blocks = new ArrayList<>();
        for (Region2D block : extractionRegionListFrom(start, end)) {
            blocks.add(grid.slice(block));
        }
        return Array2D.concatenateRows(blocks);
    }

    @Override
    public Layout2D layoutFrom(int start, int end) {
        List<Region2D> blocks = extractionRegionListFrom(start, end);
        int blockRows = end - start;
        int newRows = blockRows * blocks.size();
        List<Region2D> regions = new ArrayList<>(blocks.size());
        int offset = 0;
        for (Region2D region : layout.getRegionList()) {
            regions.add(new Region2D(offset, offset + blockRows, region.x0(), region.x1()));
            offset += blockRows;
        }
        if (layout.getParallelOverscan() != null) {
            LOG.warn("Dropped parallel overscan {} from serial calibration frame", layout.getParallelOverscan());
        }
        return Layout2D.builder(newRows, layout.getColumns())
            .regionList(regions)
            .originalCorner(layout.getOriginalCorner())
            .serialPrescan(spanRows(layout.getSerialPrescan(), newRows))
            .serialOverscan(spanRows(layout.getSerialOverscan(), newRows))
            .build();
    }

    private static Region2D spanRows(Region2D structure, int rows) {
        return structure == null ? null : new Region2D(0, rows, structure.x0(), structure.x1());
    }
}
