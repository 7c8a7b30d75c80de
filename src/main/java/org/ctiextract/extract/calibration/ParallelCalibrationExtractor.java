package org.ctiextract.extract.calibration;

import org.ctiextract.grid.Array2D;
import org.ctiextract.region.EmptyRegionListException;
import org.ctiextract.region.Layout2D;
import org.ctiextract.region.Region2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Crops a frame to a full-height strip of columns for fitting parallel CTI.
 * <p>
 * The strip spans {@code [x0 + start, x0 + end)} of the first charge-injection region. Regions and
 * structures are intersected with the strip and shifted into its coordinates; those that do not
 * intersect it are dropped.
 */
public class ParallelCalibrationExtractor implements ICalibrationExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(ParallelCalibrationExtractor.class);

    private final Layout2D layout;

    /**
     * @param layout The full-frame layout, with at least one region.
     * @throws EmptyRegionListException if the layout has no regions.
     */
    public ParallelCalibrationExtractor(Layout2D layout) {
        if (layout.getRegionList().isEmpty()) {
            throw new EmptyRegionListException("Parallel calibration needs at least one charge-injection region");
        }
        this.layout = layout;
    }

    /**
     * @param start First column relative to the first region's {@code x0}.
     * @param end End column relative to the first region's {@code x0}, exclusive.
     * @return The strip in full-frame coordinates.
     * @throws org.ctiextract.region.InvalidRegionException if the strip is empty or leaves the frame.
     */
    public Region2D extractionRegionFrom(int start, int end) {
        int x0 = layout.getRegionList().get(0).x0();
        Region2D extraction = new Region2D(0, layout.getRows(), x0 + start, x0 + end);
        extraction.checkWithin(layout.getRows(), layout.getColumns());
        return extraction;
    }

    @Override
    public Array2D arrayFrom(Array2D grid, int start, int end) {
        grid.requireShape(layout.getRows(), layout.getColumns(), "Grid");
        return grid.slice(extractionRegionFrom(start, end));
    }

    /**
     * @throws EmptyRegionListException if no charge-injection region intersects the strip.
     */
    @Override
    public Layout2D layoutFrom(int start, int end) {
        Region2D extraction = extractionRegionFrom(start, end);
        Layout2D extracted = layout.layoutExtractedFrom(extraction);
        if (extracted.getRegionList().isEmpty()) {
            throw new EmptyRegionListException("No charge-injection region intersects columns " + extraction);
        }
        int dropped = layout.getRegionList().size() - extracted.getRegionList().size();
        if (dropped > 0) {
            LOG.warn("Dropped {} charge-injection regions outside calibration strip {}", dropped, extraction);
        }
        warnIfDropped(layout.getSerialPrescan(), extracted.getSerialPrescan(), "serial prescan", extraction);
        warnIfDropped(layout.getSerialOverscan(), extracted.getSerialOverscan(), "serial overscan", extraction);
        warnIfDropped(layout.getParallelOverscan(), extracted.getParallelOverscan(), "parallel overscan", extraction);
        return extracted;
    }

    private static void warnIfDropped(Region2D before, Region2D after, String name, Region2D extraction) {
        if (before != null && after == null) {
            LOG.warn("Dropped {} {} outside calibration strip {}", name, before, extraction);
        }
    }
}
