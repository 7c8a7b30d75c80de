package org.ctiextract.extract;

import java.util.ArrayList;
import java.util.List;

import org.ctiextract.grid.Array2D;
import org.ctiextract.region.ExtractionWindow;
import org.ctiextract.region.Layout2D;
import org.ctiextract.region.Region2D;

/**
 * Whole-frame views of a 2D charge-injection frame: the injected regions only, everything but the
 * injected regions, and composites of FPRs and EPERs.
 */
public class ExtractorMisc2D {

    private final Layout2D layout;
    private final Extractor2D parallelFpr;
    private final Extractor2D parallelEper;
    private final Extractor2D serialFpr;
    private final Extractor2D serialEper;

    public ExtractorMisc2D(Layout2D layout) {
        this.layout = layout;
        this.parallelFpr = new Extractor2D(ExtractorKind2D.PARALLEL_FPR, layout);
        this.parallelEper = new Extractor2D(ExtractorKind2D.PARALLEL_EPER, layout);
        this.serialFpr = new Extractor2D(ExtractorKind2D.SERIAL_FPR, layout);
        this.serialEper = new Extractor2D(ExtractorKind2D.SERIAL_EPER, layout);
    }

    /**
     * @return A zero frame holding the values of {@code grid} inside the charge-injection regions.
     */
    public Array2D regionsArrayFrom(Array2D grid) {
        grid.requireShape(layout.getRows(), layout.getColumns(), "Grid");
        Array2D result = Array2D.zerosLike(grid);
        for (Region2D region : layout.getRegionList()) {
            result.addPatch(region, grid.slice(region));
        }
        return result;
    }

    /**
     * @return {@code grid} with the charge-injection regions set to zero.
     */
    public Array2D nonRegionsArrayFrom(Array2D grid) {
        grid.requireShape(layout.getRows(), layout.getColumns(), "Grid");
        return grid.withRegionsZeroed(layout.getRegionList());
    }

    /**
     * @return {@code grid} with the charge-injection regions, serial prescan and serial overscan set
     *         to zero, leaving the parallel EPERs and the parallel overscan.
     */
    public Array2D parallelEpersArrayFrom(Array2D grid) {
        List<Region2D> cleared = new ArrayList<>(layout.getRegionList());
        if (layout.getSerialPrescan() != null) {
            cleared.add(layout.getSerialPrescan());
        }
        if (layout.getSerialOverscan() != null) {
            cleared.add(layout.getSerialOverscan());
        }
        grid.requireShape(layout.getRows(), layout.getColumns(), "Grid");
        return grid.withRegionsZeroed(cleared);
    }

    /**
     * @param fprWindow Window of the parallel FPRs, or {@code null} to leave them out.
     * @param eperWindow Window of the parallel EPERs, or {@code null} to leave them out.
     * @return A zero frame with the selected parallel FPRs and EPERs of {@code grid} added in.
     */
    public Array2D parallelFprsAndEpersArrayFrom(Array2D grid, ExtractionWindow fprWindow, ExtractionWindow eperWindow) {
        return composite(grid, parallelFpr, fprWindow, parallelEper, eperWindow);
    }

    /**
     * @param fprWindow Window of the serial FPRs, or {@code null} to leave them out.
     * @param eperWindow Window of the serial EPERs, or {@code null} to leave them out.
     * @return A zero frame with the selected serial FPRs and EPERs of {@code grid} added in.
     */
    public Array2D serialFprsAndEpersArrayFrom(Array2D grid, ExtractionWindow fprWindow, ExtractionWindow eperWindow) {
        return composite(grid, serialFpr, fprWindow, serialEper, eperWindow);
    }

    /**
     * @return A zero frame holding the serial EPERs of {@code grid} across the full serial overscan width.
     * @throws IllegalStateException if the layout has no serial overscan.
     */
    public Array2D serialEpersArrayFrom(Array2D grid) {
        Region2D overscan = layout.getSerialOverscan();
        if (overscan == null) {
            throw new IllegalStateException("Layout does not declare a serial overscan");
        }
        return serialFprsAndEpersArrayFrom(grid, null, ExtractionWindow.pixels(0, overscan.totalColumns()));
    }

    private static Array2D composite(Array2D grid, Extractor2D fpr, ExtractionWindow fprWindow,
                                     Extractor2D eper, ExtractionWindow eperWindow) {
        Array2D result = Array2D.zerosLike(grid);
        if (fprWindow != null) {
            fpr.scatterInto(result, grid, fprWindow);
        }
        if (eperWindow != null) {
            eper.scatterInto(result, grid, eperWindow);
        }
        return result;
    }
}
