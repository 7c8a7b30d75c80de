package org.ctiextract.extract.calibration;

import java.util.Objects;

import org.ctiextract.grid.Array2D;
import org.ctiextract.region.Layout2D;

/**
 * A cropped frame together with its layout remapped into the cropped coordinates.
 *
 * @param array The cropped values and mask.
 * @param layout The layout of the cropped frame.
 */
public record CalibrationFrame(Array2D array, Layout2D layout) {

    public CalibrationFrame {
        Objects.requireNonNull(array, "array");
        Objects.requireNonNull(layout, "layout");
        array.requireShape(layout.getRows(), layout.getColumns(), "Calibration array");
    }
}
