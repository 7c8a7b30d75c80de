package org.ctiextract.extract.calibration;

import java.util.LinkedHashMap;
import java.util.Map;

import org.ctiextract.grid.Array2D;
import org.ctiextract.region.Layout2D;

/**
 * Crops a full frame to a sub-range of one axis and remaps its layout into the cropped frame.
 * The range is relative: columns from the first region's {@code x0} for parallel calibration,
 * rows from each region's {@code y0} for serial calibration.
 */
public interface ICalibrationExtractor {

    /**
     * @param grid A frame of the layout's shape.
     * @param start First pixel of the range, inclusive.
     * @param end Last pixel of the range, exclusive.
     * @return The cropped values and mask.
     */
    Array2D arrayFrom(Array2D grid, int start, int end);

    /**
     * @param start First pixel of the range, inclusive.
     * @param end Last pixel of the range, exclusive.
     * @return The layout of the cropped frame.
     */
    Layout2D layoutFrom(int start, int end);

    /**
     * @return The cropped frame and its layout.
     */
    default CalibrationFrame frameFrom(Array2D grid, int start, int end) {
        return new CalibrationFrame(arrayFrom(grid, start, end), layoutFrom(start, end));
    }

    /**
     * Crops every map of a dataset the same way, noise-scaling maps included.
     *
     * @param imaging A dataset with this extractor's layout.
     * @param start First pixel of the range, inclusive.
     * @param end Last pixel of the range, exclusive.
     * @return The cropped dataset.
     */
    default CalibrationImaging imagingFrom(CalibrationImaging imaging, int start, int end) {
        Array2D cosmicRayMap = imaging.cosmicRayMap() == null
            ? null
            : arrayFrom(imaging.cosmicRayMap(), start, end);
        Map<String, Array2D> noiseScalingMaps = new LinkedHashMap<>();
        for (Map.Entry<String, Array2D> entry : imaging.noiseScalingMaps().entrySet()) {
            noiseScalingMaps.put(entry.getKey(), arrayFrom(entry.getValue(), start, end));
        }
        return new CalibrationImaging(
            arrayFrom(imaging.image(), start, end),
            arrayFrom(imaging.noiseMap(), start, end),
            arrayFrom(imaging.preCtiData(), start, end),
            cosmicRayMap,
            layoutFrom(start, end),
            noiseScalingMaps);
    }
}
