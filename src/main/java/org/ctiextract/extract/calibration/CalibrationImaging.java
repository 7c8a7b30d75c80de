package org.ctiextract.extract.calibration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.ctiextract.extract.Dataset1D;
import org.ctiextract.extract.Extractor2D;
import org.ctiextract.extract.ExtractorKind2D;
import org.ctiextract.grid.Array2D;
import org.ctiextract.region.ExtractionWindow;
import org.ctiextract.region.Layout2D;

/**
 * A 2D charge-injection dataset: the measured image, its noise map, the image before charge
 * transfer, an optional cosmic-ray map, named noise-scaling maps and the layout they share.
 *
 * @param image The measured image.
 * @param noiseMap Per-pixel noise of the image.
 * @param preCtiData The injected charge before transfer.
 * @param cosmicRayMap Cosmic-ray hits, or {@code null}.
 * @param layout The frame layout.
 * @param noiseScalingMaps Maps scaling the noise of selected pixels, keyed by name, in insertion
 *                         order; empty if there are none.
 */
public record CalibrationImaging(Array2D image, Array2D noiseMap, Array2D preCtiData,
                                 Array2D cosmicRayMap, Layout2D layout,
                                 Map<String, Array2D> noiseScalingMaps) {

    public CalibrationImaging {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(noiseMap, "noiseMap");
        Objects.requireNonNull(preCtiData, "preCtiData");
        Objects.requireNonNull(layout, "layout");
        image.requireShape(layout.getRows(), layout.getColumns(), "Image");
        noiseMap.requireShape(layout.getRows(), layout.getColumns(), "Noise map");
        preCtiData.requireShape(layout.getRows(), layout.getColumns(), "Pre-CTI data");
        if (cosmicRayMap != null) {
            cosmicRayMap.requireShape(layout.getRows(), layout.getColumns(), "Cosmic-ray map");
        }
        if (noiseScalingMaps == null) {
            noiseScalingMaps = Map.of();
        } else {
            for (Map.Entry<String, Array2D> entry : noiseScalingMaps.entrySet()) {
                Objects.requireNonNull(entry.getValue(), "noise-scaling map " + entry.getKey());
                entry.getValue().requireShape(layout.getRows(), layout.getColumns(),
                    "Noise-scaling map '" + entry.getKey() + "'");
            }
            noiseScalingMaps = Collections.unmodifiableMap(new LinkedHashMap<>(noiseScalingMaps));
        }
    }

    /**
     * A dataset without noise-scaling maps.
     */
    public CalibrationImaging(Array2D image, Array2D noiseMap, Array2D preCtiData,
                              Array2D cosmicRayMap, Layout2D layout) {
        this(image, noiseMap, preCtiData, cosmicRayMap, layout, Map.of());
    }

    /**
     * Bins this dataset into a 1D dataset with the extractor of {@code kind}.
     *
     * @param kind The extractor kind.
     * @param window The extraction window.
     * @return The binned dataset.
     */
    public Dataset1D dataset1DFrom(ExtractorKind2D kind, ExtractionWindow window) {
        return new Extractor2D(kind, layout).dataset1DFrom(image, noiseMap, preCtiData, window);
    }
}
