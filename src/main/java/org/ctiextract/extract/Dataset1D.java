package org.ctiextract.extract;

import java.util.Objects;

import org.ctiextract.grid.Array1D;
import org.ctiextract.grid.ShapeMismatchException;
import org.ctiextract.region.Layout1D;

/**
 * A 1D charge-injection dataset, usually a 2D frame binned along one axis.
 *
 * @param data The measured profile.
 * @param noiseMap Per-pixel noise of {@code data}.
 * @param preCtiData The profile before charge transfer.
 * @param layout Location of the charge injection within the profile.
 */
public record Dataset1D(Array1D data, Array1D noiseMap, Array1D preCtiData, Layout1D layout) {

    public Dataset1D {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(noiseMap, "noiseMap");
        Objects.requireNonNull(preCtiData, "preCtiData");
        Objects.requireNonNull(layout, "layout");
        noiseMap.requireLength(data.length(), "Noise map");
        preCtiData.requireLength(data.length(), "Pre-CTI data");
        if (layout.getLength() != data.length()) {
            throw new ShapeMismatchException(
                "Layout length " + layout.getLength() + " differs from data length " + data.length());
        }
    }
}
