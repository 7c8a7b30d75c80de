package org.ctiextract.extract.calibration;

import java.util.List;
import java.util.Map;

import org.ctiextract.grid.Array2D;
import org.ctiextract.grid.GridFixtures;
import org.ctiextract.region.EmptyRegionListException;
import org.ctiextract.region.InvalidRegionException;
import org.ctiextract.region.Layout2D;
import org.ctiextract.region.ReadoutCorner;
import org.ctiextract.region.Region2D;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for cropping frames to region rows for serial CTI fits.
 */
@Tag("unit")
class SerialCalibrationExtractorTest {

    private Layout2D layout;
    private SerialCalibrationExtractor extractor;
    private Array2D rowRamp;

    @BeforeEach
    void setUp() {
        layout = Layout2D.builder(5, 5)
            .regionList(List.of(new Region2D(0, 2, 1, 4), new Region2D(3, 5, 1, 4)))
            .serialPrescan(new Region2D(0, 5, 0, 1))
            .serialOverscan(new Region2D(0, 5, 4, 5))
            .parallelOverscan(new Region2D(2, 3, 1, 4))
            .originalCorner(ReadoutCorner.TOP_RIGHT)
            .build();
        extractor = new SerialCalibrationExtractor(layout);
        rowRamp = GridFixtures.gridOf(5, 5, (r, c) -> r);
    }

    @Test
    void takesTheSameRowsOfEveryRegion() {
        assertThat(extractor.extractionRegionListFrom(1, 2))
            .containsExactly(new Region2D(1, 2, 0, 5), new Region2D(4, 5, 0, 5));
    }

    @Test
    void stacksTheRowsInRegionOrder() {
        Array2D cropped = extractor.arrayFrom(rowRamp, 1, 2);

        assertThat(cropped.getShape()).containsExactly(2, 5);
        assertThat(cropped.toArray()).isDeepEqualTo(new double[][]{
            {1, 1, 1, 1, 1},
            {4, 4, 4, 4, 4}});
    }

    @Test
    void eachRegionKeepsItsOwnRegion() {
        Layout2D cropped = extractor.layoutFrom(1, 2);

        assertThat(cropped.getShape()).containsExactly(2, 5);
        assertThat(cropped.getRegionList()).containsExactly(new Region2D(0, 1, 1, 4), new Region2D(1, 2, 1, 4));
        assertThat(cropped.getSerialPrescan()).isEqualTo(new Region2D(0, 2, 0, 1));
        assertThat(cropped.getSerialOverscan()).isEqualTo(new Region2D(0, 2, 4, 5));
        assertThat(cropped.getParallelOverscan()).isNull();
        assertThat(cropped.getOriginalCorner()).isEqualTo(ReadoutCorner.TOP_RIGHT);
    }

    @Test
    void frameAndLayoutAgree() {
        CalibrationFrame frame = extractor.frameFrom(rowRamp, 0, 2);

        assertThat(frame.array().getShape()).containsExactly(4, 5);
        assertThat(frame.layout().getRegionList()).hasSize(2);
        assertThat(frame.array().get(2, 0)).isEqualTo(3.0);
    }

    @Test
    void imagingStacksNoiseScalingMapsLikeTheImage() {
        Array2D columnRamp = GridFixtures.gridOf(5, 5, (r, c) -> c);
        CalibrationImaging imaging = new CalibrationImaging(rowRamp, rowRamp.copy(), rowRamp.copy(), null, layout,
            Map.of("rows", rowRamp.copy(), "columns", columnRamp));

        CalibrationImaging cropped = extractor.imagingFrom(imaging, 1, 2);

        assertThat(cropped.noiseScalingMaps().get("rows").toArray()).isDeepEqualTo(cropped.image().toArray());
        assertThat(cropped.noiseScalingMaps().get("columns").toArray()).isDeepEqualTo(new double[][]{
            {0, 1, 2, 3, 4},
            {0, 1, 2, 3, 4}});
        assertThat(cropped.layout().getShape()).containsExactly(2, 5);
        assertThat(cropped.cosmicRayMap()).isNull();
    }

    @Test
    void rowsMustLieWithinEveryRegion() {
        assertThatThrownBy(() -> extractor.layoutFrom(1, 3)).isInstanceOf(InvalidRegionException.class);
        assertThatThrownBy(() -> extractor.arrayFrom(rowRamp, -1, 1)).isInstanceOf(InvalidRegionException.class);
    }

    @Test
    void needsRegions() {
        assertThatThrownBy(() -> new SerialCalibrationExtractor(Layout2D.builder(5, 5).build()))
            .isInstanceOf(EmptyRegionListException.class);
    }
}
