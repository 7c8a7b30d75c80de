package org.ctiextract.extract;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.ctiextract.grid.Array1D;
import org.ctiextract.grid.Array2D;
import org.ctiextract.grid.GridFixtures;
import org.ctiextract.grid.ShapeMismatchException;
import org.ctiextract.grid.Statistic;
import org.ctiextract.random.SeededRandomProvider;
import org.ctiextract.region.EmptyRegionListException;
import org.ctiextract.region.ExtractionWindow;
import org.ctiextract.region.InvalidRegionException;
import org.ctiextract.region.Layout2D;
import org.ctiextract.region.Region1D;
import org.ctiextract.region.Region2D;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for the generic 2D extractor over the charge-injection kinds.
 */
@Tag("unit")
class Extractor2DTest {

    @Nested
    @DisplayName("Column ramp")
    class ColumnRamp {

        private final Array2D grid = GridFixtures.gridOf(3, 10, (r, c) -> c);
        private final Layout2D layout = Layout2D.of(3, 10, List.of(new Region2D(0, 3, 1, 4)));

        @Test
        void serialEperReturnsColumnAfterRegion() {
            Extractor2D eper = new Extractor2D(ExtractorKind2D.SERIAL_EPER, layout);

            List<Array2D> patches = eper.patchListFrom(grid, ExtractionWindow.pixels(0, 1));

            assertThat(patches).hasSize(1);
            assertThat(patches.get(0).toArray()).isDeepEqualTo(new double[][]{{4.0}, {4.0}, {4.0}});
        }

        @Test
        void serialFprReturnsFirstColumnOfRegion() {
            Extractor2D fpr = new Extractor2D(ExtractorKind2D.SERIAL_FPR, layout);

            List<Array2D> patches = fpr.patchListFrom(grid, ExtractionWindow.pixels(0, 1));

            assertThat(patches.get(0).toArray()).isDeepEqualTo(new double[][]{{1.0}, {1.0}, {1.0}});
        }

        @Test
        void serialEperFromEndMeasuresFromGridEdge() {
            Extractor2D eper = new Extractor2D(ExtractorKind2D.SERIAL_EPER, layout);

            assertThat(eper.regionListFrom(ExtractionWindow.fromEnd(2))).containsExactly(new Region2D(0, 3, 8, 10));
            assertThat(eper.regionListFrom(ExtractionWindow.full())).containsExactly(new Region2D(0, 3, 4, 10));
        }

        @Test
        void windowPastGridEdgeIsRejected() {
            Extractor2D eper = new Extractor2D(ExtractorKind2D.SERIAL_EPER, layout);

            assertThatThrownBy(() -> eper.regionListFrom(ExtractionWindow.pixels(0, 7)))
                .isInstanceOf(InvalidRegionException.class);
        }

        @Test
        void gridOfOtherShapeIsRejected() {
            Extractor2D fpr = new Extractor2D(ExtractorKind2D.SERIAL_FPR, layout);

            assertThatThrownBy(() -> fpr.patchListFrom(Array2D.zeros(3, 9), ExtractionWindow.pixels(0, 1)))
                .isInstanceOf(ShapeMismatchException.class);
        }
    }

    @Nested
    @DisplayName("Stacking")
    class Stacking {

        private final Layout2D layout = Layout2D.of(4, 3, List.of(new Region2D(0, 2, 0, 3), new Region2D(2, 4, 0, 3)));
        private final Extractor2D fpr = new Extractor2D(ExtractorKind2D.PARALLEL_FPR, layout);

        @Test
        void partiallyMaskedCellTakesUnmaskedContributor() {
            double[][] values = {
                {1, 2, 3},
                {4, 5, 6},
                {1, 99, 3},
                {4, 5, 6}
            };
            boolean[][] mask = new boolean[4][3];
            mask[0][1] = true;

            Array2D stacked = fpr.stackedFrom(Array2D.of(values, mask), ExtractionWindow.pixels(0, 2));

            assertThat(stacked.get(0, 1)).isEqualTo(99.0);
            assertThat(stacked.isMasked(0, 1)).isFalse();
            assertThat(stacked.get(1, 2)).isEqualTo(6.0);
            assertThat(fpr.stackedTotalPixelsFrom(Array2D.of(values, mask), ExtractionWindow.pixels(0, 2))[0])
                .containsExactly(2, 1, 2);
        }

        @Test
        void cellMaskedEverywhereStaysMasked() {
            boolean[][] mask = new boolean[4][3];
            mask[0][2] = true;
            mask[2][2] = true;
            Array2D grid = GridFixtures.gridOf(4, 3, (r, c) -> r + c).withMask(mask);

            Array2D stacked = fpr.stackedFrom(grid, ExtractionWindow.pixels(0, 2));

            assertThat(stacked.isMasked(0, 2)).isTrue();
            assertThat(stacked.get(0, 2)).isZero();
        }

        @Test
        void stackedIsInvariantUnderRegionPermutation() {
            List<Region2D> regions = new ArrayList<>(List.of(
                new Region2D(0, 3, 0, 4), new Region2D(4, 7, 0, 4), new Region2D(8, 11, 0, 4), new Region2D(12, 15, 0, 4)));
            Array2D grid = GridFixtures.gridOf(16, 4, (r, c) -> Math.sin(r * 7.3 + c) * 1e3 + 0.1 * r);
            Array2D expected = new Extractor2D(ExtractorKind2D.PARALLEL_FPR, Layout2D.of(16, 4, regions))
                .stackedFrom(grid, ExtractionWindow.pixels(0, 3));

            for (int seed = 0; seed < 5; seed++) {
                Collections.shuffle(regions, new Random(seed));
                Array2D permuted = new Extractor2D(ExtractorKind2D.PARALLEL_FPR, Layout2D.of(16, 4, regions))
                    .stackedFrom(grid, ExtractionWindow.pixels(0, 3));
                assertThat(permuted).isEqualTo(expected);
            }
        }

        @Test
        void trailingWindowsOfDifferentLengthCannotBeStacked() {
            Layout2D uneven = Layout2D.of(10, 3, List.of(new Region2D(0, 2, 0, 3), new Region2D(4, 5, 0, 3)));
            Extractor2D eper = new Extractor2D(ExtractorKind2D.PARALLEL_EPER, uneven);

            assertThatThrownBy(() -> eper.stackedFrom(Array2D.zeros(10, 3), ExtractionWindow.full()))
                .isInstanceOf(ShapeMismatchException.class);
        }

        @Test
        void emptyRegionListCannotBeStacked() {
            Extractor2D empty = new Extractor2D(ExtractorKind2D.PARALLEL_FPR, Layout2D.builder(4, 3).build());

            assertThat(empty.regionListFrom(ExtractionWindow.pixels(0, 1))).isEmpty();
            assertThat(empty.patchListFrom(Array2D.zeros(4, 3), ExtractionWindow.pixels(0, 1))).isEmpty();
            assertThatThrownBy(() -> empty.stackedFrom(Array2D.zeros(4, 3), ExtractionWindow.pixels(0, 1)))
                .isInstanceOf(EmptyRegionListException.class);
            assertThatThrownBy(() -> empty.binnedFrom(Array2D.zeros(4, 3), ExtractionWindow.pixels(0, 1)))
                .isInstanceOf(EmptyRegionListException.class);
        }
    }

    @Nested
    @DisplayName("Binning")
    class Binning {

        private final Layout2D layout = Layout2D.of(10, 6, List.of(new Region2D(1, 4, 1, 5), new Region2D(6, 9, 1, 5)));

        @Test
        void binningCollapsesTheOrthogonalAxis() {
            Array2D grid = GridFixtures.gridOf(10, 6, (r, c) -> 10 * r + c);

            Array1D parallel = new Extractor2D(ExtractorKind2D.PARALLEL_FPR, layout)
                .binnedFrom(grid, ExtractionWindow.pixels(0, 2));
            Array1D serial = new Extractor2D(ExtractorKind2D.SERIAL_FPR, layout)
                .binnedFrom(grid, ExtractionWindow.pixels(0, 2));

            assertThat(parallel.toArray()).containsExactly(37.5, 47.5);
            assertThat(serial.toArray()).containsExactly(46.0, 47.0);
        }

        @Test
        void binnedEqualsOrthogonalMeanOfStacked() {
            boolean[][] mask = new boolean[10][6];
            mask[1][2] = true;
            mask[6][2] = true;
            mask[2][4] = true;
            Array2D grid = GridFixtures.gridOf(10, 6, (r, c) -> r * r - 3 * c + 0.25).withMask(mask);

            for (ExtractorKind2D kind : List.of(ExtractorKind2D.PARALLEL_FPR, ExtractorKind2D.SERIAL_FPR)) {
                Extractor2D extractor = new Extractor2D(kind, layout);
                ExtractionWindow window = ExtractionWindow.pixels(0, 3);
                Array2D stacked = extractor.stackedFrom(grid, window);
                Array1D binned = extractor.binnedFrom(grid, window);

                boolean parallel = kind == ExtractorKind2D.PARALLEL_FPR;
                int lines = parallel ? stacked.getRows() : stacked.getColumns();
                int across = parallel ? stacked.getColumns() : stacked.getRows();
                assertThat(binned.length()).isEqualTo(lines);
                for (int i = 0; i < lines; i++) {
                    double sum = 0;
                    int count = 0;
                    for (int j = 0; j < across; j++) {
                        int r = parallel ? i : j;
                        int c = parallel ? j : i;
                        if (!stacked.isMasked(r, c)) {
                            sum += stacked.get(r, c);
                            count++;
                        }
                    }
                    assertThat(binned.get(i)).isCloseTo(sum / count, within(1e-12));
                }
            }
        }

        @Test
        void binnedTotalPixelsCountsUnmaskedContributors() {
            boolean[][] mask = new boolean[10][6];
            mask[1][2] = true;
            Array2D grid = Array2D.zeros(10, 6).withMask(mask);
            Extractor2D fpr = new Extractor2D(ExtractorKind2D.PARALLEL_FPR, layout);

            assertThat(fpr.binnedTotalPixelsFrom(grid, ExtractionWindow.pixels(0, 2))).containsExactly(7, 8);
        }
    }

    @Nested
    @DisplayName("Statistics")
    class Statistics {

        private final Layout2D layout = Layout2D.of(6, 3, List.of(new Region2D(0, 2, 0, 3), new Region2D(3, 5, 0, 3)));
        private final Extractor2D fpr = new Extractor2D(ExtractorKind2D.PARALLEL_FPR, layout);
        private final Array2D grid = GridFixtures.gridOf(6, 3, (r, c) -> 10 * r + c);

        @Test
        void perRegionStatistic() {
            assertThat(fpr.statisticListFrom(grid, ExtractionWindow.pixels(0, 2), Statistic.MEAN))
                .containsExactly(6.0, 36.0);
            assertThat(fpr.statisticListFrom(grid, ExtractionWindow.pixels(0, 1), Statistic.MEDIAN))
                .containsExactly(1.0, 31.0);
        }

        @Test
        void perLineStatisticPoolsAllRegions() {
            // column 0 pools 0, 10, 30, 40
            assertThat(fpr.statisticListPerLineFrom(grid, ExtractionWindow.pixels(0, 2), Statistic.MEDIAN))
                .containsExactly(20.0, 21.0, 22.0);
        }

        @Test
        void perRegionPerLineStatistic() {
            List<double[]> lists = fpr.statisticListsPerRegionFrom(grid, ExtractionWindow.pixels(0, 2), Statistic.MEAN);

            assertThat(lists).hasSize(2);
            assertThat(lists.get(0)).containsExactly(5.0, 6.0, 7.0);
            assertThat(lists.get(1)).containsExactly(35.0, 36.0, 37.0);
        }

        @Test
        void fullyMaskedRegionGivesNaN() {
            boolean[][] mask = new boolean[6][3];
            for (boolean[] row : mask) {
                Arrays.fill(row, true);
            }
            double[] result = fpr.statisticListFrom(grid.withMask(mask), ExtractionWindow.pixels(0, 1), Statistic.MEAN);

            assertThat(result[0]).isNaN();
        }
    }

    @Nested
    @DisplayName("Scatter")
    class Scatter {

        private final Layout2D layout = Layout2D.of(12, 8, List.of(new Region2D(1, 4, 2, 6), new Region2D(7, 10, 2, 6)));
        private final Array2D grid = GridFixtures.gridOf(12, 8, (r, c) -> 1.5 * r - c + 0.125);

        @Test
        void scatterReproducesPatchesAndLeavesRestZero() {
            for (ExtractorKind2D kind : List.of(ExtractorKind2D.PARALLEL_FPR, ExtractorKind2D.PARALLEL_EPER,
                ExtractorKind2D.SERIAL_FPR, ExtractorKind2D.SERIAL_EPER)) {
                Extractor2D extractor = new Extractor2D(kind, layout);
                ExtractionWindow window = ExtractionWindow.pixels(0, 2);
                Array2D accumulator = Array2D.zerosLike(grid);

                extractor.scatterInto(accumulator, grid, window);

                List<Region2D> regions = extractor.regionListFrom(window);
                List<Array2D> patches = extractor.patchListFrom(grid, window);
                for (int i = 0; i < regions.size(); i++) {
                    assertThat(accumulator.slice(regions.get(i)).toArray()).isDeepEqualTo(patches.get(i).toArray());
                }
                boolean[][] covered = extractor.maskFrom(window, false);
                for (int r = 0; r < 12; r++) {
                    for (int c = 0; c < 8; c++) {
                        if (!covered[r][c]) {
                            assertThat(accumulator.get(r, c)).as("%s at (%d, %d)", kind, r, c).isZero();
                        }
                    }
                }
            }
        }

        @Test
        void scatterAddsToExistingValues() {
            Extractor2D fpr = new Extractor2D(ExtractorKind2D.PARALLEL_FPR, layout);
            Array2D accumulator = fpr.scatteredFrom(grid, ExtractionWindow.pixels(0, 1));

            fpr.scatterInto(accumulator, grid, ExtractionWindow.pixels(0, 1));

            assertThat(accumulator.get(1, 2)).isEqualTo(2 * grid.get(1, 2));
        }

        @Test
        void accumulatorMustNotBeSource() {
            Extractor2D fpr = new Extractor2D(ExtractorKind2D.PARALLEL_FPR, layout);
            Array2D copy = grid.copy();

            assertThatThrownBy(() -> fpr.scatterInto(copy, copy, ExtractionWindow.pixels(0, 1)))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void accumulatorMustMatchShape() {
            Extractor2D fpr = new Extractor2D(ExtractorKind2D.PARALLEL_FPR, layout);

            assertThatThrownBy(() -> fpr.scatterInto(Array2D.zeros(12, 7), grid, ExtractionWindow.pixels(0, 1)))
                .isInstanceOf(ShapeMismatchException.class);
        }

        @Test
        void emptyRegionListIsNoOp() {
            Extractor2D fpr = new Extractor2D(ExtractorKind2D.PARALLEL_FPR, Layout2D.builder(12, 8).build());

            assertThat(fpr.scatteredFrom(grid, ExtractionWindow.pixels(0, 1))).isEqualTo(Array2D.zerosLike(grid));
        }
    }

    @Test
    void maskFromFlagsDerivedRegions() {
        Extractor2D fpr = new Extractor2D(ExtractorKind2D.PARALLEL_FPR,
            Layout2D.of(4, 3, List.of(new Region2D(1, 3, 0, 2))));

        boolean[][] mask = fpr.maskFrom(ExtractionWindow.pixels(0, 1), false);
        boolean[][] inverted = fpr.maskFrom(ExtractionWindow.pixels(0, 1), true);

        assertThat(mask).isDeepEqualTo(new boolean[][]{
            {false, false, false}, {true, true, false}, {false, false, false}, {false, false, false}});
        assertThat(inverted[1][0]).isFalse();
        assertThat(inverted[0][0]).isTrue();
    }

    @Nested
    @DisplayName("Noise injection")
    class Noise {

        private final Layout2D layout = Layout2D.of(6, 4, List.of(new Region2D(0, 2, 0, 4)));
        private final Extractor2D eper = new Extractor2D(ExtractorKind2D.PARALLEL_EPER, layout);
        private final Array2D grid = GridFixtures.gridOf(6, 4, (r, c) -> r);

        @Test
        void sameSeedGivesSameNoise() {
            Array2D first = eper.addGaussianNoiseTo(grid, ExtractionWindow.pixels(0, 2), 2.0, new SeededRandomProvider(11));
            Array2D second = eper.addGaussianNoiseTo(grid, ExtractionWindow.pixels(0, 2), 2.0, new SeededRandomProvider(11));

            assertThat(first).isEqualTo(second);
            assertThat(first).isNotEqualTo(grid);
        }

        @Test
        void noiseOnlyTouchesDerivedRegions() {
            Array2D noisy = eper.addGaussianNoiseTo(grid, ExtractionWindow.pixels(0, 2), 5.0, new SeededRandomProvider(1));

            for (int c = 0; c < 4; c++) {
                assertThat(noisy.get(0, c)).isEqualTo(grid.get(0, c));
                assertThat(noisy.get(4, c)).isEqualTo(grid.get(4, c));
            }
            assertThat(grid.get(2, 0)).isEqualTo(2.0);
        }

        @Test
        void negativeSigmaIsRejected() {
            assertThatThrownBy(() -> eper.addGaussianNoiseTo(grid, ExtractionWindow.pixels(0, 1), -1.0,
                new SeededRandomProvider(1)))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("1D datasets")
    class Datasets {

        private final Layout2D layout = Layout2D.of(10, 3, List.of(new Region2D(1, 4, 0, 3), new Region2D(6, 9, 0, 3)));

        @Test
        void binnedRegionOfFprWindows() {
            Extractor2D fpr = new Extractor2D(ExtractorKind2D.PARALLEL_FPR, layout);

            assertThat(fpr.binnedRegion1DFrom(ExtractionWindow.pixels(0, 3))).contains(new Region1D(0, 3));
            assertThat(fpr.binnedRegion1DFrom(ExtractionWindow.pixels(-1, 3))).contains(new Region1D(1, 4));
            assertThat(fpr.binnedRegion1DFrom(ExtractionWindow.fromEnd(2))).contains(new Region1D(0, 2));
        }

        @Test
        void binnedRegionOfEperWindows() {
            Extractor2D eper = new Extractor2D(ExtractorKind2D.PARALLEL_EPER, layout);

            assertThat(eper.binnedRegion1DFrom(ExtractionWindow.pixels(0, 2))).isEmpty();
            assertThat(eper.binnedRegion1DFrom(ExtractionWindow.pixels(-1, 2))).contains(new Region1D(0, 1));
        }

        @Test
        void datasetScalesNoiseByContributors() {
            Extractor2D fpr = new Extractor2D(ExtractorKind2D.PARALLEL_FPR, layout);
            Array2D data = GridFixtures.gridOf(10, 3, (r, c) -> r);
            Array2D noise = GridFixtures.gridOf(10, 3, (r, c) -> 2.0);
            Array2D preCti = GridFixtures.gridOf(10, 3, (r, c) -> 1.0);

            Dataset1D dataset = fpr.dataset1DFrom(data, noise, preCti, ExtractionWindow.pixels(0, 2));

            assertThat(dataset.data().toArray()).containsExactly(3.5, 4.5);
            assertThat(dataset.noiseMap().get(0)).isCloseTo(2.0 / Math.sqrt(6), within(1e-12));
            assertThat(dataset.preCtiData().toArray()).containsExactly(1.0, 1.0);
            assertThat(dataset.layout().getRegionList()).containsExactly(new Region1D(0, 2));
        }
    }
}
