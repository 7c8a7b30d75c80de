package org.ctiextract.grid;

import java.util.BitSet;
import java.util.List;

import org.ctiextract.region.InvalidRegionException;
import org.ctiextract.region.Region2D;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for Array2D construction, slicing and accumulation.
 */
@Tag("unit")
class Array2DTest {

    private static Array2D grid() {
        return Array2D.of(new double[][]{
            {0, 1, 2, 3},
            {4, 5, 6, 7},
            {8, 9, 10, 11}
        });
    }

    @Test
    void rejectsRaggedRows() {
        assertThatThrownBy(() -> Array2D.of(new double[][]{{1, 2}, {3}}))
            .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void rejectsMaskOfOtherShape() {
        assertThatThrownBy(() -> Array2D.of(new double[][]{{1, 2}}, new boolean[][]{{true}}))
            .isInstanceOf(ShapeMismatchException.class);
        assertThatThrownBy(() -> Array2D.fromFlat(1, 2, new double[]{1, 2, 3}, new BitSet(), PixelScales.UNIT))
            .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void slicesValuesAndMask() {
        Array2D masked = grid().withMask(new boolean[][]{
            {false, false, false, false},
            {false, false, true, false},
            {false, false, false, false}
        });

        Array2D patch = masked.slice(new Region2D(1, 3, 1, 3));

        assertThat(patch.toArray()).isDeepEqualTo(new double[][]{{5, 6}, {9, 10}});
        assertThat(patch.toMaskArray()).isDeepEqualTo(new boolean[][]{{false, true}, {false, false}});
    }

    @Test
    void sliceOutsideGridIsRejected() {
        assertThatThrownBy(() -> grid().slice(new Region2D(2, 4, 0, 1)))
            .isInstanceOf(InvalidRegionException.class);
    }

    @Test
    void addPatchAccumulates() {
        Array2D accumulator = Array2D.zeros(3, 4);
        Array2D patch = Array2D.of(new double[][]{{1, 2}});

        accumulator.addPatch(new Region2D(1, 2, 2, 4), patch);
        accumulator.addPatch(new Region2D(1, 2, 2, 4), patch);

        assertThat(accumulator.get(1, 2)).isEqualTo(2.0);
        assertThat(accumulator.get(1, 3)).isEqualTo(4.0);
        assertThat(accumulator.get(0, 0)).isZero();
    }

    @Test
    void addPatchChecksShape() {
        assertThatThrownBy(() -> Array2D.zeros(3, 4).addPatch(new Region2D(0, 1, 0, 3), Array2D.zeros(1, 2)))
            .isInstanceOf(ShapeMismatchException.class);
    }

    @Test
    void reflectionIsAnInvolution() {
        Array2D original = grid();
        Array2D flipped = original.reflected(true, true);

        assertThat(flipped.get(0, 0)).isEqualTo(11.0);
        assertThat(flipped.reflected(true, true)).isEqualTo(original);
    }

    @Test
    void concatenatesRows() {
        Array2D stacked = Array2D.concatenateRows(List.of(
            Array2D.of(new double[][]{{1, 2}}),
            Array2D.of(new double[][]{{3, 4}}, new boolean[][]{{false, true}})));

        assertThat(stacked.toArray()).isDeepEqualTo(new double[][]{{1, 2}, {3, 4}});
        assertThat(stacked.isMasked(1, 1)).isTrue();
        assertThat(stacked.maskedCount()).isEqualTo(1);
    }

    @Test
    void zeroesRegionsButKeepsMask() {
        Array2D masked = grid().withMask(new boolean[][]{
            {true, false, false, false},
            {false, false, false, false},
            {false, false, false, false}
        });

        Array2D cleared = masked.withRegionsZeroed(List.of(new Region2D(0, 1, 0, 2)));

        assertThat(cleared.toArray()[0]).containsExactly(0, 0, 2, 3);
        assertThat(cleared.isMasked(0, 0)).isTrue();
        assertThat(masked.get(0, 1)).isEqualTo(1.0);
    }
}
