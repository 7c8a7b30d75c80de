package org.ctiextract.grid;

import java.util.function.DoubleBinaryOperator;

/**
 * Builders for small test frames.
 */
public final class GridFixtures {

    private GridFixtures() {
    }

    /**
     * @param value Pixel value as a function of (row, column).
     * @return An unmasked frame with unit pixel scales.
     */
    public static Array2D gridOf(int rows, int columns, DoubleBinaryOperator value) {
        double[][] values = new double[rows][columns];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < columns; c++) {
                values[r][c] = value.applyAsDouble(r, c);
            }
        }
        return Array2D.of(values);
    }
}
