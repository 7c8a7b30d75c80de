package org.ctiextract.grid;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import org.ctiextract.region.Region2D;

/**
 * A row-major 2D grid of pixel values with an aligned exclusion mask and pixel scales.
 * <p>
 * A set mask bit excludes the pixel from statistics. Instances are immutable to the extraction
 * code, except for {@link #addAt(int, int, double)} and {@link #addPatch(Region2D, Array2D)},
 * which are reserved for accumulators owned by the caller.
 */
public final class Array2D {

    private final int rows;
    private final int columns;
    private final double[] values;
    private final BitSet mask;
    private final PixelScales pixelScales;

    private Array2D(int rows, int columns, double[] values, BitSet mask, PixelScales pixelScales) {
        this.rows = rows;
        this.columns = columns;
        this.values = values;
        this.mask = mask;
        this.pixelScales = pixelScales;
    }

    // ==================== Factories ====================

    /**
     * Wraps flat row-major data. The arrays are copied.
     *
     * @param rows Number of rows.
     * @param columns Number of columns.
     * @param values Row-major values of length {@code rows * columns}.
     * @param mask Exclusion bits indexed like {@code values}; bits at or beyond the length are rejected.
     * @param pixelScales Pixel scales.
     * @return The grid.
     * @throws ShapeMismatchException if the values or mask do not match the shape.
     */
    public static Array2D fromFlat(int rows, int columns, double[] values, BitSet mask, PixelScales pixelScales) {
        int size = checkedSize(rows, columns);
        if (values.length != size) {
            throw new ShapeMismatchException(
                "Expected " + size + " values for shape (" + rows + ", " + columns + "), got " + values.length);
        }
        if (mask.length() > size) {
            throw new ShapeMismatchException(
                "Mask sets bit " + (mask.length() - 1) + " outside shape (" + rows + ", " + columns + ")");
        }
        return new Array2D(rows, columns, values.clone(), (BitSet) mask.clone(),
            Objects.requireNonNull(pixelScales, "pixelScales"));
    }

    /**
     * @param values Rectangular values, indexed {@code [row][column]}.
     * @return An unmasked grid with unit pixel scales.
     */
    public static Array2D of(double[][] values) {
        return of(values, null, PixelScales.UNIT);
    }

    /**
     * @param values Rectangular values, indexed {@code [row][column]}.
     * @param mask Exclusion flags of the same shape, or {@code null} for none.
     * @return A grid with unit pixel scales.
     * @throws ShapeMismatchException if the rows are ragged or the mask shape differs.
     */
    public static Array2D of(double[][] values, boolean[][] mask) {
        return of(values, mask, PixelScales.UNIT);
    }

    /**
     * @param values Rectangular values, indexed {@code [row][column]}.
     * @param mask Exclusion flags of the same shape, or {@code null} for none.
     * @param pixelScales Pixel scales.
     * @return The grid.
     * @throws ShapeMismatchException if the rows are ragged or the mask shape differs.
     */
    public static Array2D of(double[][] values, boolean[][] mask, PixelScales pixelScales) {
        int rows = values.length;
        int columns = rows == 0 ? 0 : values[0].length;
        int size = checkedSize(rows, columns);
        double[] flat = new double[size];
        for (int r = 0; r < rows; r++) {
            if (values[r].length != columns) {
                throw new ShapeMismatchException(
                    "Row " + r + " has " + values[r].length + " columns, expected " + columns);
            }
            System.arraycopy(values[r], 0, flat, r * columns, columns);
        }
        BitSet bits = new BitSet(size);
        if (mask != null) {
            if (mask.length != rows) {
                throw new ShapeMismatchException(
                    "Mask has " + mask.length + " rows, values have " + rows);
            }
            for (int r = 0; r < rows; r++) {
                if (mask[r].length != columns) {
                    throw new ShapeMismatchException(
                        "Mask row " + r + " has " + mask[r].length + " columns, expected " + columns);
                }
                for (int c = 0; c < columns; c++) {
                    if (mask[r][c]) {
                        bits.set(r * columns + c);
                    }
                }
            }
        }
        return new Array2D(rows, columns, flat, bits, Objects.requireNonNull(pixelScales, "pixelScales"));
    }

    /**
     * @return An unmasked grid of zeros with unit pixel scales.
     */
    public static Array2D zeros(int rows, int columns) {
        return new Array2D(rows, columns, new double[checkedSize(rows, columns)], new BitSet(), PixelScales.UNIT);
    }

    /**
     * @param like The template grid.
     * @return An unmasked grid of zeros with the template's shape and pixel scales.
     */
    public static Array2D zerosLike(Array2D like) {
        return new Array2D(like.rows, like.columns, new double[like.values.length], new BitSet(), like.pixelScales);
    }

    /**
     * Stacks grids of equal width on top of each other, first grid at the top.
     *
     * @param blocks The grids, at least one.
     * @return The concatenated grid, with the first block's pixel scales.
     * @throws ShapeMismatchException if the widths differ.
     */
    public static Array2D concatenateRows(List<Array2D> blocks) {
        if (blocks.isEmpty()) {
            throw new IllegalArgumentException("Nothing to concatenate");
        }
        int columns = blocks.get(0).columns;
        int rows = 0;
        for (Array2D block : blocks) {
            if (block.columns != columns) {
                throw new ShapeMismatchException(
                    "Cannot concatenate a block of " + block.columns + " columns onto " + columns + " columns");
            }
            rows += block.rows;
        }
        double[] values = new double[checkedSize(rows, columns)];
        BitSet mask = new BitSet(values.length);
        int offset = 0;
        for (Array2D block : blocks) {
            System.arraycopy(block.values, 0, values, offset, block.values.length);
            for (int i = block.mask.nextSetBit(0); i >= 0; i = block.mask.nextSetBit(i + 1)) {
                mask.set(offset + i);
            }
            offset += block.values.length;
        }
        return new Array2D(rows, columns, values, mask, blocks.get(0).pixelScales);
    }

    private static int checkedSize(int rows, int columns) {
        if (rows <= 0 || columns <= 0) {
            throw new IllegalArgumentException("Grid shape must be positive, got (" + rows + ", " + columns + ")");
        }
        long size = (long) rows * columns;
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                "Grid too large: " + size + " pixels for shape (" + rows + ", " + columns + ")");
        }
        return (int) size;
    }

    // ==================== Accessors ====================

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    /**
     * @return {@code {rows, columns}}.
     */
    public int[] getShape() {
        return new int[]{rows, columns};
    }

    public PixelScales getPixelScales() {
        return pixelScales;
    }

    public double get(int row, int column) {
        return values[index(row, column)];
    }

    public boolean isMasked(int row, int column) {
        return mask.get(index(row, column));
    }

    /**
     * @return Number of masked pixels.
     */
    public int maskedCount() {
        return mask.cardinality();
    }

    public boolean hasShape(int rows, int columns) {
        return this.rows == rows && this.columns == columns;
    }

    /**
     * @param expectedRows Required rows.
     * @param expectedColumns Required columns.
     * @param what Name of this grid in the error message.
     * @throws ShapeMismatchException if the shape differs.
     */
    public void requireShape(int expectedRows, int expectedColumns, String what) {
        if (!hasShape(expectedRows, expectedColumns)) {
            throw new ShapeMismatchException(what + " has shape (" + rows + ", " + columns
                + "), expected (" + expectedRows + ", " + expectedColumns + ")");
        }
    }

    private int index(int row, int column) {
        Objects.checkIndex(row, rows);
        Objects.checkIndex(column, columns);
        return row * columns + column;
    }

    // ==================== Derived grids ====================

    /**
     * Cuts out the values and mask covered by {@code region}.
     *
     * @param region The region, in this grid's coordinates.
     * @return The patch, with this grid's pixel scales.
     * @throws org.ctiextract.region.InvalidRegionException if the region lies outside the grid.
     */
    public Array2D slice(Region2D region) {
        region.checkWithin(rows, columns);
        int patchRows = region.totalRows();
        int patchColumns = region.totalColumns();
        double[] patchValues = new double[patchRows * patchColumns];
        BitSet patchMask = new BitSet(patchValues.length);
        for (int r = 0; r < patchRows; r++) {
            int source = (region.y0() + r) * columns + region.x0();
            System.arraycopy(values, source, patchValues, r * patchColumns, patchColumns);
            for (int c = 0; c < patchColumns; c++) {
                if (mask.get(source + c)) {
                    patchMask.set(r * patchColumns + c);
                }
            }
        }
        return new Array2D(patchRows, patchColumns, patchValues, patchMask, pixelScales);
    }

    /**
     * Mirrors the grid. Both flags false returns an equal copy.
     *
     * @param flipRows Reverse the row order.
     * @param flipColumns Reverse the column order.
     * @return The reflected grid.
     */
    public Array2D reflected(boolean flipRows, boolean flipColumns) {
        double[] reflectedValues = new double[values.length];
        BitSet reflectedMask = new BitSet(values.length);
        for (int r = 0; r < rows; r++) {
            int targetRow = flipRows ? rows - 1 - r : r;
            for (int c = 0; c < columns; c++) {
                int targetColumn = flipColumns ? columns - 1 - c : c;
                int source = r * columns + c;
                int target = targetRow * columns + targetColumn;
                reflectedValues[target] = values[source];
                if (mask.get(source)) {
                    reflectedMask.set(target);
                }
            }
        }
        return new Array2D(rows, columns, reflectedValues, reflectedMask, pixelScales);
    }

    /**
     * @param regions Regions to clear, in this grid's coordinates.
     * @return A copy with the values inside every region set to zero; the mask is kept.
     * @throws org.ctiextract.region.InvalidRegionException if a region lies outside the grid.
     */
    public Array2D withRegionsZeroed(Collection<Region2D> regions) {
        double[] cleared = values.clone();
        for (Region2D region : regions) {
            region.checkWithin(rows, columns);
            for (int r = region.y0(); r < region.y1(); r++) {
                Arrays.fill(cleared, r * columns + region.x0(), r * columns + region.x1(), 0.0);
            }
        }
        return new Array2D(rows, columns, cleared, (BitSet) mask.clone(), pixelScales);
    }

    /**
     * @param newMask Exclusion flags of this grid's shape.
     * @return A grid with the same values and the given mask.
     */
    public Array2D withMask(boolean[][] newMask) {
        return of(toArray(), newMask, pixelScales);
    }

    /**
     * @return An independent copy, suitable as an accumulator.
     */
    public Array2D copy() {
        return new Array2D(rows, columns, values.clone(), (BitSet) mask.clone(), pixelScales);
    }

    // ==================== Accumulation ====================

    /**
     * Adds {@code value} to one pixel in place.
     */
    public void addAt(int row, int column, double value) {
        values[index(row, column)] += value;
    }

    /**
     * Adds the values of {@code patch} in place at the location of {@code region}. The patch mask
     * is ignored.
     *
     * @param region Where the patch goes, in this grid's coordinates.
     * @param patch Values of the region's shape.
     * @throws ShapeMismatchException if the patch shape differs from the region shape.
     */
    public void addPatch(Region2D region, Array2D patch) {
        region.checkWithin(rows, columns);
        patch.requireShape(region.totalRows(), region.totalColumns(), "Patch for region " + region);
        for (int r = 0; r < patch.rows; r++) {
            int target = (region.y0() + r) * columns + region.x0();
            int source = r * patch.columns;
            for (int c = 0; c < patch.columns; c++) {
                values[target + c] += patch.values[source + c];
            }
        }
    }

    // ==================== Export ====================

    /**
     * @return A copy of the values, indexed {@code [row][column]}.
     */
    public double[][] toArray() {
        double[][] out = new double[rows][columns];
        for (int r = 0; r < rows; r++) {
            System.arraycopy(values, r * columns, out[r], 0, columns);
        }
        return out;
    }

    /**
     * @return A copy of the mask, indexed {@code [row][column]}.
     */
    public boolean[][] toMaskArray() {
        boolean[][] out = new boolean[rows][columns];
        for (int i = mask.nextSetBit(0); i >= 0; i = mask.nextSetBit(i + 1)) {
            out[i / columns][i % columns] = true;
        }
        return out;
    }

    /**
     * @return A copy of the row-major values.
     */
    public double[] toFlatArray() {
        return values.clone();
    }

    /**
     * @return A copy of the row-major mask bits.
     */
    public BitSet toFlatMask() {
        return (BitSet) mask.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Array2D that)) return false;
        return rows == that.rows
            && columns == that.columns
            && Arrays.equals(values, that.values)
            && mask.equals(that.mask)
            && pixelScales.equals(that.pixelScales);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(rows, columns, mask, pixelScales);
        return 31 * result + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Array2D{shape=(" + rows + ", " + columns + "), masked=" + mask.cardinality()
            + ", pixelScales=" + pixelScales + "}";
    }
}
