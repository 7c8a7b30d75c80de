package org.ctiextract.region;

import java.util.Locale;

/**
 * The corner of a raw detector quadrant that is physically nearest its readout electronics.
 * <p>
 * Corners are written as {@code (row, column)} tuples following the instrument convention, in
 * which {@code (1, 0)} denotes a frame already stored in readout order. The corner only selects
 * a reflection: it never implies a transpose, since the parallel and serial axes are fixed by
 * the detector wiring.
 * <ul>
 *   <li>{@code (1, 0)}: identity</li>
 *   <li>{@code (0, 0)}: flip rows</li>
 *   <li>{@code (1, 1)}: flip columns</li>
 *   <li>{@code (0, 1)}: flip rows and columns</li>
 * </ul>
 */
public enum ReadoutCorner {

    TOP_LEFT(0, 0, true, false),
    TOP_RIGHT(0, 1, true, true),
    BOTTOM_LEFT(1, 0, false, false),
    BOTTOM_RIGHT(1, 1, false, true);

    /** The corner of frames already stored in readout order. */
    public static final ReadoutCorner CANONICAL = BOTTOM_LEFT;

    private final int row;
    private final int column;
    private final boolean flipsRows;
    private final boolean flipsColumns;

    ReadoutCorner(int row, int column, boolean flipsRows, boolean flipsColumns) {
        this.row = row;
        this.column = column;
        this.flipsRows = flipsRows;
        this.flipsColumns = flipsColumns;
    }

    /**
     * @param row Row component of the tuple (0 or 1).
     * @param column Column component of the tuple (0 or 1).
     * @return The matching corner.
     * @throws UnsupportedOrientationException if the tuple is not one of the four corners.
     */
    public static ReadoutCorner of(int row, int column) {
        for (ReadoutCorner corner : values()) {
            if (corner.row == row && corner.column == column) {
                return corner;
            }
        }
        throw new UnsupportedOrientationException(
            "Readout corner (" + row + ", " + column + ") is not one of (0, 0), (0, 1), (1, 0), (1, 1)");
    }

    /**
     * Parses a corner name such as {@code "TOP_LEFT"} (case-insensitive, dashes allowed).
     *
     * @param name The corner name.
     * @return The matching corner.
     * @throws UnsupportedOrientationException if the name is unknown.
     */
    public static ReadoutCorner fromName(String name) {
        if (name == null) {
            throw new UnsupportedOrientationException("Readout corner name must not be null");
        }
        try {
            return valueOf(name.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UnsupportedOrientationException("Unknown readout corner: " + name, e);
        }
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    /**
     * @return True if normalizing a frame with this corner reverses its rows.
     */
    public boolean flipsRows() {
        return flipsRows;
    }

    /**
     * @return True if normalizing a frame with this corner reverses its columns.
     */
    public boolean flipsColumns() {
        return flipsColumns;
    }

    @Override
    public String toString() {
        return name() + "(" + row + ", " + column + ")";
    }
}
