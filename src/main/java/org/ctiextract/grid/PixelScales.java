package org.ctiextract.grid;

/**
 * Physical size of a pixel along the row ({@code y}) and column ({@code x}) directions, in
 * arc-seconds. Carried along with a grid but never used by the extraction arithmetic.
 *
 * @param y Scale along rows.
 * @param x Scale along columns.
 */
public record PixelScales(double y, double x) {

    /** Scale used when a loader does not supply one. */
    public static final PixelScales UNIT = new PixelScales(1.0, 1.0);

    public PixelScales {
        if (!(y > 0.0) || !(x > 0.0)) {
            throw new IllegalArgumentException("Pixel scales must be positive, got (" + y + ", " + x + ")");
        }
    }

    /**
     * @param scale Scale along both directions.
     * @return Square pixel scales.
     */
    public static PixelScales uniform(double scale) {
        return new PixelScales(scale, scale);
    }
}
