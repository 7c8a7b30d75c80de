package org.ctiextract.grid;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.Objects;

import org.ctiextract.region.Region1D;

/**
 * A 1D line of pixel values with an aligned exclusion mask and a pixel scale. Mutable only through
 * {@link #addAt(int, double)} and {@link #addPatch(Region1D, Array1D)} on caller-owned accumulators.
 */
public final class Array1D {

    private final double[] values;
    private final BitSet mask;
    private final double pixelScale;

    private Array1D(double[] values, BitSet mask, double pixelScale) {
        this.values = values;
        this.mask = mask;
        this.pixelScale = pixelScale;
    }

    public static Array1D of(double... values) {
        return of(values, null, 1.0);
    }

    public static Array1D of(double[] values, boolean[] mask) {
        return of(values, mask, 1.0);
    }

    /**
     * @param values Pixel values, copied.
     * @param mask Exclusion flags of the same length, or {@code null} for none.
     * @param pixelScale Pixel scale, positive.
     * @return The line.
     * @throws ShapeMismatchException if the mask length differs from the value length.
     */
    public static Array1D of(double[] values, boolean[] mask, double pixelScale) {
        checkLength(values.length);
        if (!(pixelScale > 0.0)) {
            throw new IllegalArgumentException("Pixel scale must be positive, got " + pixelScale);
        }
        BitSet bits = new BitSet(values.length);
        if (mask != null) {
            if (mask.length != values.length) {
                throw new ShapeMismatchException(
                    "Mask has " + mask.length + " pixels, values have " + values.length);
            }
            for (int i = 0; i < mask.length; i++) {
                if (mask[i]) {
                    bits.set(i);
                }
            }
        }
        return new Array1D(values.clone(), bits, pixelScale);
    }

    public static Array1D zeros(int length) {
        checkLength(length);
        return new Array1D(new double[length], new BitSet(), 1.0);
    }

    public static Array1D zerosLike(Array1D like) {
        return new Array1D(new double[like.values.length], new BitSet(), like.pixelScale);
    }

    private static void checkLength(int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Line length must be positive, got " + length);
        }
    }

    public int length() {
        return values.length;
    }

    public double getPixelScale() {
        return pixelScale;
    }

    public double get(int index) {
        return values[Objects.checkIndex(index, values.length)];
    }

    public boolean isMasked(int index) {
        return mask.get(Objects.checkIndex(index, values.length));
    }

    /**
     * @param expectedLength Required length.
     * @param what Name of this line in the error message.
     * @throws ShapeMismatchException if the length differs.
     */
    public void requireLength(int expectedLength, String what) {
        if (values.length != expectedLength) {
            throw new ShapeMismatchException(
                what + " has length " + values.length + ", expected " + expectedLength);
        }
    }

    /**
     * @param region The region, in this line's coordinates.
     * @return Values and mask covered by the region.
     * @throws org.ctiextract.region.InvalidRegionException if the region lies outside the line.
     */
    public Array1D slice(Region1D region) {
        region.checkWithin(values.length);
        double[] patch = Arrays.copyOfRange(values, region.x0(), region.x1());
        BitSet patchMask = mask.get(region.x0(), region.x1());
        return new Array1D(patch, patchMask, pixelScale);
    }

    /**
     * @return A copy with the values inside every region set to zero; the mask is kept.
     */
    public Array1D withRegionsZeroed(Collection<Region1D> regions) {
        double[] cleared = values.clone();
        for (Region1D region : regions) {
            region.checkWithin(values.length);
            Arrays.fill(cleared, region.x0(), region.x1(), 0.0);
        }
        return new Array1D(cleared, (BitSet) mask.clone(), pixelScale);
    }

    public Array1D copy() {
        return new Array1D(values.clone(), (BitSet) mask.clone(), pixelScale);
    }

    public void addAt(int index, double value) {
        values[Objects.checkIndex(index, values.length)] += value;
    }

    /**
     * Adds the values of {@code patch} in place at {@code region}; the patch mask is ignored.
     *
     * @throws ShapeMismatchException if the patch length differs from the region length.
     */
    public void addPatch(Region1D region, Array1D patch) {
        region.checkWithin(values.length);
        patch.requireLength(region.totalPixels(), "Patch for region " + region);
        for (int i = 0; i < patch.values.length; i++) {
            values[region.x0() + i] += patch.values[i];
        }
    }

    public double[] toArray() {
        return values.clone();
    }

    public boolean[] toMaskArray() {
        boolean[] out = new boolean[values.length];
        for (int i = mask.nextSetBit(0); i >= 0; i = mask.nextSetBit(i + 1)) {
            out[i] = true;
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Array1D that)) return false;
        return Double.compare(pixelScale, that.pixelScale) == 0
            && Arrays.equals(values, that.values)
            && mask.equals(that.mask);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(mask, pixelScale) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Array1D{values=" + Arrays.toString(values) + ", masked=" + mask.cardinality() + "}";
    }
}
