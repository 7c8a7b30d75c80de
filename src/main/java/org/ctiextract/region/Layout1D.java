package org.ctiextract.region;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * The geometry of a 1D charge-injection line: its length, the charge-injection regions and the
 * optional prescan and overscan.
 */
public final class Layout1D {

    private final int length;
    private final List<Region1D> regionList;
    private final Region1D prescan;
    private final Region1D overscan;

    /**
     * @param length Number of pixels in the line.
     * @param regionList The charge-injection regions, in caller order.
     * @param prescan The prescan, or {@code null}.
     * @param overscan The overscan, or {@code null}.
     * @throws InvalidRegionException if the length is not positive or a structure lies outside the line.
     */
    public Layout1D(int length, List<Region1D> regionList, Region1D prescan, Region1D overscan) {
        if (length <= 0) {
            throw new InvalidRegionException("Layout length must be positive, got " + length);
        }
        this.length = length;
        this.regionList = Collections.unmodifiableList(new ArrayList<>(regionList));
        this.prescan = prescan;
        this.overscan = overscan;
        for (Region1D region : this.regionList) {
            region.checkWithin(length);
        }
        if (prescan != null) {
            prescan.checkWithin(length);
        }
        if (overscan != null) {
            overscan.checkWithin(length);
        }
    }

    public static Layout1D of(int length, List<Region1D> regionList) {
        return new Layout1D(length, regionList, null, null);
    }

    public int getLength() {
        return length;
    }

    public List<Region1D> getRegionList() {
        return regionList;
    }

    /** @return The prescan, or {@code null}. */
    public Region1D getPrescan() {
        return prescan;
    }

    /** @return The overscan, or {@code null}. */
    public Region1D getOverscan() {
        return overscan;
    }

    /**
     * Pixels between the far edge of {@code region} and the nearest following region, or the end
     * of the line.
     *
     * @param region A region of this layout.
     * @return The trailing space.
     */
    public int trailingSpace(Region1D region) {
        int limit = length;
        for (Region1D other : regionList) {
            if (other.x0() >= region.x1() && other.x0() < limit) {
                limit = other.x0();
            }
        }
        return Math.max(0, limit - region.x1());
    }

    /**
     * @return Pixels between each region and the next one along the line, in pixel order.
     */
    public int[] pixelsBetweenRegions() {
        List<Region1D> ordered = new ArrayList<>(regionList);
        ordered.sort(Comparator.comparingInt(Region1D::x0).thenComparingInt(Region1D::x1));
        int count = Math.max(0, ordered.size() - 1);
        int[] between = new int[count];
        for (int i = 0; i < count; i++) {
            between[i] = ordered.get(i + 1).x0() - ordered.get(i).x1();
        }
        return between;
    }

    /**
     * @return Pixels between the furthest region edge and the end of the line.
     * @throws EmptyRegionListException if the layout has no regions.
     */
    public int trailSizeToArrayEdge() {
        requireRegions("trailSizeToArrayEdge");
        int maxX1 = 0;
        for (Region1D region : regionList) {
            maxX1 = Math.max(maxX1, region.x1());
        }
        return length - maxX1;
    }

    /**
     * @return Pixels of the shortest region.
     * @throws EmptyRegionListException if the layout has no regions.
     */
    public int totalPixelsMin() {
        requireRegions("totalPixelsMin");
        int min = Integer.MAX_VALUE;
        for (Region1D region : regionList) {
            min = Math.min(min, region.totalPixels());
        }
        return min;
    }

    private void requireRegions(String operation) {
        if (regionList.isEmpty()) {
            throw new EmptyRegionListException(operation + " requires at least one charge-injection region");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Layout1D that)) return false;
        return length == that.length
            && regionList.equals(that.regionList)
            && Objects.equals(prescan, that.prescan)
            && Objects.equals(overscan, that.overscan);
    }

    @Override
    public int hashCode() {
        return Objects.hash(length, regionList, prescan, overscan);
    }

    @Override
    public String toString() {
        return "Layout1D{length=" + length + ", regions=" + regionList
            + ", prescan=" + prescan + ", overscan=" + overscan + "}";
    }
}
