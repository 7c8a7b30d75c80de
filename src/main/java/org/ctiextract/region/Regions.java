package org.ctiextract.region;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Factory turning raw coordinate tuples supplied by loaders and configuration into validated
 * region objects. Coordinates are checked once, here, rather than at every call site.
 */
public final class Regions {

    private Regions() {
    }

    /**
     * @param coordinates {@code {y0, y1, x0, x1}}.
     * @return The validated region.
     * @throws InvalidRegionException if the tuple does not have four entries or is invalid.
     */
    public static Region2D region2DOf(int... coordinates) {
        if (coordinates == null || coordinates.length != 4) {
            throw new InvalidRegionException(
                "A 2D region needs 4 coordinates (y0, y1, x0, x1), got "
                    + (coordinates == null ? "null" : coordinates.length));
        }
        return new Region2D(coordinates[0], coordinates[1], coordinates[2], coordinates[3]);
    }

    /**
     * @param coordinates {@code {x0, x1}}.
     * @return The validated region.
     * @throws InvalidRegionException if the tuple does not have two entries or is invalid.
     */
    public static Region1D region1DOf(int... coordinates) {
        if (coordinates == null || coordinates.length != 2) {
            throw new InvalidRegionException(
                "A 1D region needs 2 coordinates (x0, x1), got "
                    + (coordinates == null ? "null" : coordinates.length));
        }
        return new Region1D(coordinates[0], coordinates[1]);
    }

    /**
     * @param coordinates One {@code {y0, y1, x0, x1}} tuple per region, in caller order.
     * @return An unmodifiable list of validated regions.
     */
    public static List<Region2D> region2DListOf(int[]... coordinates) {
        List<Region2D> regions = new ArrayList<>(coordinates.length);
        for (int[] tuple : coordinates) {
            regions.add(region2DOf(tuple));
        }
        return Collections.unmodifiableList(regions);
    }

    /**
     * @param coordinates One {@code {x0, x1}} tuple per region, in caller order.
     * @return An unmodifiable list of validated regions.
     */
    public static List<Region1D> region1DListOf(int[]... coordinates) {
        List<Region1D> regions = new ArrayList<>(coordinates.length);
        for (int[] tuple : coordinates) {
            regions.add(region1DOf(tuple));
        }
        return Collections.unmodifiableList(regions);
    }
}
