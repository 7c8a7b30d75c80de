package org.ctiextract.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.ctiextract.region.ClockingAxis;
import org.ctiextract.region.EdgeAnchor;
import org.ctiextract.region.EmptyRegionListException;
import org.ctiextract.region.ExtractionWindow;
import org.ctiextract.region.InvalidRegionException;
import org.ctiextract.region.Layout2D;
import org.ctiextract.region.Region2D;

/**
 * What a 2D extractor cuts out of a frame. Each kind fixes the clocking axis the window applies to,
 * the edge it is anchored at and the parent structures it is applied to.
 * <p>
 * The charge-injection kinds derive one region per charge-injection region. The structure kinds
 * derive one region from a prescan, overscan or pedestal of the layout, except
 * {@link #SERIAL_OVERSCAN_NO_EPER}, which derives one per charge-injection region.
 */
public enum ExtractorKind2D {

    /** Leading rows of every charge-injection region. */
    PARALLEL_FPR(ClockingAxis.PARALLEL, EdgeAnchor.LEADING, true) {
        @Override
        List<Region2D> parentRegionsFrom(Layout2D layout) {
            return layout.getRegionList();
        }
    },

    /** Rows trailing every charge-injection region. */
    PARALLEL_EPER(ClockingAxis.PARALLEL, EdgeAnchor.TRAILING, false) {
        @Override
        List<Region2D> parentRegionsFrom(Layout2D layout) {
            return layout.getRegionList();
        }
    },

    /** Leading columns of every charge-injection region. */
    SERIAL_FPR(ClockingAxis.SERIAL, EdgeAnchor.LEADING, true) {
        @Override
        List<Region2D> parentRegionsFrom(Layout2D layout) {
            return layout.getRegionList();
        }
    },

    /** Columns trailing every charge-injection region. */
    SERIAL_EPER(ClockingAxis.SERIAL, EdgeAnchor.TRAILING, false) {
        @Override
        List<Region2D> parentRegionsFrom(Layout2D layout) {
            return layout.getRegionList();
        }
    },

    /** Rows of the parallel overscan. */
    PARALLEL_OVERSCAN(ClockingAxis.PARALLEL, EdgeAnchor.LEADING, false) {
        @Override
        List<Region2D> parentRegionsFrom(Layout2D layout) {
            return List.of(requireStructure(layout.getParallelOverscan(), "a parallel overscan"));
        }
    },

    /**
     * Rows in front of the first charge-injection region, spanning the columns of the first
     * region. Windows count from row 0.
     */
    PARALLEL_PRE_INJECTION(ClockingAxis.PARALLEL, EdgeAnchor.LEADING, false) {
        @Override
        List<Region2D> parentRegionsFrom(Layout2D layout) {
            Region2D first = requireRegions(layout).get(0);
            int y0Min = Integer.MAX_VALUE;
            for (Region2D region : layout.getRegionList()) {
                y0Min = Math.min(y0Min, region.y0());
            }
            if (y0Min == 0) {
                throw new InvalidRegionException(
                    "No rows precede the charge-injection regions");
            }
            return List.of(new Region2D(0, y0Min, first.x0(), first.x1()));
        }
    },

    /** Rows of the corner shared by the parallel and serial overscans. */
    PEDESTAL(ClockingAxis.PARALLEL, EdgeAnchor.LEADING, false) {
        @Override
        List<Region2D> parentRegionsFrom(Layout2D layout) {
            requireStructure(layout.getParallelOverscan(), "a parallel overscan");
            requireStructure(layout.getSerialOverscan(), "a serial overscan");
            return List.of(layout.pedestal());
        }
    },

    /** Columns of the serial prescan. */
    SERIAL_PRESCAN(ClockingAxis.SERIAL, EdgeAnchor.LEADING, false) {
        @Override
        List<Region2D> parentRegionsFrom(Layout2D layout) {
            return List.of(requireStructure(layout.getSerialPrescan(), "a serial prescan"));
        }
    },

    /** Columns of the serial overscan. */
    SERIAL_OVERSCAN(ClockingAxis.SERIAL, EdgeAnchor.LEADING, false) {
        @Override
        List<Region2D> parentRegionsFrom(Layout2D layout) {
            return List.of(requireStructure(layout.getSerialOverscan(), "a serial overscan"));
        }
    },

    /**
     * Columns of the serial overscan restricted to the rows between charge-injection regions, so
     * that no serial EPER of an injected row is included.
     */
    SERIAL_OVERSCAN_NO_EPER(ClockingAxis.SERIAL, EdgeAnchor.LEADING, false) {
        @Override
        List<Region2D> parentRegionsFrom(Layout2D layout) {
            Region2D overscan = requireStructure(layout.getSerialOverscan(), "a serial overscan");
            List<Region2D> parents = new ArrayList<>();
            for (Region2D region : layout.getRegionList()) {
                Region2D rows = region.trailingRegionFrom(ClockingAxis.PARALLEL, ExtractionWindow.full(),
                    layout.trailingSpace(region, ClockingAxis.PARALLEL));
                parents.add(new Region2D(rows.y0(), rows.y1(), overscan.x0(), overscan.x1()));
            }
            return parents;
        }
    };

    private final ClockingAxis axis;
    private final EdgeAnchor anchor;
    private final boolean chargeInjected;

    ExtractorKind2D(ClockingAxis axis, EdgeAnchor anchor, boolean chargeInjected) {
        this.axis = axis;
        this.anchor = anchor;
        this.chargeInjected = chargeInjected;
    }

    /**
     * @param layout The layout.
     * @return The structures the window is applied to, in layout order.
     * @throws IllegalStateException if the layout lacks a structure this kind needs.
     */
    abstract List<Region2D> parentRegionsFrom(Layout2D layout);

    /**
     * @return The axis the extraction window applies to; binning collapses the other one.
     */
    public ClockingAxis getAxis() {
        return axis;
    }

    public EdgeAnchor getAnchor() {
        return anchor;
    }

    /**
     * @return Whether the extracted pixels lie inside the charge injection (FPR kinds).
     */
    public boolean isChargeInjected() {
        return chargeInjected;
    }

    /**
     * @return The key of this kind under {@code cti-extract.windows}, e.g. {@code "parallel-eper"}.
     */
    public String configKey() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    private static Region2D requireStructure(Region2D structure, String description) {
        if (structure == null) {
            throw new IllegalStateException("Layout does not declare " + description);
        }
        return structure;
    }

    private static List<Region2D> requireRegions(Layout2D layout) {
        if (layout.getRegionList().isEmpty()) {
            throw new EmptyRegionListException(
                "Layout declares no charge-injection regions");
        }
        return layout.getRegionList();
    }
}
