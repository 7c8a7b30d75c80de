package org.ctiextract.extract;

import java.util.List;
import java.util.Locale;

import org.ctiextract.region.EdgeAnchor;
import org.ctiextract.region.Layout1D;
import org.ctiextract.region.Region1D;

/**
 * What a 1D extractor cuts out of a line.
 */
public enum ExtractorKind1D {

    FPR(EdgeAnchor.LEADING) {
        @Override
        List<Region1D> parentRegionsFrom(Layout1D layout) {
            return layout.getRegionList();
        }
    },

    EPER(EdgeAnchor.TRAILING) {
        @Override
        List<Region1D> parentRegionsFrom(Layout1D layout) {
            return layout.getRegionList();
        }
    },

    PRESCAN(EdgeAnchor.LEADING) {
        @Override
        List<Region1D> parentRegionsFrom(Layout1D layout) {
            if (layout.getPrescan() == null) {
                throw new IllegalStateException("Layout does not declare a prescan");
            }
            return List.of(layout.getPrescan());
        }
    },

    OVERSCAN(EdgeAnchor.LEADING) {
        @Override
        List<Region1D> parentRegionsFrom(Layout1D layout) {
            if (layout.getOverscan() == null) {
                throw new IllegalStateException("Layout does not declare an overscan");
            }
            return List.of(layout.getOverscan());
        }
    };

    private final EdgeAnchor anchor;

    ExtractorKind1D(EdgeAnchor anchor) {
        this.anchor = anchor;
    }

    abstract List<Region1D> parentRegionsFrom(Layout1D layout);

    public EdgeAnchor getAnchor() {
        return anchor;
    }

    /**
     * @return The key of this kind under {@code cti-extract.windows}.
     */
    public String configKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
