package org.ctiextract.extract;

import org.ctiextract.grid.Array1D;
import org.ctiextract.region.ExtractionWindow;
import org.ctiextract.region.Layout1D;
import org.ctiextract.region.Region1D;

/**
 * Whole-line views of a 1D charge-injection line.
 */
public class ExtractorMisc1D {

    private final Layout1D layout;
    private final Extractor1D fpr;
    private final Extractor1D eper;

    public ExtractorMisc1D(Layout1D layout) {
        this.layout = layout;
        this.fpr = new Extractor1D(ExtractorKind1D.FPR, layout);
        this.eper = new Extractor1D(ExtractorKind1D.EPER, layout);
    }

    public Array1D regionsArrayFrom(Array1D line) {
        line.requireLength(layout.getLength(), "Line");
        Array1D result = Array1D.zerosLike(line);
        for (Region1D region : layout.getRegionList()) {
            result.addPatch(region, line.slice(region));
        }
        return result;
    }

    public Array1D nonRegionsArrayFrom(Array1D line) {
        line.requireLength(layout.getLength(), "Line");
        return line.withRegionsZeroed(layout.getRegionList());
    }

    /**
     * @param fprWindow Window of the FPRs, or {@code null} to leave them out.
     * @param eperWindow Window of the EPERs, or {@code null} to leave them out.
     * @return A zero line with the selected FPRs and EPERs of {@code line} added in.
     */
    public Array1D fprsAndEpersArrayFrom(Array1D line, ExtractionWindow fprWindow, ExtractionWindow eperWindow) {
        Array1D result = Array1D.zerosLike(line);
        if (fprWindow != null) {
            fpr.scatterInto(result, line, fprWindow);
        }
        if (eperWindow != null) {
            eper.scatterInto(result, line, eperWindow);
        }
        return result;
    }
}
