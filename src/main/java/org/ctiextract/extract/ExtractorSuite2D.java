package org.ctiextract.extract;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import org.ctiextract.config.WindowSettings;
import org.ctiextract.region.ExtractionWindow;
import org.ctiextract.region.Layout2D;

/**
 * Every 2D extractor of one layout.
 */
public class ExtractorSuite2D {

    private final Layout2D layout;
    private final Map<ExtractorKind2D, Extractor2D> extractors;
    private final ExtractorMisc2D misc;

    public ExtractorSuite2D(Layout2D layout) {
        this.layout = layout;
        Map<ExtractorKind2D, Extractor2D> byKind = new EnumMap<>(ExtractorKind2D.class);
        for (ExtractorKind2D kind : ExtractorKind2D.values()) {
            byKind.put(kind, new Extractor2D(kind, layout));
        }
        this.extractors = Collections.unmodifiableMap(byKind);
        this.misc = new ExtractorMisc2D(layout);
    }

    public Layout2D getLayout() {
        return layout;
    }

    public Extractor2D extractor(ExtractorKind2D kind) {
        return extractors.get(kind);
    }

    public Extractor2D parallelFpr() {
        return extractors.get(ExtractorKind2D.PARALLEL_FPR);
    }

    public Extractor2D parallelEper() {
        return extractors.get(ExtractorKind2D.PARALLEL_EPER);
    }

    public Extractor2D serialFpr() {
        return extractors.get(ExtractorKind2D.SERIAL_FPR);
    }

    public Extractor2D serialEper() {
        return extractors.get(ExtractorKind2D.SERIAL_EPER);
    }

    public ExtractorMisc2D misc() {
        return misc;
    }

    /**
     * @param kind The extractor kind.
     * @param settings Configured windows.
     * @return The window configured for {@code kind}.
     * @throws org.ctiextract.region.InvalidRegionException if none is configured.
     */
    public static ExtractionWindow windowFor(ExtractorKind2D kind, WindowSettings settings) {
        return settings.requireWindowFor(kind.configKey());
    }
}
