package org.ctiextract.extract;

import java.util.List;

import org.ctiextract.config.WindowSettings;
import org.ctiextract.region.ExtractionWindow;
import org.ctiextract.region.InvalidRegionException;
import org.ctiextract.region.Layout2D;
import org.ctiextract.region.Region2D;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.ConfigFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the per-layout extractor suite.
 */
@Tag("unit")
class ExtractorSuite2DTest {

    private final ExtractorSuite2D suite = new ExtractorSuite2D(Layout2D.of(10, 10, List.of(new Region2D(1, 4, 1, 4))));

    @Test
    void holdsOneExtractorPerKind() {
        for (ExtractorKind2D kind : ExtractorKind2D.values()) {
            assertThat(suite.extractor(kind).getKind()).isEqualTo(kind);
            assertThat(suite.extractor(kind).getLayout()).isSameAs(suite.getLayout());
        }
        assertThat(suite.parallelFpr().getKind()).isEqualTo(ExtractorKind2D.PARALLEL_FPR);
        assertThat(suite.serialEper().getKind()).isEqualTo(ExtractorKind2D.SERIAL_EPER);
        assertThat(suite.misc()).isNotNull();
    }

    @Test
    void windowsComeFromSettings() {
        WindowSettings settings = new WindowSettings(ConfigFactory.parseString("""
            parallel-eper = full
            serial-fpr = [0, 2]
            """));

        assertThat(ExtractorSuite2D.windowFor(ExtractorKind2D.PARALLEL_EPER, settings)).isEqualTo(ExtractionWindow.full());
        assertThat(suite.serialFpr().regionListFrom(ExtractorSuite2D.windowFor(ExtractorKind2D.SERIAL_FPR, settings)))
            .containsExactly(new Region2D(1, 4, 1, 3));
        assertThatThrownBy(() -> ExtractorSuite2D.windowFor(ExtractorKind2D.PEDESTAL, settings))
            .isInstanceOf(InvalidRegionException.class);
    }
}
