package org.ctiextract.region;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ExtractionWindowTest {

    @Test
    void pixelsWindowExposesRange() {
        ExtractionWindow window = ExtractionWindow.pixels(-1, 4);

        assertThat(window.getForm()).isEqualTo(ExtractionWindow.Form.PIXELS);
        assertThat(window.getStart()).isEqualTo(-1);
        assertThat(window.getEnd()).isEqualTo(4);
        assertThat(window).isEqualTo(ExtractionWindow.pixels(-1, 4)).hasToString("pixels(-1, 4)");
    }

    @Test
    void rejectsEmptyRange() {
        assertThatThrownBy(() -> ExtractionWindow.pixels(3, 3)).isInstanceOf(InvalidRegionException.class);
    }

    @Test
    void rejectsNonPositiveCount() {
        assertThatThrownBy(() -> ExtractionWindow.fromEnd(0)).isInstanceOf(InvalidRegionException.class);
    }

    @Test
    void accessorsOfOtherFormsFail() {
        assertThatThrownBy(() -> ExtractionWindow.fromEnd(3).getStart()).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> ExtractionWindow.full().getCount()).isInstanceOf(IllegalStateException.class);
        assertThat(ExtractionWindow.fromEnd(3).getCount()).isEqualTo(3);
    }
}
