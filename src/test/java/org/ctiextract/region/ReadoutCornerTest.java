package org.ctiextract.region;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ReadoutCornerTest {

    @Test
    void tuplesSelectReflections() {
        assertThat(ReadoutCorner.of(1, 0)).isEqualTo(ReadoutCorner.BOTTOM_LEFT);
        assertThat(ReadoutCorner.of(0, 0).flipsRows()).isTrue();
        assertThat(ReadoutCorner.of(0, 0).flipsColumns()).isFalse();
        assertThat(ReadoutCorner.of(1, 1).flipsColumns()).isTrue();
        assertThat(ReadoutCorner.of(1, 1).flipsRows()).isFalse();
        assertThat(ReadoutCorner.of(0, 1).flipsRows()).isTrue();
        assertThat(ReadoutCorner.of(0, 1).flipsColumns()).isTrue();
        assertThat(ReadoutCorner.CANONICAL.flipsRows()).isFalse();
        assertThat(ReadoutCorner.CANONICAL.flipsColumns()).isFalse();
    }

    @Test
    void rejectsUnknownTuple() {
        assertThatThrownBy(() -> ReadoutCorner.of(2, 0)).isInstanceOf(UnsupportedOrientationException.class);
    }

    @Test
    void parsesNames() {
        assertThat(ReadoutCorner.fromName("top_right")).isEqualTo(ReadoutCorner.TOP_RIGHT);
        assertThatThrownBy(() -> ReadoutCorner.fromName("middle")).isInstanceOf(UnsupportedOrientationException.class);
    }
}
