package io.wahdex.kernel;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BitRangeTest {

    @Test
    void emptyRangeContainsNothing() {
        var range = BitRange.empty();

        assertThat(range.isEmpty()).isTrue();
        assertThat(range.contains(0)).isFalse();
        assertThat(range.contains(-1)).isFalse();
        assertThat(range.length()).isZero();
    }

    @Test
    void emptyRangeHasNoBounds() {
        assertThatThrownBy(() -> BitRange.empty().lowest())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> BitRange.empty().highest())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void closedRangeIncludesBothEnds() {
        var range = BitRange.of(3, 9);

        assertThat(range.contains(2)).isFalse();
        assertThat(range.contains(3)).isTrue();
        assertThat(range.contains(9)).isTrue();
        assertThat(range.contains(10)).isFalse();
        assertThat(range.length()).isEqualTo(7L);
    }

    @Test
    void singleBitRange() {
        var range = BitRange.of(Integer.MAX_VALUE, Integer.MAX_VALUE);

        assertThat(range.contains(Integer.MAX_VALUE)).isTrue();
        assertThat(range.length()).isEqualTo(1L);
    }

    @Test
    void rejectsInvertedOrNegativeBounds() {
        assertThatThrownBy(() -> BitRange.of(5, 4))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BitRange.of(-1, 4))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void equalityByBounds() {
        assertThat(BitRange.of(1, 2)).isEqualTo(BitRange.of(1, 2));
        assertThat(BitRange.of(1, 2)).isNotEqualTo(BitRange.of(1, 3));
        assertThat(BitRange.of(0, 0)).isNotEqualTo(BitRange.empty());
        assertThat(BitRange.of(1, 2).hashCode()).isEqualTo(BitRange.of(1, 2).hashCode());
        assertThat(BitRange.empty()).hasToString("BitRange{empty}");
        assertThat(BitRange.of(0, 92)).hasToString("BitRange{0..92}");
    }
}
