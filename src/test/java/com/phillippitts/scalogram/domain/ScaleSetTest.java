package com.phillippitts.scalogram.domain;

import com.phillippitts.scalogram.exception.InvalidScaleException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScaleSetTest {

    @Test
    void shouldBuildGeometricBankIncludingBothBounds() {
        ScaleSet scales = ScaleSet.geometric(1.0, 128.0, 8);

        assertThat(scales.size()).isEqualTo(57);
        assertThat(scales.min()).isEqualTo(1.0);
        assertThat(scales.max()).isCloseTo(128.0, within(1e-9));
        assertThat(scales.scaleAt(8)).isCloseTo(2.0, within(1e-12));
    }

    @Test
    void shouldStopAtLastScaleBelowUpperBound() {
        ScaleSet scales = ScaleSet.geometric(1.0, 3.0, 1);

        assertThat(scales.toArray()).containsExactly(1.0, 2.0);
    }

    @Test
    void shouldAllowSingleScale() {
        ScaleSet scales = ScaleSet.geometric(5.0, 5.0, 4);

        assertThat(scales.size()).isEqualTo(1);
        assertThat(scales.scaleAt(0)).isEqualTo(5.0);
    }

    @Test
    void shouldDeriveScalesFromFrequencyBand() {
        ScaleSet scales = ScaleSet.forFrequencyBand(1.0, 50.0, 1, 1.0, 100.0);

        assertThat(scales.toArray()).containsExactly(2.0, 4.0, 8.0, 16.0, 32.0, 64.0);
        assertThat(scales.frequencyAt(0, 1.0, 100.0)).isEqualTo(50.0);
    }

    @Test
    void shouldRejectNonIncreasingScales() {
        assertThatThrownBy(() -> ScaleSet.of(1.0, 2.0, 2.0))
                .isInstanceOf(InvalidScaleException.class)
                .hasMessageContaining("strictly increasing");
    }

    @Test
    void shouldRejectNonPositiveOrNonFiniteScales() {
        assertThatThrownBy(() -> ScaleSet.of(0.0, 1.0)).isInstanceOf(InvalidScaleException.class);
        assertThatThrownBy(() -> ScaleSet.of(-1.0)).isInstanceOf(InvalidScaleException.class);
        assertThatThrownBy(() -> ScaleSet.of(1.0, Double.POSITIVE_INFINITY)).isInstanceOf(InvalidScaleException.class);
    }

    @Test
    void shouldRejectEmptyScaleSet() {
        assertThatThrownBy(() -> ScaleSet.of()).isInstanceOf(InvalidScaleException.class);
    }

    @Test
    void shouldRejectInvertedBounds() {
        assertThatThrownBy(() -> ScaleSet.geometric(8.0, 2.0, 4))
                .isInstanceOf(InvalidScaleException.class);
        assertThatThrownBy(() -> ScaleSet.forFrequencyBand(10.0, 5.0, 4, 1.0, 100.0))
                .isInstanceOf(InvalidScaleException.class);
        assertThatThrownBy(() -> ScaleSet.forFrequencyBand(0.0, 5.0, 4, 1.0, 100.0))
                .isInstanceOf(InvalidScaleException.class);
    }

    @Test
    void shouldCopyInputArray() {
        double[] values = {1.0, 2.0};
        ScaleSet scales = ScaleSet.of(values);
        values[0] = 99.0;

        assertThat(scales.scaleAt(0)).isEqualTo(1.0);
    }
}
