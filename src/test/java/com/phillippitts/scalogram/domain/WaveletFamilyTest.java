package com.phillippitts.scalogram.domain;

import com.phillippitts.scalogram.exception.InvalidWaveletFamilyException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WaveletFamilyTest {

    @Test
    void shouldResolveIdsAndAliasesCaseInsensitively() {
        assertThat(WaveletFamily.fromId("morlet")).isEqualTo(WaveletFamily.MORLET);
        assertThat(WaveletFamily.fromId("MORL")).isEqualTo(WaveletFamily.MORLET);
        assertThat(WaveletFamily.fromId(" mexh ")).isEqualTo(WaveletFamily.DERIVATIVE_OF_GAUSSIAN);
        assertThat(WaveletFamily.fromId("derivative_of_gaussian")).isEqualTo(WaveletFamily.DERIVATIVE_OF_GAUSSIAN);
        assertThat(WaveletFamily.fromId("ricker")).isEqualTo(WaveletFamily.DERIVATIVE_OF_GAUSSIAN);
    }

    @Test
    void shouldRejectUnknownFamily() {
        assertThatThrownBy(() -> WaveletFamily.fromId("haar"))
                .isInstanceOf(InvalidWaveletFamilyException.class)
                .hasMessageContaining("haar");
        assertThatThrownBy(() -> WaveletFamily.fromId(""))
                .isInstanceOf(InvalidWaveletFamilyException.class);
    }
}
