package com.phillippitts.scalogram.service.transform;

import com.phillippitts.scalogram.domain.WaveletFamily;
import com.phillippitts.scalogram.service.wavelet.WaveletBasisGenerator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KernelCacheTest {

    private final KernelCache cache = new KernelCache(new WaveletBasisGenerator());

    @Test
    void shouldReuseKernelForSameKey() {
        PreparedKernel first = cache.get(WaveletFamily.MORLET, 4.0, 100);
        PreparedKernel second = cache.get(WaveletFamily.MORLET, 4.0, 100);

        assertThat(second).isSameAs(first);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void shouldSeparateByFamilyScaleAndLength() {
        cache.get(WaveletFamily.MORLET, 4.0, 100);
        cache.get(WaveletFamily.DERIVATIVE_OF_GAUSSIAN, 4.0, 100);
        cache.get(WaveletFamily.MORLET, 8.0, 100);
        cache.get(WaveletFamily.MORLET, 4.0, 200);

        assertThat(cache.size()).isEqualTo(4);
    }

    @Test
    void shouldSizeFftToHoldFullCorrelation() {
        PreparedKernel kernel = cache.get(WaveletFamily.MORLET, 4.0, 100);

        // half = 16, full correlation length = 100 + 4 * 16 = 164
        assertThat(kernel.half()).isEqualTo(16);
        assertThat(kernel.fftSize()).isEqualTo(256);
        assertThat(kernel.spectrum()[0]).hasSize(256);
        assertThat(kernel.spectrum()).isSameAs(kernel.spectrum());
    }

    @Test
    void nextPowerOfTwoShouldRoundUp() {
        assertThat(PreparedKernel.nextPowerOfTwo(1)).isEqualTo(1);
        assertThat(PreparedKernel.nextPowerOfTwo(2)).isEqualTo(2);
        assertThat(PreparedKernel.nextPowerOfTwo(3)).isEqualTo(4);
        assertThat(PreparedKernel.nextPowerOfTwo(1025)).isEqualTo(2048);
    }

    @Test
    void shouldEvictLeastRecentlyUsedSignalLength() {
        KernelCache bounded = new KernelCache(new WaveletBasisGenerator(), 2);
        PreparedKernel first = bounded.get(WaveletFamily.MORLET, 4.0, 100);
        bounded.get(WaveletFamily.MORLET, 8.0, 100);
        PreparedKernel second = bounded.get(WaveletFamily.MORLET, 4.0, 200);

        bounded.get(WaveletFamily.MORLET, 4.0, 300);

        assertThat(bounded.signalLengthCount()).isEqualTo(2);
        assertThat(bounded.size()).isEqualTo(2);
        assertThat(bounded.get(WaveletFamily.MORLET, 4.0, 200)).isSameAs(second);
        assertThat(bounded.get(WaveletFamily.MORLET, 4.0, 100)).isNotSameAs(first);
        assertThat(bounded.signalLengthCount()).isEqualTo(2);
    }

    @Test
    void recentlyUsedLengthShouldSurviveEviction() {
        KernelCache bounded = new KernelCache(new WaveletBasisGenerator(), 2);
        PreparedKernel first = bounded.get(WaveletFamily.MORLET, 4.0, 100);
        bounded.get(WaveletFamily.MORLET, 4.0, 200);
        bounded.get(WaveletFamily.MORLET, 4.0, 100);

        bounded.get(WaveletFamily.MORLET, 4.0, 300);

        assertThat(bounded.get(WaveletFamily.MORLET, 4.0, 100)).isSameAs(first);
    }

    @Test
    void manyDistinctLengthsShouldStayWithinBound() {
        KernelCache bounded = new KernelCache(new WaveletBasisGenerator(), 3);
        for (int length = 50; length < 150; length++) {
            bounded.get(WaveletFamily.MORLET, 2.0, length);
        }

        assertThat(bounded.signalLengthCount()).isEqualTo(3);
        assertThat(bounded.size()).isEqualTo(3);
    }

    @Test
    void shouldRejectNonPositiveBound() {
        assertThatThrownBy(() -> new KernelCache(new WaveletBasisGenerator(), 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least 1");
    }
}
