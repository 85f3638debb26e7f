package com.phillippitts.scalogram.domain;

import java.util.List;
import java.util.Objects;

/**
 * Describes how a coefficient matrix was produced.
 *
 * @param family          mother wavelet family
 * @param centerFrequency centre frequency of the mother wavelet, cycles per unit scale
 * @param padding         boundary policy; it affects the first and last {@code edgeWidths[j]}
 *                        columns of row {@code j}
 * @param edgeWidths      per-row count of columns influenced by padding (kernel length / 2)
 * @param methods         per-row convolution algorithm actually used (never {@code AUTO})
 */
public record TransformMetadata(
        WaveletFamily family,
        double centerFrequency,
        PaddingMode padding,
        List<Integer> edgeWidths,
        List<ConvolutionMethod> methods
) {
    public TransformMetadata {
        Objects.requireNonNull(family, "family must not be null");
        Objects.requireNonNull(padding, "padding must not be null");
        edgeWidths = List.copyOf(edgeWidths);
        methods = List.copyOf(methods);
        if (edgeWidths.size() != methods.size()) {
            throw new IllegalArgumentException("edgeWidths and methods must have one entry per scale");
        }
    }
}
