package com.phillippitts.scalogram.service.transform;

import com.phillippitts.scalogram.config.properties.TransformProperties;
import com.phillippitts.scalogram.domain.CoefficientMatrix;
import com.phillippitts.scalogram.domain.ConvolutionMethod;
import com.phillippitts.scalogram.domain.PaddingMode;
import com.phillippitts.scalogram.domain.ScaleSet;
import com.phillippitts.scalogram.domain.Signal;
import com.phillippitts.scalogram.domain.TransformMetadata;
import com.phillippitts.scalogram.domain.WaveletFamily;
import com.phillippitts.scalogram.exception.EmptySignalException;
import com.phillippitts.scalogram.exception.NonFiniteInputException;
import com.phillippitts.scalogram.exception.ScalogramException;
import com.phillippitts.scalogram.exception.TransformFailureException;
import com.phillippitts.scalogram.service.wavelet.WaveletBasisGenerator;
import com.phillippitts.scalogram.util.TimeUtils;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Continuous wavelet transform of a sampled signal over a bank of scales.
 *
 * <p>Row {@code j} of the result is {@code |W_j[b]|} with
 * {@code W_j[b] = sum_k xpad[b + k] * conj(kernel_j[k])}, where {@code xpad} is the signal
 * extended by {@code kernel_j.half()} samples per side according to the configured
 * {@link PaddingMode}. Each row is computed either by direct correlation or by FFT
 * multiplication; both give the same coefficients up to rounding.
 *
 * <p>Rows are independent. When a scale executor is supplied and
 * {@code scalogram.transform.parallel-scales} is set, they are computed concurrently and
 * assembled by index, so the output does not depend on scheduling.
 *
 * <p>Thread-safe: no mutable state; kernels come from a caller-owned {@link KernelCache}.
 */
public class CwtEngine {

    private static final Logger LOG = LogManager.getLogger(CwtEngine.class);

    /** Estimated cost factor of one complex FFT butterfly relative to one multiply-add. */
    private static final double FFT_COST_FACTOR = 6.0;

    private final WaveletBasisGenerator basis;
    private final TransformProperties properties;
    private final Executor scaleExecutor;

    /**
     * Creates a sequential engine.
     */
    public CwtEngine(WaveletBasisGenerator basis, TransformProperties properties) {
        this(basis, properties, null);
    }

    /**
     * @param basis         kernel generator
     * @param properties    padding, convolution and phase settings
     * @param scaleExecutor executor for per-scale rows, or {@code null} to compute them inline
     */
    public CwtEngine(WaveletBasisGenerator basis, TransformProperties properties, Executor scaleExecutor) {
        this.basis = Objects.requireNonNull(basis, "basis must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.scaleExecutor = scaleExecutor;
    }

    /**
     * @return a fresh kernel cache bound to this engine's basis generator
     */
    public KernelCache newKernelCache() {
        return new KernelCache(basis, properties.getKernelCacheLengths());
    }

    /**
     * Transforms a signal with a family given by identifier.
     *
     * @throws com.phillippitts.scalogram.exception.InvalidWaveletFamilyException for unknown identifiers
     */
    public CoefficientMatrix transform(Signal signal, ScaleSet scales, String familyId) {
        return transform(signal, scales, WaveletFamily.fromId(familyId));
    }

    /**
     * Transforms a signal using a private kernel cache.
     */
    public CoefficientMatrix transform(Signal signal, ScaleSet scales, WaveletFamily family) {
        return transform(signal, scales, family, newKernelCache());
    }

    /**
     * Transforms a signal.
     *
     * @param signal  input signal, non-empty with finite samples
     * @param scales  scale bank; rows of the result follow its order
     * @param family  mother wavelet
     * @param kernels kernel cache of the current run
     * @return {@code scales.size() x signal.length()} coefficient matrix
     * @throws EmptySignalException      if the signal has no samples
     * @throws NonFiniteInputException   if a sample is NaN or infinite
     * @throws TransformFailureException if a row computation fails unexpectedly
     */
    public CoefficientMatrix transform(Signal signal, ScaleSet scales, WaveletFamily family, KernelCache kernels) {
        Objects.requireNonNull(signal, "signal must not be null");
        Objects.requireNonNull(scales, "scales must not be null");
        Objects.requireNonNull(family, "family must not be null");
        Objects.requireNonNull(kernels, "kernels must not be null");

        double[] samples = signal.samples();
        validate(signal.identifier(), samples);

        long startNanos = System.nanoTime();
        int rows = scales.size();
        List<Row> computed = computeRows(samples, scales, family, kernels);

        double[][] magnitude = new double[rows][];
        double[][] phase = properties.isIncludePhase() ? new double[rows][] : null;
        List<Integer> edgeWidths = new ArrayList<>(rows);
        List<ConvolutionMethod> methods = new ArrayList<>(rows);
        for (int j = 0; j < rows; j++) {
            Row row = computed.get(j);
            magnitude[j] = row.magnitude();
            if (phase != null) {
                phase[j] = row.phase();
            }
            edgeWidths.add(row.edgeWidth());
            methods.add(row.method());
        }

        TransformMetadata metadata = new TransformMetadata(family, basis.centerFrequency(family),
                properties.getPadding(), edgeWidths, methods);
        LOG.debug("CWT {}: {} samples x {} scales ({}) in {}ms", signal.identifier(), samples.length, rows,
                family.getId(), TimeUtils.elapsedMillis(startNanos));
        return new CoefficientMatrix(magnitude, phase, metadata);
    }

    /**
     * Picks the algorithm for one row.
     *
     * @param signalLength number of samples
     * @param kernel       prepared kernel of the row
     * @return {@link ConvolutionMethod#DIRECT} or {@link ConvolutionMethod#FFT}
     */
    ConvolutionMethod resolveMethod(int signalLength, PreparedKernel kernel) {
        ConvolutionMethod configured = properties.getConvolution();
        if (configured != ConvolutionMethod.AUTO) {
            return configured;
        }
        int m = kernel.length();
        if (m <= properties.getFftThreshold()) {
            return ConvolutionMethod.DIRECT;
        }
        int size = kernel.fftSize();
        double fftCost = FFT_COST_FACTOR * size * (Math.log(size) / Math.log(2.0));
        return (double) signalLength * m > fftCost ? ConvolutionMethod.FFT : ConvolutionMethod.DIRECT;
    }

    private List<Row> computeRows(double[] samples, ScaleSet scales, WaveletFamily family, KernelCache kernels) {
        int rows = scales.size();
        List<Row> result = new ArrayList<>(rows);
        if (scaleExecutor == null || !properties.isParallelScales() || rows == 1) {
            for (int j = 0; j < rows; j++) {
                result.add(computeRow(samples, kernels.get(family, scales.scaleAt(j), samples.length)));
            }
            return result;
        }

        List<CompletableFuture<Row>> futures = new ArrayList<>(rows);
        for (int j = 0; j < rows; j++) {
            double scale = scales.scaleAt(j);
            futures.add(CompletableFuture.supplyAsync(
                    () -> computeRow(samples, kernels.get(family, scale, samples.length)), scaleExecutor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            for (CompletableFuture<Row> future : futures) {
                result.add(future.join());
            }
            return result;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ScalogramException scalogramException) {
                throw scalogramException;
            }
            throw new TransformFailureException("Scale computation failed: " + cause.getMessage(), cause);
        }
    }

    private Row computeRow(double[] samples, PreparedKernel kernel) {
        ConvolutionMethod method = resolveMethod(samples.length, kernel);
        double[] padded = SignalPadder.pad(samples, kernel.half(), properties.getPadding());
        int n = samples.length;
        double[] re = new double[n];
        double[] im = new double[n];
        if (method == ConvolutionMethod.FFT) {
            correlateFft(padded, kernel, re, im);
        } else {
            correlateDirect(padded, kernel, re, im);
        }
        if (!kernel.kernel().isComplex()) {
            Arrays.fill(im, 0.0);
        }

        double[] magnitude = new double[n];
        double[] phase = properties.isIncludePhase() ? new double[n] : null;
        for (int b = 0; b < n; b++) {
            magnitude[b] = Math.hypot(re[b], im[b]);
            if (phase != null) {
                phase[b] = Math.atan2(im[b], re[b]);
            }
        }
        return new Row(magnitude, phase, kernel.half(), method);
    }

    private static void correlateDirect(double[] padded, PreparedKernel kernel, double[] re, double[] im) {
        double[] kr = kernel.real();
        double[] ki = kernel.imag();
        int m = kr.length;
        for (int b = 0; b < re.length; b++) {
            double sumRe = 0.0;
            double sumIm = 0.0;
            for (int k = 0; k < m; k++) {
                double v = padded[b + k];
                sumRe += v * kr[k];
                sumIm -= v * ki[k];
            }
            re[b] = sumRe;
            im[b] = sumIm;
        }
    }

    private static void correlateFft(double[] padded, PreparedKernel kernel, double[] re, double[] im) {
        int size = kernel.fftSize();
        double[][] data = new double[2][size];
        System.arraycopy(padded, 0, data[0], 0, padded.length);
        FastFourierTransformer.transformInPlace(data, DftNormalization.STANDARD, TransformType.FORWARD);

        double[][] spectrum = kernel.spectrum();
        for (int i = 0; i < size; i++) {
            double a = data[0][i];
            double b = data[1][i];
            double c = spectrum[0][i];
            double d = spectrum[1][i];
            data[0][i] = a * c - b * d;
            data[1][i] = a * d + b * c;
        }
        FastFourierTransformer.transformInPlace(data, DftNormalization.STANDARD, TransformType.INVERSE);

        // Full convolution index b + 2 * half holds coefficient b.
        int offset = 2 * kernel.half();
        System.arraycopy(data[0], offset, re, 0, re.length);
        System.arraycopy(data[1], offset, im, 0, im.length);
    }

    private static void validate(String identifier, double[] samples) {
        if (samples.length == 0) {
            throw new EmptySignalException(identifier);
        }
        for (int i = 0; i < samples.length; i++) {
            if (!Double.isFinite(samples[i])) {
                throw new NonFiniteInputException(identifier, i, samples[i]);
            }
        }
    }

    private record Row(double[] magnitude, double[] phase, int edgeWidth, ConvolutionMethod method) {
    }
}
