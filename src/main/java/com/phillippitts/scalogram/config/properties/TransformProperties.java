package com.phillippitts.scalogram.config.properties;

import com.phillippitts.scalogram.domain.ConvolutionMethod;
import com.phillippitts.scalogram.domain.PaddingMode;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Continuous wavelet transform settings.
 *
 * <p>Properties:
 * <ul>
 *   <li>scalogram.transform.wavelet-family - morlet or derivative_of_gaussian (aliases accepted)</li>
 *   <li>scalogram.transform.scale-min / scale-max - scale bounds in samples (default: 1 / 128)</li>
 *   <li>scalogram.transform.frequency-min / frequency-max - when both are set, scales are derived
 *       from this band instead</li>
 *   <li>scalogram.transform.points-per-octave - scale density (default: 8)</li>
 *   <li>scalogram.transform.convolution - AUTO, DIRECT or FFT (default: AUTO)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "scalogram.transform")
@Validated
public class TransformProperties {

    @NotBlank(message = "Wavelet family must not be blank")
    private String waveletFamily = "morlet";

    /** Morlet central angular frequency; below 5 the wavelet is no longer admissible in practice. */
    @DecimalMin(value = "5.0", message = "Morlet omega0 must be at least 5.0")
    private double morletOmega0 = 6.0;

    @Positive(message = "Minimum scale must be positive")
    private double scaleMin = 1.0;

    @Positive(message = "Maximum scale must be positive")
    private double scaleMax = 128.0;

    @Positive(message = "Minimum frequency must be positive")
    private Double frequencyMin;

    @Positive(message = "Maximum frequency must be positive")
    private Double frequencyMax;

    @Min(value = 1, message = "Points per octave must be at least 1")
    @Max(value = 64, message = "Points per octave must be at most 64")
    private int pointsPerOctave = 8;

    @NotNull(message = "Padding mode must not be null")
    private PaddingMode padding = PaddingMode.REFLECTIVE;

    @NotNull(message = "Convolution method must not be null")
    private ConvolutionMethod convolution = ConvolutionMethod.AUTO;

    /** Kernels up to this length are always correlated directly in AUTO mode. */
    @PositiveOrZero(message = "FFT threshold must not be negative")
    private int fftThreshold = 64;

    private boolean includePhase = false;

    private boolean parallelScales = true;

    /** Distinct signal lengths whose prepared kernels are kept during one run. */
    @Min(value = 1, message = "Kernel cache must keep at least one signal length")
    private int kernelCacheLengths = 4;

    @AssertTrue(message = "Maximum scale must not be below minimum scale")
    public boolean isScaleRangeValid() {
        return scaleMax >= scaleMin;
    }

    @AssertTrue(message = "Frequency bounds must be set together and maximum must not be below minimum")
    public boolean isFrequencyRangeValid() {
        if (frequencyMin == null && frequencyMax == null) {
            return true;
        }
        return frequencyMin != null && frequencyMax != null && frequencyMax >= frequencyMin;
    }

    /**
     * @return {@code true} when scales should be derived from a frequency band
     */
    public boolean usesFrequencyBand() {
        return frequencyMin != null && frequencyMax != null;
    }

    public String getWaveletFamily() {
        return waveletFamily;
    }

    public void setWaveletFamily(String waveletFamily) {
        this.waveletFamily = waveletFamily;
    }

    public double getMorletOmega0() {
        return morletOmega0;
    }

    public void setMorletOmega0(double morletOmega0) {
        this.morletOmega0 = morletOmega0;
    }

    public double getScaleMin() {
        return scaleMin;
    }

    public void setScaleMin(double scaleMin) {
        this.scaleMin = scaleMin;
    }

    public double getScaleMax() {
        return scaleMax;
    }

    public void setScaleMax(double scaleMax) {
        this.scaleMax = scaleMax;
    }

    public Double getFrequencyMin() {
        return frequencyMin;
    }

    public void setFrequencyMin(Double frequencyMin) {
        this.frequencyMin = frequencyMin;
    }

    public Double getFrequencyMax() {
        return frequencyMax;
    }

    public void setFrequencyMax(Double frequencyMax) {
        this.frequencyMax = frequencyMax;
    }

    public int getPointsPerOctave() {
        return pointsPerOctave;
    }

    public void setPointsPerOctave(int pointsPerOctave) {
        this.pointsPerOctave = pointsPerOctave;
    }

    public PaddingMode getPadding() {
        return padding;
    }

    public void setPadding(PaddingMode padding) {
        this.padding = padding;
    }

    public ConvolutionMethod getConvolution() {
        return convolution;
    }

    public void setConvolution(ConvolutionMethod convolution) {
        this.convolution = convolution;
    }

    public int getFftThreshold() {
        return fftThreshold;
    }

    public void setFftThreshold(int fftThreshold) {
        this.fftThreshold = fftThreshold;
    }

    public boolean isIncludePhase() {
        return includePhase;
    }

    public void setIncludePhase(boolean includePhase) {
        this.includePhase = includePhase;
    }

    public boolean isParallelScales() {
        return parallelScales;
    }

    public void setParallelScales(boolean parallelScales) {
        this.parallelScales = parallelScales;
    }

    public int getKernelCacheLengths() {
        return kernelCacheLengths;
    }

    public void setKernelCacheLengths(int kernelCacheLengths) {
        this.kernelCacheLengths = kernelCacheLengths;
    }
}
