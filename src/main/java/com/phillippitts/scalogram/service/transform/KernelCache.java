package com.phillippitts.scalogram.service.transform;

import com.phillippitts.scalogram.domain.WaveletFamily;
import com.phillippitts.scalogram.service.wavelet.WaveletBasisGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Prepared kernels shared by the transforms of one batch run.
 *
 * <p>Keyed by {@code (family, scale, signalLength)}: files of equal length reuse kernels and
 * their spectra. At most {@code maxSignalLengths} distinct signal lengths are kept; when a new
 * length arrives, every kernel of the least recently used length is dropped. Transforms that
 * still hold an evicted kernel keep using it.
 *
 * <p>Thread-safe. Instances are created per run and discarded with it.
 */
public final class KernelCache {

    private static final Logger LOG = LogManager.getLogger(KernelCache.class);

    /** Distinct signal lengths kept when no bound is given. */
    public static final int DEFAULT_MAX_SIGNAL_LENGTHS = 4;

    private final WaveletBasisGenerator basis;
    private final int maxSignalLengths;
    private final Lock lock = new ReentrantLock();
    // access-ordered: first entry is the least recently used length
    private final LinkedHashMap<Integer, Map<Key, PreparedKernel>> byLength = new LinkedHashMap<>(16, 0.75f, true);

    public KernelCache(WaveletBasisGenerator basis) {
        this(basis, DEFAULT_MAX_SIGNAL_LENGTHS);
    }

    /**
     * @param basis            kernel generator
     * @param maxSignalLengths number of distinct signal lengths kept, at least 1
     */
    public KernelCache(WaveletBasisGenerator basis, int maxSignalLengths) {
        this.basis = Objects.requireNonNull(basis, "basis must not be null");
        if (maxSignalLengths < 1) {
            throw new IllegalArgumentException("maxSignalLengths must be at least 1, got: " + maxSignalLengths);
        }
        this.maxSignalLengths = maxSignalLengths;
    }

    /**
     * Returns the prepared kernel, generating it on first request.
     *
     * @param family       wavelet family
     * @param scale        dilation in samples
     * @param signalLength length of the signals it will be correlated with
     * @return shared prepared kernel
     */
    public PreparedKernel get(WaveletFamily family, double scale, int signalLength) {
        return kernelsFor(signalLength).computeIfAbsent(new Key(family, scale),
                key -> new PreparedKernel(basis.kernel(key.family(), key.scale()), signalLength));
    }

    /**
     * @return number of cached kernels over all retained lengths
     */
    public int size() {
        lock.lock();
        try {
            int total = 0;
            for (Map<Key, PreparedKernel> kernels : byLength.values()) {
                total += kernels.size();
            }
            return total;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of distinct signal lengths currently cached
     */
    public int signalLengthCount() {
        lock.lock();
        try {
            return byLength.size();
        } finally {
            lock.unlock();
        }
    }

    public int maxSignalLengths() {
        return maxSignalLengths;
    }

    private Map<Key, PreparedKernel> kernelsFor(int signalLength) {
        lock.lock();
        try {
            Map<Key, PreparedKernel> kernels = byLength.get(signalLength);
            if (kernels != null) {
                return kernels;
            }
            evictFor(1);
            kernels = new ConcurrentHashMap<>();
            byLength.put(signalLength, kernels);
            return kernels;
        } finally {
            lock.unlock();
        }
    }

    private void evictFor(int incoming) {
        Iterator<Map.Entry<Integer, Map<Key, PreparedKernel>>> it = byLength.entrySet().iterator();
        while (byLength.size() + incoming > maxSignalLengths && it.hasNext()) {
            Map.Entry<Integer, Map<Key, PreparedKernel>> eldest = it.next();
            LOG.debug("Evicting {} kernel(s) for signal length {}", eldest.getValue().size(), eldest.getKey());
            it.remove();
        }
    }

    private record Key(WaveletFamily family, double scale) {
    }
}
