package fr.lapetina.airouting.infrastructure.metrics;

import java.util.Arrays;
import java.util.Random;

/**
 * Fixed-capacity sample of durations used to approximate the 95th percentile.
 *
 * <p>While the reservoir is not full every value is appended. Once full, a slot
 * {@code j = floor(random * totalOperations)} is drawn and the value replaces slot
 * {@code j} only if {@code j < capacity}. The percentile is recomputed on every update
 * until the reservoir fills, then once every {@code recomputeInterval} operations.
 *
 * <p>Not thread-safe. The owning {@link RunningStats} serialises access.
 */
final class PercentileReservoir {

    private static final double PERCENTILE = 0.95;

    private final double[] samples;
    private final int recomputeInterval;
    private final Random random;

    private int size;
    private long lastRecomputeAt;
    private double p95;

    PercentileReservoir(int capacity, int recomputeInterval, Random random) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Reservoir capacity must be > 0: " + capacity);
        }
        if (recomputeInterval <= 0) {
            throw new IllegalArgumentException("Recompute interval must be > 0: " + recomputeInterval);
        }
        this.samples = new double[capacity];
        this.recomputeInterval = recomputeInterval;
        this.random = random;
    }

    /**
     * Offers a value.
     *
     * @param value           the measured duration
     * @param totalOperations total operations recorded so far, including this one
     */
    void add(double value, long totalOperations) {
        if (size < samples.length) {
            samples[size++] = value;
        } else {
            long j = (long) Math.floor(random.nextDouble() * totalOperations);
            if (j < samples.length) {
                samples[(int) j] = value;
            }
        }

        if (size < samples.length || totalOperations - lastRecomputeAt >= recomputeInterval) {
            recompute();
            lastRecomputeAt = totalOperations;
        }
    }

    private void recompute() {
        Arrays.sort(samples, 0, size);
        int index = (int) Math.floor(size * PERCENTILE);
        p95 = samples[Math.min(index, size - 1)];
    }

    double p95() {
        return p95;
    }

    int size() {
        return size;
    }

    int capacity() {
        return samples.length;
    }
}
