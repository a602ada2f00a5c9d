package fr.lapetina.airouting.infrastructure.metrics;

import fr.lapetina.airouting.domain.model.StatsSnapshot;
import fr.lapetina.airouting.domain.model.SubjectKind;

import java.time.Instant;
import java.util.Random;

/**
 * Mutable running statistics of one provider or service.
 *
 * <p>Each instance is its own monitor, so updates to one subject never wait on
 * another. Readers get a consistent {@link StatsSnapshot}.
 */
public final class RunningStats {

    private final String subjectId;
    private final SubjectKind kind;
    private final PercentileReservoir reservoir;
    private final double learningRate;

    private long total;
    private long successful;
    private long failed;
    private double sumDurationMs;
    private double minDurationMs = Double.NaN;
    private double maxDurationMs = Double.NaN;
    private double qualityScore;
    private Instant lastOperationAt;

    RunningStats(String subjectId, SubjectKind kind, MetricsStore.Settings settings, Random random) {
        this.subjectId = subjectId;
        this.kind = kind;
        this.reservoir = new PercentileReservoir(
                settings.reservoirCapacity(), settings.recomputeInterval(), random);
        this.learningRate = settings.qualityLearningRate();
        this.qualityScore = settings.initialQuality();
    }

    /**
     * Records one finished operation. Duration must already be clamped positive.
     */
    synchronized void record(double durationMs, boolean success, Instant at) {
        total++;
        if (success) {
            successful++;
        } else {
            failed++;
        }
        sumDurationMs += durationMs;
        minDurationMs = Double.isNaN(minDurationMs) ? durationMs : Math.min(minDurationMs, durationMs);
        maxDurationMs = Double.isNaN(maxDurationMs) ? durationMs : Math.max(maxDurationMs, durationMs);
        lastOperationAt = at;
        reservoir.add(durationMs, total);
    }

    /**
     * Folds a caller-reported quality into the exponentially weighted average.
     */
    synchronized void recordQuality(double quality) {
        double bounded = Math.max(0.0, Math.min(1.0, quality));
        qualityScore = qualityScore * (1 - learningRate) + bounded * learningRate;
    }

    public synchronized StatsSnapshot snapshot() {
        return new StatsSnapshot(
                subjectId,
                kind,
                total,
                successful,
                failed,
                sumDurationMs,
                Double.isNaN(minDurationMs) ? 0.0 : minDurationMs,
                Double.isNaN(maxDurationMs) ? 0.0 : maxDurationMs,
                reservoir.p95(),
                qualityScore,
                lastOperationAt
        );
    }

    public String getSubjectId() {
        return subjectId;
    }

    public SubjectKind getKind() {
        return kind;
    }
}
