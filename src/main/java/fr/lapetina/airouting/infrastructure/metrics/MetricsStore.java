package fr.lapetina.airouting.infrastructure.metrics;

import fr.lapetina.airouting.domain.model.OverallStats;
import fr.lapetina.airouting.domain.model.StatsSnapshot;
import fr.lapetina.airouting.domain.model.SubjectKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the running statistics of every provider and every service.
 *
 * <p>Two independent tables are kept, one per {@link SubjectKind}. Entries are created
 * on first write. Each entry serialises its own updates; there is no lock across
 * subjects, so aggregate views are best-effort sums of per-subject snapshots.
 */
public final class MetricsStore {

    private static final Logger log = LoggerFactory.getLogger(MetricsStore.class);

    /**
     * Durations at or below zero are replaced by this value.
     */
    public static final double MIN_DURATION_MS = 1.0;

    private final Map<String, RunningStats> providers = new ConcurrentHashMap<>();
    private final Map<String, RunningStats> services = new ConcurrentHashMap<>();
    private final Settings settings;
    private final Random random;

    public MetricsStore(Settings settings, Random random) {
        this.settings = settings;
        this.random = random;
    }

    /**
     * Records a finished operation against a subject.
     *
     * @return the duration actually recorded, after clamping
     */
    public double record(SubjectKind kind, String subjectId, double durationMs, boolean success, Instant at) {
        double clamped = clampDuration(durationMs);
        if (clamped != durationMs) {
            log.debug("Non-positive duration clamped: subject={}, durationMs={}", subjectId, durationMs);
        }
        statsFor(kind, subjectId).record(clamped, success, at);
        return clamped;
    }

    /**
     * Feeds a caller-reported quality score into a provider's moving average.
     */
    public void recordQuality(String providerId, double quality) {
        statsFor(SubjectKind.PROVIDER, providerId).recordQuality(quality);
    }

    public Optional<StatsSnapshot> snapshot(SubjectKind kind, String subjectId) {
        RunningStats stats = table(kind).get(subjectId);
        return stats == null ? Optional.empty() : Optional.of(stats.snapshot());
    }

    /**
     * Snapshots every subject of a kind, ordered by subject id.
     */
    public List<StatsSnapshot> snapshots(SubjectKind kind) {
        return table(kind).values().stream()
                .map(RunningStats::snapshot)
                .sorted(Comparator.comparing(StatsSnapshot::subjectId))
                .toList();
    }

    /**
     * Sums the per-subject counters of a kind.
     */
    public OverallStats overall(SubjectKind kind) {
        List<StatsSnapshot> all = snapshots(kind);
        if (all.isEmpty()) {
            return OverallStats.EMPTY;
        }
        long total = 0;
        long successful = 0;
        long failed = 0;
        double duration = 0.0;
        for (StatsSnapshot s : all) {
            total += s.totalOperations();
            successful += s.successfulOperations();
            failed += s.failedOperations();
            duration += s.totalDurationMs();
        }
        return new OverallStats(
                total,
                successful,
                failed,
                total == 0 ? 0.0 : duration / total,
                total == 0 ? 0.0 : (double) failed / total,
                all.size()
        );
    }

    public double initialQuality() {
        return settings.initialQuality();
    }

    static double clampDuration(double durationMs) {
        if (durationMs <= 0 || Double.isNaN(durationMs)) {
            return MIN_DURATION_MS;
        }
        return durationMs;
    }

    private RunningStats statsFor(SubjectKind kind, String subjectId) {
        return table(kind).computeIfAbsent(subjectId,
                id -> new RunningStats(id, kind, settings, random));
    }

    private Map<String, RunningStats> table(SubjectKind kind) {
        return kind == SubjectKind.PROVIDER ? providers : services;
    }

    /**
     * Tuning shared by every subject's statistics.
     */
    public record Settings(
            int reservoirCapacity,
            int recomputeInterval,
            double qualityLearningRate,
            double initialQuality
    ) {
        public static Settings defaults() {
            return new Settings(200, 100, 0.1, 0.85);
        }
    }
}
