package fr.lapetina.airouting.analytics;

import fr.lapetina.airouting.domain.model.OverallStats;
import fr.lapetina.airouting.domain.model.StatsSnapshot;
import fr.lapetina.airouting.infrastructure.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Compares successive system-wide samples to tell whether performance is moving.
 *
 * <p>Response time and error rate improve when they go down; throughput and quality
 * improve when they go up. A relative change smaller than the adaptation threshold is
 * reported as stable.
 */
public final class TrendAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TrendAnalyzer.class);

    private static final double CONFIDENT_SAMPLE_SIZE = 100.0;

    private final TimeSource timeSource;
    private final double adaptationThreshold;

    private Sample previous;
    private volatile PerformanceTrends latest;

    public TrendAnalyzer(TimeSource timeSource, double adaptationThreshold) {
        this.timeSource = timeSource;
        this.adaptationThreshold = adaptationThreshold;
    }

    /**
     * Takes a new sample and recomputes the trends against the previous one.
     *
     * @param overall   provider-wide totals
     * @param providers per-provider snapshots, used for the average quality
     */
    public synchronized PerformanceTrends refresh(OverallStats overall, List<StatsSnapshot> providers) {
        Instant now = timeSource.now();
        double quality = providers.stream()
                .filter(StatsSnapshot::hasData)
                .mapToDouble(StatsSnapshot::qualityScore)
                .average()
                .orElse(0.0);

        Sample current = new Sample(now, overall.totalOperations(), overall.averageDurationMs(),
                overall.errorRate(), quality);
        Sample base = previous != null ? previous : current;

        double throughput = perMinute(current, base);
        double previousThroughput = base.throughputPerMinute;
        current.throughputPerMinute = throughput;

        double confidence = Math.min(1.0, overall.totalOperations() / CONFIDENT_SAMPLE_SIZE);
        PerformanceTrends trends = new PerformanceTrends(
                trend("responseTime", current.averageDurationMs, base.averageDurationMs, false, confidence),
                trend("errorRate", current.errorRate, base.errorRate, false, confidence),
                trend("throughput", throughput, previousThroughput, true, confidence),
                trend("quality", current.quality, base.quality, true, confidence),
                now
        );

        previous = current;
        latest = trends;
        log.debug("Trends refreshed: responseTime={}, errorRate={}, throughput={}, quality={}",
                trends.responseTime().direction(), trends.errorRate().direction(),
                trends.throughput().direction(), trends.quality().direction());
        return trends;
    }

    public Optional<PerformanceTrends> getLatest() {
        return Optional.ofNullable(latest);
    }

    private double perMinute(Sample current, Sample base) {
        long elapsedMs = Duration.between(base.at, current.at).toMillis();
        if (elapsedMs <= 0) {
            return base.throughputPerMinute;
        }
        return (current.totalOperations - base.totalOperations) * 60_000.0 / elapsedMs;
    }

    TrendData trend(String metric, double current, double previousValue, boolean higherIsBetter, double confidence) {
        double change = current - previousValue;
        double changePercent = previousValue != 0.0 ? change / Math.abs(previousValue) : 0.0;
        TrendDirection direction;
        if (Math.abs(changePercent) < adaptationThreshold) {
            direction = TrendDirection.STABLE;
        } else if ((change > 0) == higherIsBetter) {
            direction = TrendDirection.IMPROVING;
        } else {
            direction = TrendDirection.DECLINING;
        }
        return new TrendData(metric, current, previousValue, change, changePercent, direction, confidence);
    }

    private static final class Sample {
        private final Instant at;
        private final long totalOperations;
        private final double averageDurationMs;
        private final double errorRate;
        private final double quality;
        private double throughputPerMinute;

        private Sample(Instant at, long totalOperations, double averageDurationMs, double errorRate, double quality) {
            this.at = at;
            this.totalOperations = totalOperations;
            this.averageDurationMs = averageDurationMs;
            this.errorRate = errorRate;
            this.quality = quality;
        }
    }
}
