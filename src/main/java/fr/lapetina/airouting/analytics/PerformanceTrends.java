package fr.lapetina.airouting.analytics;

import java.time.Instant;

/**
 * Trends computed on the last collection tick.
 */
public record PerformanceTrends(
        TrendData responseTime,
        TrendData errorRate,
        TrendData throughput,
        TrendData quality,
        Instant computedAt
) {
}
