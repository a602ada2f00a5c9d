package fr.lapetina.airouting.domain.model;

/**
 * System-wide totals, summed from per-subject statistics at read time.
 */
public record OverallStats(
        long totalOperations,
        long successfulOperations,
        long failedOperations,
        double averageDurationMs,
        double errorRate,
        int subjectsMonitored
) {
    public static final OverallStats EMPTY = new OverallStats(0, 0, 0, 0.0, 0.0, 0);
}
