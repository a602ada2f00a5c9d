package fr.lapetina.airouting.dashboard;

import java.time.Instant;

/**
 * Lightweight status for polling and the command line.
 */
public record DashboardSummary(
        SystemStatus status,
        long totalOperations,
        double errorRate,
        double averageDurationMs,
        int activeAlerts,
        int criticalAlerts,
        int providersMonitored,
        int servicesMonitored,
        Instant generatedAt
) {
}
