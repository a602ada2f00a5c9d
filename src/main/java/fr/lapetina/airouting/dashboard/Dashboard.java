package fr.lapetina.airouting.dashboard;

import fr.lapetina.airouting.analytics.PerformanceTrends;
import fr.lapetina.airouting.domain.model.Alert;
import fr.lapetina.airouting.domain.model.HealthStatus;
import fr.lapetina.airouting.domain.model.OperationRecord;
import fr.lapetina.airouting.domain.model.OverallStats;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate view of everything being monitored.
 *
 * @param overall        totals summed over services
 * @param providerTotals totals summed over providers
 * @param trends         null until the first collection tick
 */
public record Dashboard(
        Instant generatedAt,
        OverallStats overall,
        OverallStats providerTotals,
        List<SubjectView> providers,
        List<SubjectView> services,
        List<HealthStatus> health,
        List<Alert> activeAlerts,
        List<OperationRecord> recentOperations,
        PerformanceTrends trends,
        String strategy,
        int totalInFlight,
        boolean monitoringEnabled
) {
}
