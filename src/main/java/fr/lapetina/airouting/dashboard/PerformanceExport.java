package fr.lapetina.airouting.dashboard;

import fr.lapetina.airouting.domain.model.Alert;
import fr.lapetina.airouting.domain.model.HealthStatus;
import fr.lapetina.airouting.domain.model.OperationRecord;
import fr.lapetina.airouting.domain.model.StatsSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Full dump handed to an external store for long-term analysis.
 */
public record PerformanceExport(
        Instant exportedAt,
        List<OperationRecord> operations,
        List<StatsSnapshot> providers,
        List<StatsSnapshot> services,
        List<Alert> alerts,
        List<HealthStatus> health,
        Summary summary
) {
    /**
     * @param timeRangeStart oldest retained operation, null when there is none
     * @param timeRangeEnd   newest retained operation, null when there is none
     */
    public record Summary(
            long totalOperations,
            Instant timeRangeStart,
            Instant timeRangeEnd,
            int subjectsMonitored
    ) {
    }
}
