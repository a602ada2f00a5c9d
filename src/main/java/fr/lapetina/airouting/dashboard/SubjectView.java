package fr.lapetina.airouting.dashboard;

import fr.lapetina.airouting.domain.model.StatsSnapshot;

/**
 * Dashboard row for one provider or service, with derived values spelled out.
 */
public record SubjectView(
        StatsSnapshot stats,
        double averageDurationMs,
        double errorRate,
        int inFlight,
        HealthLevel health
) {
}
