package fr.lapetina.airouting.dashboard;

import fr.lapetina.airouting.analytics.TrendAnalyzer;
import fr.lapetina.airouting.domain.model.Alert;
import fr.lapetina.airouting.domain.model.AlertSeverity;
import fr.lapetina.airouting.domain.model.OperationRecord;
import fr.lapetina.airouting.domain.model.OverallStats;
import fr.lapetina.airouting.domain.model.StatsSnapshot;
import fr.lapetina.airouting.domain.model.SubjectKind;
import fr.lapetina.airouting.infrastructure.alert.AlertEngine;
import fr.lapetina.airouting.infrastructure.health.HealthTracker;
import fr.lapetina.airouting.infrastructure.metrics.MetricsStore;
import fr.lapetina.airouting.infrastructure.time.TimeSource;
import fr.lapetina.airouting.infrastructure.tracking.RequestTracker;
import fr.lapetina.airouting.routing.RoutingDecisionEngine;

import java.time.Instant;
import java.util.List;

/**
 * Builds read-only views over the monitoring state. Every view is a best-effort
 * composition of per-component snapshots taken one after another.
 */
public final class DashboardAssembler {

    static final int RECENT_OPERATIONS = 100;

    private final MetricsStore metricsStore;
    private final RequestTracker requestTracker;
    private final HealthTracker healthTracker;
    private final AlertEngine alertEngine;
    private final TrendAnalyzer trendAnalyzer;
    private final RoutingDecisionEngine routingEngine;
    private final TimeSource timeSource;
    private final AlertEngine.Thresholds thresholds;
    private final int maxActiveAlerts;

    public DashboardAssembler(
            MetricsStore metricsStore,
            RequestTracker requestTracker,
            HealthTracker healthTracker,
            AlertEngine alertEngine,
            TrendAnalyzer trendAnalyzer,
            RoutingDecisionEngine routingEngine,
            TimeSource timeSource,
            AlertEngine.Thresholds thresholds,
            int maxActiveAlerts
    ) {
        this.metricsStore = metricsStore;
        this.requestTracker = requestTracker;
        this.healthTracker = healthTracker;
        this.alertEngine = alertEngine;
        this.trendAnalyzer = trendAnalyzer;
        this.routingEngine = routingEngine;
        this.timeSource = timeSource;
        this.thresholds = thresholds;
        this.maxActiveAlerts = maxActiveAlerts;
    }

    public Dashboard dashboard() {
        return new Dashboard(
                timeSource.now(),
                metricsStore.overall(SubjectKind.SERVICE),
                metricsStore.overall(SubjectKind.PROVIDER),
                views(SubjectKind.PROVIDER),
                views(SubjectKind.SERVICE),
                healthTracker.getAllStatuses(),
                alertEngine.getActiveAlerts(maxActiveAlerts),
                requestTracker.getRecentOperations(RECENT_OPERATIONS),
                trendAnalyzer.getLatest().orElse(null),
                routingEngine.getStrategy().getName(),
                requestTracker.getTotalInFlight(),
                requestTracker.isEnabled()
        );
    }

    public DashboardSummary summary() {
        OverallStats overall = overallForSummary();
        List<Alert> active = alertEngine.getActiveAlerts(Integer.MAX_VALUE);
        int critical = (int) active.stream().filter(a -> a.severity() == AlertSeverity.CRITICAL).count();

        SystemStatus status;
        if (critical > 0) {
            status = SystemStatus.CRITICAL;
        } else if (!active.isEmpty()) {
            status = SystemStatus.WARNING;
        } else if (overall.errorRate() > 0.1) {
            status = SystemStatus.DEGRADED;
        } else {
            status = SystemStatus.HEALTHY;
        }

        return new DashboardSummary(
                status,
                overall.totalOperations(),
                overall.errorRate(),
                overall.averageDurationMs(),
                active.size(),
                critical,
                metricsStore.snapshots(SubjectKind.PROVIDER).size(),
                metricsStore.snapshots(SubjectKind.SERVICE).size(),
                timeSource.now()
        );
    }

    public PerformanceExport export() {
        List<OperationRecord> operations = requestTracker.getAllOperations();
        List<StatsSnapshot> providers = metricsStore.snapshots(SubjectKind.PROVIDER);
        List<StatsSnapshot> services = metricsStore.snapshots(SubjectKind.SERVICE);
        Instant start = operations.isEmpty() ? null : operations.get(0).timestamp();
        Instant end = operations.isEmpty() ? null : operations.get(operations.size() - 1).timestamp();

        return new PerformanceExport(
                timeSource.now(),
                operations,
                providers,
                services,
                alertEngine.getAllAlerts(),
                healthTracker.getAllStatuses(),
                new PerformanceExport.Summary(operations.size(), start, end, providers.size() + services.size())
        );
    }

    /**
     * Threshold classification of one subject.
     */
    public HealthLevel classify(StatsSnapshot stats) {
        if (!stats.hasData()) {
            return HealthLevel.HEALTHY;
        }
        double errorRate = stats.errorRate();
        double latency = stats.averageDurationMs();
        if (errorRate > thresholds.errorRateCritical() || latency > thresholds.latencyCriticalMs()) {
            return HealthLevel.CRITICAL;
        }
        if (errorRate > thresholds.errorRateWarning() || latency > thresholds.latencyWarningMs()) {
            return HealthLevel.WARNING;
        }
        return HealthLevel.HEALTHY;
    }

    private List<SubjectView> views(SubjectKind kind) {
        return metricsStore.snapshots(kind).stream()
                .map(s -> new SubjectView(
                        s,
                        s.averageDurationMs(),
                        s.errorRate(),
                        kind == SubjectKind.PROVIDER ? requestTracker.getInFlight(s.subjectId()) : 0,
                        classify(s)))
                .toList();
    }

    // Services see every tracked request that named one; fall back to providers otherwise.
    private OverallStats overallForSummary() {
        OverallStats services = metricsStore.overall(SubjectKind.SERVICE);
        return services.totalOperations() > 0 ? services : metricsStore.overall(SubjectKind.PROVIDER);
    }
}
