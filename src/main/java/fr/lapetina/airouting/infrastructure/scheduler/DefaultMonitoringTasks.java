package fr.lapetina.airouting.infrastructure.scheduler;

import fr.lapetina.airouting.analytics.TrendAnalyzer;
import fr.lapetina.airouting.domain.model.StatsSnapshot;
import fr.lapetina.airouting.domain.model.SubjectKind;
import fr.lapetina.airouting.infrastructure.alert.AlertEngine;
import fr.lapetina.airouting.infrastructure.health.HealthTracker;
import fr.lapetina.airouting.infrastructure.metrics.MetricsStore;
import fr.lapetina.airouting.infrastructure.tracking.RequestTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Monitoring work wired to the live components.
 */
public final class DefaultMonitoringTasks implements MonitoringTasks {

    private static final Logger log = LoggerFactory.getLogger(DefaultMonitoringTasks.class);

    private final MetricsStore metricsStore;
    private final RequestTracker requestTracker;
    private final HealthTracker healthTracker;
    private final AlertEngine alertEngine;
    private final TrendAnalyzer trendAnalyzer;
    private final Duration alertRetention;

    public DefaultMonitoringTasks(
            MetricsStore metricsStore,
            RequestTracker requestTracker,
            HealthTracker healthTracker,
            AlertEngine alertEngine,
            TrendAnalyzer trendAnalyzer,
            Duration alertRetention
    ) {
        this.metricsStore = metricsStore;
        this.requestTracker = requestTracker;
        this.healthTracker = healthTracker;
        this.alertEngine = alertEngine;
        this.trendAnalyzer = trendAnalyzer;
        this.alertRetention = alertRetention;
    }

    @Override
    public void collect() {
        trendAnalyzer.refresh(metricsStore.overall(SubjectKind.PROVIDER),
                metricsStore.snapshots(SubjectKind.PROVIDER));
    }

    @Override
    public void sweepAlerts() {
        List<StatsSnapshot> subjects = new ArrayList<>(metricsStore.snapshots(SubjectKind.PROVIDER));
        subjects.addAll(metricsStore.snapshots(SubjectKind.SERVICE));
        alertEngine.evaluate(subjects);
    }

    @Override
    public void sweepHealth() {
        int stale = healthTracker.sweepStaleness();
        int dropped = requestTracker.sweepStaleRequests();
        int abandoned = requestTracker.sweepAbandonedOperations();
        if (stale > 0 || dropped > 0 || abandoned > 0) {
            log.info("Health sweep: staleProviders={}, droppedRequests={}, abandonedOperations={}",
                    stale, dropped, abandoned);
        }
    }

    @Override
    public void cleanup() {
        int operations = requestTracker.cleanupHistory();
        int alerts = alertEngine.cleanup(alertRetention);
        log.debug("Cleanup complete: operationsRemoved={}, alertsRemoved={}", operations, alerts);
    }
}
