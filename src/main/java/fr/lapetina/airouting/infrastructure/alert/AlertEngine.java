package fr.lapetina.airouting.infrastructure.alert;

import fr.lapetina.airouting.domain.model.Alert;
import fr.lapetina.airouting.domain.model.AlertSeverity;
import fr.lapetina.airouting.domain.model.AlertType;
import fr.lapetina.airouting.domain.model.StatsSnapshot;
import fr.lapetina.airouting.domain.model.SubjectKind;
import fr.lapetina.airouting.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.airouting.infrastructure.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Evaluates statistics snapshots against thresholds and keeps the set of alerts.
 *
 * <p>Rules per subject:
 * <ul>
 *   <li>latency: mean duration above warning raises HIGH, above critical raises CRITICAL</li>
 *   <li>error rate: same tiers on the failure ratio</li>
 *   <li>inactivity: a subject that has seen traffic but nothing within the window raises MEDIUM</li>
 * </ul>
 *
 * <p>At most one unresolved alert exists per (subject, type). Once resolved, the same
 * pair stays quiet until the cooldown has elapsed.
 */
public final class AlertEngine {

    private static final Logger log = LoggerFactory.getLogger(AlertEngine.class);

    private final Map<String, Alert> alerts = new ConcurrentHashMap<>();
    private final Map<AlertKey, String> openAlerts = new ConcurrentHashMap<>();
    private final Map<AlertKey, Instant> lastResolved = new ConcurrentHashMap<>();
    private final List<Consumer<Alert>> listeners = new CopyOnWriteArrayList<>();
    private final TimeSource timeSource;
    private final MetricsRegistry metricsRegistry;
    private final Thresholds thresholds;

    public AlertEngine(TimeSource timeSource, MetricsRegistry metricsRegistry, Thresholds thresholds) {
        this.timeSource = timeSource;
        this.metricsRegistry = metricsRegistry;
        this.thresholds = thresholds;
    }

    /**
     * Evaluates every snapshot. A failure on one subject is logged and does not stop the sweep.
     *
     * @return alerts raised during this sweep
     */
    public List<Alert> evaluate(List<StatsSnapshot> snapshots) {
        List<Alert> raised = new ArrayList<>();
        for (StatsSnapshot snapshot : snapshots) {
            try {
                evaluateSubject(snapshot, raised);
            } catch (RuntimeException e) {
                log.error("Alert evaluation failed, continuing: subject={}", snapshot.subjectId(), e);
            }
        }
        metricsRegistry.setActiveAlerts(countActive());
        if (!raised.isEmpty()) {
            log.info("Alert sweep complete: subjects={}, raised={}", snapshots.size(), raised.size());
        }
        return raised;
    }

    private void evaluateSubject(StatsSnapshot snapshot, List<Alert> raised) {
        if (!snapshot.hasData()) {
            return;
        }
        double latency = snapshot.averageDurationMs();
        if (latency > thresholds.latencyWarningMs()) {
            boolean critical = latency > thresholds.latencyCriticalMs();
            raise(snapshot, AlertType.LATENCY,
                    critical ? AlertSeverity.CRITICAL : AlertSeverity.HIGH,
                    critical ? thresholds.latencyCriticalMs() : thresholds.latencyWarningMs(),
                    latency,
                    String.format("Average response time %.0fms exceeds %.0fms",
                            latency, critical ? thresholds.latencyCriticalMs() : thresholds.latencyWarningMs()))
                    .ifPresent(raised::add);
        }

        double errorRate = snapshot.errorRate();
        if (errorRate > thresholds.errorRateWarning()) {
            boolean critical = errorRate > thresholds.errorRateCritical();
            raise(snapshot, AlertType.ERROR_RATE,
                    critical ? AlertSeverity.CRITICAL : AlertSeverity.HIGH,
                    critical ? thresholds.errorRateCritical() : thresholds.errorRateWarning(),
                    errorRate,
                    String.format("Error rate %.1f%% exceeds %.1f%%",
                            errorRate * 100, (critical ? thresholds.errorRateCritical() : thresholds.errorRateWarning()) * 100))
                    .ifPresent(raised::add);
        }

        Instant last = snapshot.lastOperationAt();
        if (last != null) {
            Duration idle = Duration.between(last, timeSource.now());
            if (idle.compareTo(thresholds.inactivityWindow()) > 0) {
                raise(snapshot, AlertType.INACTIVITY, AlertSeverity.MEDIUM,
                        thresholds.inactivityWindow().toMillis(), idle.toMillis(),
                        "No activity for " + idle.toMinutes() + " minutes, possibly down")
                        .ifPresent(raised::add);
            }
        }
    }

    private Optional<Alert> raise(
            StatsSnapshot snapshot,
            AlertType type,
            AlertSeverity severity,
            double threshold,
            double observed,
            String message
    ) {
        AlertKey key = new AlertKey(snapshot.subjectId(), snapshot.kind(), type);
        Instant now = timeSource.now();
        Alert[] created = new Alert[1];

        openAlerts.compute(key, (k, openId) -> {
            if (openId != null) {
                return openId;
            }
            Instant resolvedAt = lastResolved.get(k);
            if (resolvedAt != null && Duration.between(resolvedAt, now).compareTo(thresholds.cooldown()) < 0) {
                log.debug("Alert suppressed by cooldown: subject={}, type={}", k.subjectId(), k.type());
                return null;
            }
            Alert alert = new Alert(UUID.randomUUID().toString(), snapshot.subjectId(), snapshot.kind(),
                    type, severity, message, threshold, observed, now, null);
            alerts.put(alert.id(), alert);
            created[0] = alert;
            return alert.id();
        });

        Alert alert = created[0];
        if (alert == null) {
            return Optional.empty();
        }
        log.warn("Alert raised: id={}, subject={}, type={}, severity={}, message={}",
                alert.id(), alert.subjectId(), alert.type(), alert.severity(), alert.message());
        metricsRegistry.incrementAlertCount(type, severity);
        notifyListeners(alert);
        return Optional.of(alert);
    }

    /**
     * Resolves an alert.
     *
     * @return false if the alert is unknown or already resolved
     */
    public boolean resolveAlert(String alertId) {
        Instant now = timeSource.now();
        Alert[] resolved = new Alert[1];
        alerts.computeIfPresent(alertId, (id, alert) -> {
            if (alert.isResolved()) {
                return alert;
            }
            resolved[0] = alert.resolve(now);
            return resolved[0];
        });
        Alert alert = resolved[0];
        if (alert == null) {
            return false;
        }
        AlertKey key = new AlertKey(alert.subjectId(), alert.subjectKind(), alert.type());
        lastResolved.put(key, now);
        openAlerts.remove(key, alertId);
        metricsRegistry.setActiveAlerts(countActive());
        log.info("Alert resolved: id={}, subject={}, type={}", alertId, alert.subjectId(), alert.type());
        return true;
    }

    /**
     * Drops alerts created before the retention window.
     *
     * @return number of alerts removed
     */
    public int cleanup(Duration retention) {
        Instant cutoff = timeSource.now().minus(retention);
        int removed = 0;
        for (Alert alert : new ArrayList<>(alerts.values())) {
            if (alert.createdAt().isBefore(cutoff) && alerts.remove(alert.id()) != null) {
                openAlerts.remove(new AlertKey(alert.subjectId(), alert.subjectKind(), alert.type()), alert.id());
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Alerts cleaned up: removed={}, retained={}", removed, alerts.size());
            metricsRegistry.setActiveAlerts(countActive());
        }
        return removed;
    }

    /**
     * Most recent unresolved alerts, newest first, capped at {@code limit}.
     */
    public List<Alert> getActiveAlerts(int limit) {
        return alerts.values().stream()
                .filter(a -> !a.isResolved())
                .sorted(Comparator.comparing(Alert::createdAt).reversed())
                .limit(limit)
                .toList();
    }

    public List<Alert> getAllAlerts() {
        return alerts.values().stream()
                .sorted(Comparator.comparing(Alert::createdAt))
                .toList();
    }

    public Optional<Alert> getAlert(String alertId) {
        return Optional.ofNullable(alerts.get(alertId));
    }

    public int countActive() {
        return (int) alerts.values().stream().filter(a -> !a.isResolved()).count();
    }

    public void addListener(Consumer<Alert> listener) {
        listeners.add(listener);
    }

    private void notifyListeners(Alert alert) {
        for (Consumer<Alert> listener : listeners) {
            try {
                listener.accept(alert);
            } catch (Exception e) {
                log.error("Error notifying alert listener", e);
            }
        }
    }

    private record AlertKey(String subjectId, SubjectKind kind, AlertType type) {
    }

    /**
     * Alert tiers and timing.
     */
    public record Thresholds(
            double latencyWarningMs,
            double latencyCriticalMs,
            double errorRateWarning,
            double errorRateCritical,
            Duration inactivityWindow,
            Duration cooldown
    ) {
        public static Thresholds defaults() {
            return new Thresholds(5000, 10000, 0.15, 0.30, Duration.ofMinutes(5), Duration.ofMinutes(10));
        }
    }
}
