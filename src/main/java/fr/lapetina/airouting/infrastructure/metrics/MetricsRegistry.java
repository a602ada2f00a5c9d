package fr.lapetina.airouting.infrastructure.metrics;

import fr.lapetina.airouting.domain.model.AlertSeverity;
import fr.lapetina.airouting.domain.model.AlertType;
import fr.lapetina.airouting.domain.model.SubjectKind;
import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Micrometer export of what the router observes, for Prometheus scraping.
 *
 * Provides:
 * - Operation counters and latency timers per provider and service
 * - In-flight and health gauges per provider
 * - Alert and routing decision counters
 * - JVM and system metrics
 *
 * <p>This is an export channel only; routing reads {@link MetricsStore}.
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> operationCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> alertCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> decisionCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Boolean> providerGauges = new ConcurrentHashMap<>();

    private final Counter droppedDecisions;
    private final Counter unknownCompletions;
    private final DistributionSummary estimateError;
    private final AtomicInteger activeAlerts = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        Gauge.builder(prefix + "_alerts_active", activeAlerts, AtomicInteger::get)
                .description("Number of unresolved alerts")
                .register(registry);

        this.droppedDecisions = Counter.builder(prefix + "_decisions_dropped_total")
                .description("Routing decisions not journaled because the ring buffer was full")
                .register(registry);

        this.unknownCompletions = Counter.builder(prefix + "_unknown_completions_total")
                .description("Completions reported for requests or handles that were not tracked")
                .register(registry);

        this.estimateError = DistributionSummary.builder(prefix + "_decision_estimate_error_ms")
                .description("Absolute difference between estimated and observed response time")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("ai_router");
    }

    /**
     * Counts one finished operation and records its latency.
     */
    public void recordOperation(SubjectKind kind, String subjectId, double durationMs, boolean success) {
        String kindTag = kind.name().toLowerCase();
        String outcome = success ? "success" : "failure";
        String key = kindTag + ":" + subjectId + ":" + outcome;
        operationCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_operations_total")
                        .description("Total number of tracked operations")
                        .tag("kind", kindTag)
                        .tag("subject", subjectId)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();

        latencyTimers.computeIfAbsent(kindTag + ":" + subjectId, k ->
                Timer.builder(prefix + "_operation_latency")
                        .description("Operation latency")
                        .tag("kind", kindTag)
                        .tag("subject", subjectId)
                        .publishPercentiles(0.5, 0.95, 0.99)
                        .register(registry)
        ).record(Duration.ofNanos((long) (durationMs * 1_000_000)));
    }

    /**
     * Registers in-flight and health gauges for a provider, once.
     */
    public void registerProvider(String providerId, Supplier<Number> inFlight, Supplier<Number> health) {
        if (providerGauges.putIfAbsent(providerId, Boolean.TRUE) != null) {
            return;
        }
        Gauge.builder(prefix + "_provider_inflight", inFlight, s -> s.get().doubleValue())
                .description("In-flight requests per provider")
                .tag("provider", providerId)
                .register(registry);
        Gauge.builder(prefix + "_provider_health", health, s -> s.get().doubleValue())
                .description("Provider health (0=UNHEALTHY, 1=DEGRADED, 2=HEALTHY)")
                .tag("provider", providerId)
                .register(registry);
    }

    public void incrementAlertCount(AlertType type, AlertSeverity severity) {
        String key = type.name() + ":" + severity.name();
        alertCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_alerts_raised_total")
                        .description("Total number of alerts raised")
                        .tag("type", type.name())
                        .tag("severity", severity.name())
                        .register(registry)
        ).increment();
    }

    public void incrementDecisionCount(String providerId, String strategy, boolean fallback) {
        String key = providerId + ":" + strategy + ":" + fallback;
        decisionCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_routing_decisions_total")
                        .description("Total number of routing decisions")
                        .tag("provider", providerId)
                        .tag("strategy", strategy)
                        .tag("fallback", Boolean.toString(fallback))
                        .register(registry)
        ).increment();
    }

    public void incrementDroppedDecisions() {
        droppedDecisions.increment();
    }

    public void incrementUnknownCompletions() {
        unknownCompletions.increment();
    }

    public void recordEstimateError(double absoluteErrorMs) {
        estimateError.record(absoluteErrorMs);
    }

    public void setActiveAlerts(int value) {
        activeAlerts.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
