package fr.lapetina.airouting;

import fr.lapetina.airouting.analytics.Recommendation;
import fr.lapetina.airouting.analytics.RecommendationAdvisor;
import fr.lapetina.airouting.analytics.TrendAnalyzer;
import fr.lapetina.airouting.dashboard.Dashboard;
import fr.lapetina.airouting.dashboard.DashboardAssembler;
import fr.lapetina.airouting.dashboard.DashboardSummary;
import fr.lapetina.airouting.dashboard.PerformanceExport;
import fr.lapetina.airouting.dashboard.SnapshotExporter;
import fr.lapetina.airouting.domain.model.HistoryRecord;
import fr.lapetina.airouting.domain.model.OperationHandle;
import fr.lapetina.airouting.domain.model.OperationRecord;
import fr.lapetina.airouting.domain.model.Provider;
import fr.lapetina.airouting.domain.model.RequestContext;
import fr.lapetina.airouting.domain.model.RoutingDecision;
import fr.lapetina.airouting.domain.model.RoutingRequirement;
import fr.lapetina.airouting.domain.model.StatsSnapshot;
import fr.lapetina.airouting.domain.model.SubjectKind;
import fr.lapetina.airouting.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.airouting.domain.strategy.StrategyFactory;
import fr.lapetina.airouting.domain.strategy.TieBreaker;
import fr.lapetina.airouting.infrastructure.alert.AlertEngine;
import fr.lapetina.airouting.infrastructure.config.ConfigLoader;
import fr.lapetina.airouting.infrastructure.config.RoutingConfig;
import fr.lapetina.airouting.infrastructure.health.HealthTracker;
import fr.lapetina.airouting.infrastructure.health.ProviderRegistry;
import fr.lapetina.airouting.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.airouting.infrastructure.metrics.MetricsStore;
import fr.lapetina.airouting.infrastructure.scheduler.DefaultMonitoringTasks;
import fr.lapetina.airouting.infrastructure.scheduler.MonitoringScheduler;
import fr.lapetina.airouting.infrastructure.time.TimeSource;
import fr.lapetina.airouting.infrastructure.tracking.RequestTracker;
import fr.lapetina.airouting.journal.DecisionJournal;
import fr.lapetina.airouting.routing.ProviderScorer;
import fr.lapetina.airouting.routing.RoutingDecisionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Wires the router from configuration and exposes its operations.
 * This is the primary entry point for embedding the router.
 *
 * <p>Usage:
 * <pre>{@code
 * try (RoutingMonitor monitor = RoutingMonitor.create("config.yaml").start()) {
 *     RoutingDecision decision = monitor.selectProvider(RequestContext.of(null, 0.7), RoutingRequirement.none());
 *     monitor.trackRequestStart(decision.requestId(), decision.selectedProvider(),
 *             decision.selectedModel(), decision.selectedService());
 *     // call the provider...
 *     monitor.trackRequestComplete(decision.requestId(), true, null, 0.9);
 * }
 * }</pre>
 */
public class RoutingMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RoutingMonitor.class);

    private final ConfigLoader configLoader;
    private final RoutingConfig config;
    private final TimeSource timeSource;
    private final TieBreaker tieBreaker;
    private final MetricsRegistry metricsRegistry;
    private final ProviderRegistry providerRegistry;
    private final MetricsStore metricsStore;
    private final HealthTracker healthTracker;
    private final RequestTracker requestTracker;
    private final AlertEngine alertEngine;
    private final DecisionJournal journal;
    private final RoutingDecisionEngine routingEngine;
    private final TrendAnalyzer trendAnalyzer;
    private final RecommendationAdvisor recommendationAdvisor;
    private final DashboardAssembler dashboardAssembler;
    private final SnapshotExporter snapshotExporter;
    private final MonitoringScheduler scheduler;

    protected RoutingMonitor(String configPath, TimeSource timeSourceOverride, Random randomOverride) {
        log.info("Initializing RoutingMonitor from config: {}", configPath);

        // Load configuration
        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        this.timeSource = timeSourceOverride != null ? timeSourceOverride : TimeSource.system();
        Random random = randomOverride != null ? randomOverride : createRandom();
        this.tieBreaker = new TieBreaker(random, config.getLoadBalancing().getTieBreakEpsilon());

        // Initialize metrics
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());
        RoutingConfig.MonitoringConfig monitoring = config.getMonitoring();
        this.metricsStore = new MetricsStore(new MetricsStore.Settings(
                monitoring.getReservoirCapacity(),
                monitoring.getPercentileRecomputeInterval(),
                config.getAdaptiveRouting().getLearningRate(),
                config.getPriors().getProviderQuality()
        ), random);

        // Initialize providers and health
        this.providerRegistry = new ProviderRegistry();
        this.healthTracker = new HealthTracker(
                timeSource,
                config.getHealth().getDegradedThreshold(),
                config.getHealth().getUnhealthyThreshold(),
                Duration.ofMillis(config.getHealth().getStaleAfterMs())
        );
        loadProviders(config);

        this.requestTracker = new RequestTracker(metricsStore, healthTracker, providerRegistry, metricsRegistry,
                timeSource, new RequestTracker.Settings(
                        monitoring.isEnabled(),
                        monitoring.getMaxOperationHistory(),
                        config.getAdaptiveRouting().getHistoricalWindowSize(),
                        Duration.ofMillis(monitoring.getStaleRequestMaxAgeMs()),
                        Duration.ofMillis(monitoring.getHistoryRetentionMs())
                ));

        AlertEngine.Thresholds thresholds = alertThresholds(config);
        this.alertEngine = new AlertEngine(timeSource, metricsRegistry, thresholds);

        // Decision journal
        this.journal = DecisionJournal.builder()
                .ringBufferSize(config.getJournal().getRingBufferSize())
                .waitStrategy(config.getJournal().getWaitStrategy())
                .retainedDecisions(config.getJournal().getRetainedDecisions())
                .metricsRegistry(metricsRegistry)
                .build();

        // Create strategy
        LoadBalancingStrategy strategy = StrategyFactory.createOrDefault(
                config.getLoadBalancing().getAlgorithm(), tieBreaker);
        log.info("Using load balancing strategy: {}", strategy.getName());

        this.routingEngine = RoutingDecisionEngine.builder()
                .providerRegistry(providerRegistry)
                .metricsStore(metricsStore)
                .healthTracker(healthTracker)
                .requestTracker(requestTracker)
                .scorer(new ProviderScorer(scorerSettings(config)))
                .strategy(strategy)
                .recorder(journal)
                .metricsRegistry(metricsRegistry)
                .timeSource(timeSource)
                .settings(engineSettings(config))
                .build();

        // Analytics and views
        this.trendAnalyzer = new TrendAnalyzer(timeSource, config.getAdaptiveRouting().getAdaptationThreshold());
        this.recommendationAdvisor = new RecommendationAdvisor(
                thresholds.errorRateCritical(),
                thresholds.latencyCriticalMs(),
                config.getThresholds().getQuality().getMinimum()
        );
        this.dashboardAssembler = new DashboardAssembler(metricsStore, requestTracker, healthTracker, alertEngine,
                trendAnalyzer, routingEngine, timeSource, thresholds, config.getAlerts().getMaxActiveListed());
        this.snapshotExporter = new SnapshotExporter();

        this.scheduler = new MonitoringScheduler(
                new DefaultMonitoringTasks(metricsStore, requestTracker, healthTracker, alertEngine, trendAnalyzer,
                        Duration.ofMillis(monitoring.getAlertRetentionMs())),
                new MonitoringScheduler.Intervals(
                        Duration.ofMillis(monitoring.getCollectionIntervalMs()),
                        Duration.ofMillis(monitoring.getAlertCheckIntervalMs()),
                        Duration.ofMillis(config.getHealth().getCheckIntervalMs()),
                        Duration.ofMillis(monitoring.getCleanupIntervalMs())
                ));

        // Register config change listener
        configLoader.addListener(this::onConfigChanged);

        log.info("RoutingMonitor initialized with {} providers", providerRegistry.size());
    }

    /**
     * Creates a monitor from the specified configuration file.
     */
    public static RoutingMonitor create(String configPath) {
        return new RoutingMonitor(configPath, null, null);
    }

    /**
     * Creates a monitor from the default configuration (config.yaml).
     */
    public static RoutingMonitor create() {
        return create("config.yaml");
    }

    /**
     * Starts the decision journal, the monitoring scheduler and the config watcher.
     */
    public RoutingMonitor start() {
        journal.start();
        scheduler.start();
        configLoader.startWatching();
        log.info("RoutingMonitor started");
        return this;
    }

    // ==================== OPERATIONS ====================

    public OperationHandle startOperation(String serviceId, String operationName) {
        return requestTracker.startOperation(serviceId, operationName);
    }

    public Optional<OperationRecord> endOperation(
            OperationHandle handle,
            boolean success,
            String errorMessage,
            Map<String, Object> metadata
    ) {
        return requestTracker.endOperation(handle, success, errorMessage, metadata);
    }

    public Optional<OperationRecord> endOperation(OperationHandle handle, boolean success) {
        return endOperation(handle, success, null, Map.of());
    }

    // ==================== ROUTING ====================

    /**
     * @throws fr.lapetina.airouting.routing.NoProvidersAvailableException if nothing can be routed to
     */
    public RoutingDecision selectProvider(RequestContext context, RoutingRequirement requirement) {
        return routingEngine.selectProvider(context, requirement);
    }

    public boolean trackRequestStart(String requestId, String providerId, String model, String serviceId) {
        return requestTracker.trackRequestStart(requestId, providerId, model, serviceId);
    }

    /**
     * Completes a provider request. When the request was routed by this monitor, the
     * observed duration is compared with the decision's estimate.
     */
    public Optional<HistoryRecord> trackRequestComplete(
            String requestId,
            boolean success,
            String errorType,
            Double quality
    ) {
        Optional<HistoryRecord> record = requestTracker.trackRequestComplete(requestId, success, errorType, quality);
        record.ifPresent(this::correlate);
        return record;
    }

    private void correlate(HistoryRecord record) {
        journal.take(record.requestId()).ifPresent(decision -> {
            double error = Math.abs(decision.responseTimeEstimateMs() - record.durationMs());
            metricsRegistry.recordEstimateError(error);
            log.debug("Estimate compared: requestId={}, estimatedMs={}, observedMs={}",
                    record.requestId(), decision.responseTimeEstimateMs(), record.durationMs());
        });
    }

    /**
     * Switches the load balancing strategy by name.
     *
     * @return false if the name is not registered
     */
    public boolean setStrategy(String name) {
        Optional<LoadBalancingStrategy> strategy = StrategyFactory.create(name, tieBreaker);
        if (strategy.isEmpty()) {
            log.warn("Unknown load balancing strategy requested: {}", name);
            return false;
        }
        routingEngine.setStrategy(strategy.get());
        return true;
    }

    public String getStrategyName() {
        return routingEngine.getStrategy().getName();
    }

    // ==================== QUERIES ====================

    public Optional<StatsSnapshot> getServiceStats(String serviceId) {
        return metricsStore.snapshot(SubjectKind.SERVICE, serviceId);
    }

    public List<StatsSnapshot> getServiceStats() {
        return metricsStore.snapshots(SubjectKind.SERVICE);
    }

    public Optional<StatsSnapshot> getProviderStats(String providerId) {
        return metricsStore.snapshot(SubjectKind.PROVIDER, providerId);
    }

    public List<StatsSnapshot> getProviderStats() {
        return metricsStore.snapshots(SubjectKind.PROVIDER);
    }

    public Dashboard getDashboard() {
        return dashboardAssembler.dashboard();
    }

    public DashboardSummary getSummary() {
        return dashboardAssembler.summary();
    }

    /**
     * Retained operations in a time range, oldest first. Null bounds are open.
     */
    public List<OperationRecord> getMetricsForTimeRange(Instant start, Instant end) {
        return requestTracker.getOperations(null, start, end, Integer.MAX_VALUE);
    }

    public List<OperationRecord> getHistory(String subjectId, int limit) {
        return requestTracker.getOperations(subjectId, null, null, limit);
    }

    public List<Recommendation> getRecommendations() {
        return recommendationAdvisor.recommend(metricsStore.snapshots(SubjectKind.PROVIDER));
    }

    public boolean resolveAlert(String alertId) {
        return alertEngine.resolveAlert(alertId);
    }

    public PerformanceExport exportSnapshot() {
        return dashboardAssembler.export();
    }

    public void writeSnapshot(OutputStream out) throws IOException {
        snapshotExporter.write(exportSnapshot(), out);
    }

    public String scrapeMetrics() {
        return metricsRegistry.scrape();
    }

    // ==================== ADMINISTRATION ====================

    public void setMonitoringEnabled(boolean enabled) {
        requestTracker.setEnabled(enabled);
    }

    public boolean isMonitoringEnabled() {
        return requestTracker.isEnabled();
    }

    /**
     * Reloads configuration from disk. Providers and strategy follow the new file.
     */
    public RoutingConfig reloadConfig() {
        return configLoader.reload();
    }

    public RoutingConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    public ProviderRegistry getProviderRegistry() {
        return providerRegistry;
    }

    public HealthTracker getHealthTracker() {
        return healthTracker;
    }

    public RequestTracker getRequestTracker() {
        return requestTracker;
    }

    public AlertEngine getAlertEngine() {
        return alertEngine;
    }

    public RoutingDecisionEngine getRoutingEngine() {
        return routingEngine;
    }

    public DecisionJournal getDecisionJournal() {
        return journal;
    }

    public MonitoringScheduler getScheduler() {
        return scheduler;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    // ==================== WIRING ====================

    private Random createRandom() {
        Long seed = config.getLoadBalancing().getRandomSeed();
        if (seed != null) {
            log.info("Using seeded random generator: seed={}", seed);
            return new Random(seed);
        }
        return new Random();
    }

    private void loadProviders(RoutingConfig source) {
        List<Provider> providers = source.getProviders().stream()
                .map(pc -> Provider.builder()
                        .id(pc.getId())
                        .models(pc.getModels() != null ? pc.getModels() : List.of())
                        .weight(source.getLoadBalancing().weightFor(pc.getId(), pc.getWeight()))
                        .enabled(pc.isEnabled())
                        .build())
                .toList();
        providerRegistry.replaceAll(providers);
        for (Provider provider : providers) {
            healthTracker.register(provider.getId());
            log.debug("Registered provider: {}", provider);
        }
    }

    private static AlertEngine.Thresholds alertThresholds(RoutingConfig config) {
        RoutingConfig.ThresholdsConfig t = config.getThresholds();
        return new AlertEngine.Thresholds(
                t.getResponseTime().getWarning(),
                t.getResponseTime().getCritical(),
                t.getErrorRate().getWarning(),
                t.getErrorRate().getCritical(),
                Duration.ofMillis(config.getMonitoring().getInactivityWindowMs()),
                Duration.ofMillis(config.getAlerts().getCooldownMs())
        );
    }

    private static ProviderScorer.Settings scorerSettings(RoutingConfig config) {
        RoutingConfig.LoadBalancingConfig lb = config.getLoadBalancing();
        RoutingConfig.PriorsConfig priors = config.getPriors();
        return new ProviderScorer.Settings(
                lb.getDefaultMaxLatencyMs(),
                lb.getAssumedCapacity(),
                lb.getPreferredBonus(),
                priors.getProviderLatencyMs(),
                priors.getProviderSuccessRate(),
                priors.getProviderQuality()
        );
    }

    private static RoutingDecisionEngine.Settings engineSettings(RoutingConfig config) {
        List<RoutingDecisionEngine.ServiceTier> tiers = config.getServices().stream()
                .map(s -> new RoutingDecisionEngine.ServiceTier(s.getId(), s.getMinComplexity()))
                .toList();
        return new RoutingDecisionEngine.Settings(
                tiers,
                config.getLoadBalancing().getSystemCapacity(),
                config.getLoadBalancing().getDefaultMaxLatencyMs(),
                config.getPriors().getServiceLatencyMs(),
                config.getPriors().getServiceSuccessRate()
        );
    }

    private void onConfigChanged(RoutingConfig oldConfig, RoutingConfig newConfig) {
        log.info("Configuration changed, applying updates...");

        loadProviders(newConfig);

        // Update strategy if changed
        String newAlgorithm = newConfig.getLoadBalancing().getAlgorithm();
        if (oldConfig == null || !newAlgorithm.equals(oldConfig.getLoadBalancing().getAlgorithm())) {
            routingEngine.setStrategy(StrategyFactory.create(newAlgorithm, tieBreaker)
                    .orElse(routingEngine.getStrategy()));
        }

        log.info("Configuration updates applied: providers={}, strategy={}",
                providerRegistry.size(), routingEngine.getStrategy().getName());
    }

    @Override
    public void close() {
        log.info("Shutting down RoutingMonitor...");

        try {
            scheduler.close();
        } catch (Exception e) {
            log.warn("Error closing monitoring scheduler", e);
        }

        try {
            journal.close();
        } catch (Exception e) {
            log.warn("Error closing decision journal", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        log.info("RoutingMonitor shut down");
    }
}
