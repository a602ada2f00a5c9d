package fr.lapetina.airouting.infrastructure.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the router.
 * Designed to be populated from YAML.
 */
public class RoutingConfig {

    private ServerConfig server = new ServerConfig();
    private List<ProviderConfig> providers = new ArrayList<>();
    private List<ServiceTierConfig> services = defaultServiceTiers();
    private MonitoringConfig monitoring = new MonitoringConfig();
    private ThresholdsConfig thresholds = new ThresholdsConfig();
    private AlertsConfig alerts = new AlertsConfig();
    private HealthConfig health = new HealthConfig();
    private LoadBalancingConfig loadBalancing = new LoadBalancingConfig();
    private AdaptiveRoutingConfig adaptiveRouting = new AdaptiveRoutingConfig();
    private PriorsConfig priors = new PriorsConfig();
    private JournalConfig journal = new JournalConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public List<ProviderConfig> getProviders() { return providers; }
    public void setProviders(List<ProviderConfig> providers) { this.providers = providers; }

    public List<ServiceTierConfig> getServices() { return services; }
    public void setServices(List<ServiceTierConfig> services) { this.services = services; }

    public MonitoringConfig getMonitoring() { return monitoring; }
    public void setMonitoring(MonitoringConfig monitoring) { this.monitoring = monitoring; }

    public ThresholdsConfig getThresholds() { return thresholds; }
    public void setThresholds(ThresholdsConfig thresholds) { this.thresholds = thresholds; }

    public AlertsConfig getAlerts() { return alerts; }
    public void setAlerts(AlertsConfig alerts) { this.alerts = alerts; }

    public HealthConfig getHealth() { return health; }
    public void setHealth(HealthConfig health) { this.health = health; }

    public LoadBalancingConfig getLoadBalancing() { return loadBalancing; }
    public void setLoadBalancing(LoadBalancingConfig loadBalancing) { this.loadBalancing = loadBalancing; }

    public AdaptiveRoutingConfig getAdaptiveRouting() { return adaptiveRouting; }
    public void setAdaptiveRouting(AdaptiveRoutingConfig adaptiveRouting) { this.adaptiveRouting = adaptiveRouting; }

    public PriorsConfig getPriors() { return priors; }
    public void setPriors(PriorsConfig priors) { this.priors = priors; }

    public JournalConfig getJournal() { return journal; }
    public void setJournal(JournalConfig journal) { this.journal = journal; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    private static List<ServiceTierConfig> defaultServiceTiers() {
        List<ServiceTierConfig> tiers = new ArrayList<>();
        tiers.add(new ServiceTierConfig("enhanced-autonomous-activation", 0.8));
        tiers.add(new ServiceTierConfig("smart-context-manager", 0.6));
        tiers.add(new ServiceTierConfig("advanced-intent-detection", 0.4));
        tiers.add(new ServiceTierConfig("unified-message-analysis", 0.0));
        return tiers;
    }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private int backlog = 100;
        private int threads = 8;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    /**
     * A routable provider.
     */
    public static class ProviderConfig {
        private String id;
        private List<String> models = new ArrayList<>();
        private double weight = 1.0;
        private boolean enabled = true;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public List<String> getModels() { return models; }
        public void setModels(List<String> models) { this.models = models; }

        public double getWeight() { return weight; }
        public void setWeight(double weight) { this.weight = weight; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    /**
     * Internal service path chosen for requests at or above a complexity.
     */
    public static class ServiceTierConfig {
        private String id;
        private double minComplexity;

        public ServiceTierConfig() {
        }

        public ServiceTierConfig(String id, double minComplexity) {
            this.id = id;
            this.minComplexity = minComplexity;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public double getMinComplexity() { return minComplexity; }
        public void setMinComplexity(double minComplexity) { this.minComplexity = minComplexity; }
    }

    /**
     * Tracking, history and periodic task settings.
     */
    public static class MonitoringConfig {
        private boolean enabled = true;
        private long collectionIntervalMs = 10_000;
        private long alertCheckIntervalMs = 30_000;
        private long cleanupIntervalMs = 3_600_000;
        private long historyRetentionMs = 86_400_000;
        private long alertRetentionMs = 604_800_000;
        private long inactivityWindowMs = 300_000;
        private long staleRequestMaxAgeMs = 600_000;
        private int maxOperationHistory = 10_000;
        private int reservoirCapacity = 200;
        private int percentileRecomputeInterval = 100;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getCollectionIntervalMs() { return collectionIntervalMs; }
        public void setCollectionIntervalMs(long collectionIntervalMs) { this.collectionIntervalMs = collectionIntervalMs; }

        public long getAlertCheckIntervalMs() { return alertCheckIntervalMs; }
        public void setAlertCheckIntervalMs(long alertCheckIntervalMs) { this.alertCheckIntervalMs = alertCheckIntervalMs; }

        public long getCleanupIntervalMs() { return cleanupIntervalMs; }
        public void setCleanupIntervalMs(long cleanupIntervalMs) { this.cleanupIntervalMs = cleanupIntervalMs; }

        public long getHistoryRetentionMs() { return historyRetentionMs; }
        public void setHistoryRetentionMs(long historyRetentionMs) { this.historyRetentionMs = historyRetentionMs; }

        public long getAlertRetentionMs() { return alertRetentionMs; }
        public void setAlertRetentionMs(long alertRetentionMs) { this.alertRetentionMs = alertRetentionMs; }

        public long getInactivityWindowMs() { return inactivityWindowMs; }
        public void setInactivityWindowMs(long inactivityWindowMs) { this.inactivityWindowMs = inactivityWindowMs; }

        public long getStaleRequestMaxAgeMs() { return staleRequestMaxAgeMs; }
        public void setStaleRequestMaxAgeMs(long staleRequestMaxAgeMs) { this.staleRequestMaxAgeMs = staleRequestMaxAgeMs; }

        public int getMaxOperationHistory() { return maxOperationHistory; }
        public void setMaxOperationHistory(int maxOperationHistory) { this.maxOperationHistory = maxOperationHistory; }

        public int getReservoirCapacity() { return reservoirCapacity; }
        public void setReservoirCapacity(int reservoirCapacity) { this.reservoirCapacity = reservoirCapacity; }

        public int getPercentileRecomputeInterval() { return percentileRecomputeInterval; }
        public void setPercentileRecomputeInterval(int interval) { this.percentileRecomputeInterval = interval; }
    }

    /**
     * Warning and critical levels, shared by alerts, health classification and recommendations.
     */
    public static class ThresholdsConfig {
        private Level responseTime = new Level(5000, 10000);
        private Level errorRate = new Level(0.15, 0.30);
        private Target throughput = new Target(10, 100);
        private Target quality = new Target(0.7, 0.9);

        public Level getResponseTime() { return responseTime; }
        public void setResponseTime(Level responseTime) { this.responseTime = responseTime; }

        public Level getErrorRate() { return errorRate; }
        public void setErrorRate(Level errorRate) { this.errorRate = errorRate; }

        public Target getThroughput() { return throughput; }
        public void setThroughput(Target throughput) { this.throughput = throughput; }

        public Target getQuality() { return quality; }
        public void setQuality(Target quality) { this.quality = quality; }
    }

    public static class Level {
        private double warning;
        private double critical;

        public Level() {
        }

        public Level(double warning, double critical) {
            this.warning = warning;
            this.critical = critical;
        }

        public double getWarning() { return warning; }
        public void setWarning(double warning) { this.warning = warning; }

        public double getCritical() { return critical; }
        public void setCritical(double critical) { this.critical = critical; }
    }

    public static class Target {
        private double minimum;
        private double target;

        public Target() {
        }

        public Target(double minimum, double target) {
            this.minimum = minimum;
            this.target = target;
        }

        public double getMinimum() { return minimum; }
        public void setMinimum(double minimum) { this.minimum = minimum; }

        public double getTarget() { return target; }
        public void setTarget(double target) { this.target = target; }
    }

    /**
     * Alert lifecycle configuration.
     */
    public static class AlertsConfig {
        private long cooldownMs = 600_000;
        private int maxActiveListed = 50;

        public long getCooldownMs() { return cooldownMs; }
        public void setCooldownMs(long cooldownMs) { this.cooldownMs = cooldownMs; }

        public int getMaxActiveListed() { return maxActiveListed; }
        public void setMaxActiveListed(int maxActiveListed) { this.maxActiveListed = maxActiveListed; }
    }

    /**
     * Health state machine configuration.
     */
    public static class HealthConfig {
        private long checkIntervalMs = 30_000;
        private int degradedThreshold = 3;
        private int unhealthyThreshold = 6;
        private long staleAfterMs = 300_000;

        public long getCheckIntervalMs() { return checkIntervalMs; }
        public void setCheckIntervalMs(long checkIntervalMs) { this.checkIntervalMs = checkIntervalMs; }

        public int getDegradedThreshold() { return degradedThreshold; }
        public void setDegradedThreshold(int degradedThreshold) { this.degradedThreshold = degradedThreshold; }

        public int getUnhealthyThreshold() { return unhealthyThreshold; }
        public void setUnhealthyThreshold(int unhealthyThreshold) { this.unhealthyThreshold = unhealthyThreshold; }

        public long getStaleAfterMs() { return staleAfterMs; }
        public void setStaleAfterMs(long staleAfterMs) { this.staleAfterMs = staleAfterMs; }
    }

    /**
     * Scoring and policy configuration.
     */
    public static class LoadBalancingConfig {
        private String algorithm = "performance_based";
        private Map<String, Double> weights = new LinkedHashMap<>();
        private double failoverThreshold = 0.8;
        private double defaultMaxLatencyMs = 5000;
        private int assumedCapacity = 20;
        private int systemCapacity = 50;
        private double preferredBonus = 1.1;
        private double tieBreakEpsilon = 1e-6;
        private Long randomSeed;

        public String getAlgorithm() { return algorithm; }
        public void setAlgorithm(String algorithm) { this.algorithm = algorithm; }

        public Map<String, Double> getWeights() { return weights; }
        public void setWeights(Map<String, Double> weights) { this.weights = weights; }

        public double getFailoverThreshold() { return failoverThreshold; }
        public void setFailoverThreshold(double failoverThreshold) { this.failoverThreshold = failoverThreshold; }

        public double getDefaultMaxLatencyMs() { return defaultMaxLatencyMs; }
        public void setDefaultMaxLatencyMs(double defaultMaxLatencyMs) { this.defaultMaxLatencyMs = defaultMaxLatencyMs; }

        public int getAssumedCapacity() { return assumedCapacity; }
        public void setAssumedCapacity(int assumedCapacity) { this.assumedCapacity = assumedCapacity; }

        public int getSystemCapacity() { return systemCapacity; }
        public void setSystemCapacity(int systemCapacity) { this.systemCapacity = systemCapacity; }

        public double getPreferredBonus() { return preferredBonus; }
        public void setPreferredBonus(double preferredBonus) { this.preferredBonus = preferredBonus; }

        public double getTieBreakEpsilon() { return tieBreakEpsilon; }
        public void setTieBreakEpsilon(double tieBreakEpsilon) { this.tieBreakEpsilon = tieBreakEpsilon; }

        public Long getRandomSeed() { return randomSeed; }
        public void setRandomSeed(Long randomSeed) { this.randomSeed = randomSeed; }

        /**
         * Static weight for a provider. YAML integers are accepted as well as decimals.
         */
        public double weightFor(String providerId, double fallback) {
            if (weights == null) {
                return fallback;
            }
            Object value = ((Map<?, ?>) weights).get(providerId);
            return value instanceof Number n ? n.doubleValue() : fallback;
        }
    }

    /**
     * Learning parameters for quality tracking and trend detection.
     */
    public static class AdaptiveRoutingConfig {
        private boolean enabled = true;
        private double learningRate = 0.1;
        private double adaptationThreshold = 0.05;
        private int historicalWindowSize = 1000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public double getLearningRate() { return learningRate; }
        public void setLearningRate(double learningRate) { this.learningRate = learningRate; }

        public double getAdaptationThreshold() { return adaptationThreshold; }
        public void setAdaptationThreshold(double adaptationThreshold) { this.adaptationThreshold = adaptationThreshold; }

        public int getHistoricalWindowSize() { return historicalWindowSize; }
        public void setHistoricalWindowSize(int historicalWindowSize) { this.historicalWindowSize = historicalWindowSize; }
    }

    /**
     * Values assumed for a provider or service before any data has been observed.
     */
    public static class PriorsConfig {
        private double providerLatencyMs = 1500;
        private double providerSuccessRate = 0.98;
        private double providerQuality = 0.85;
        private double serviceLatencyMs = 500;
        private double serviceSuccessRate = 0.98;

        public double getProviderLatencyMs() { return providerLatencyMs; }
        public void setProviderLatencyMs(double providerLatencyMs) { this.providerLatencyMs = providerLatencyMs; }

        public double getProviderSuccessRate() { return providerSuccessRate; }
        public void setProviderSuccessRate(double providerSuccessRate) { this.providerSuccessRate = providerSuccessRate; }

        public double getProviderQuality() { return providerQuality; }
        public void setProviderQuality(double providerQuality) { this.providerQuality = providerQuality; }

        public double getServiceLatencyMs() { return serviceLatencyMs; }
        public void setServiceLatencyMs(double serviceLatencyMs) { this.serviceLatencyMs = serviceLatencyMs; }

        public double getServiceSuccessRate() { return serviceSuccessRate; }
        public void setServiceSuccessRate(double serviceSuccessRate) { this.serviceSuccessRate = serviceSuccessRate; }
    }

    /**
     * Decision journal ring buffer configuration.
     */
    public static class JournalConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int retainedDecisions = 1000;

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public int getRetainedDecisions() { return retainedDecisions; }
        public void setRetainedDecisions(int retainedDecisions) { this.retainedDecisions = retainedDecisions; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "ai_router";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
