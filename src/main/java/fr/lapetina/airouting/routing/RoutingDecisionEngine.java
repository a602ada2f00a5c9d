package fr.lapetina.airouting.routing;

import fr.lapetina.airouting.domain.model.HistoryRecord;
import fr.lapetina.airouting.domain.model.Provider;
import fr.lapetina.airouting.domain.model.ProviderScore;
import fr.lapetina.airouting.domain.model.RequestContext;
import fr.lapetina.airouting.domain.model.RoutingDecision;
import fr.lapetina.airouting.domain.model.RoutingRequirement;
import fr.lapetina.airouting.domain.model.StatsSnapshot;
import fr.lapetina.airouting.domain.model.SubjectKind;
import fr.lapetina.airouting.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.airouting.infrastructure.health.HealthTracker;
import fr.lapetina.airouting.infrastructure.health.ProviderRegistry;
import fr.lapetina.airouting.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.airouting.infrastructure.metrics.MetricsStore;
import fr.lapetina.airouting.infrastructure.tracking.RequestTracker;
import fr.lapetina.airouting.infrastructure.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Chooses a provider, model and service path for each request.
 *
 * <p>Runs synchronously on the caller's thread and only reads: statistics from
 * {@link MetricsStore}, health from {@link HealthTracker}, in-flight counts and history
 * from {@link RequestTracker}. The one exception it throws is
 * {@link NoProvidersAvailableException}, when there is nothing to route to; a request
 * that no provider can fully satisfy still gets a decision, flagged as fallback.
 */
public final class RoutingDecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(RoutingDecisionEngine.class);

    private static final int MAX_ALTERNATIVES = 3;
    private static final int HISTORY_WINDOW = 100;

    private final ProviderRegistry providerRegistry;
    private final MetricsStore metricsStore;
    private final HealthTracker healthTracker;
    private final RequestTracker requestTracker;
    private final ProviderScorer scorer;
    private final AtomicReference<LoadBalancingStrategy> strategyRef;
    private final DecisionRecorder recorder;
    private final MetricsRegistry metricsRegistry;
    private final TimeSource timeSource;
    private final Settings settings;

    private volatile List<ProviderScore> lastRanking = List.of();

    private RoutingDecisionEngine(Builder builder) {
        this.providerRegistry = builder.providerRegistry;
        this.metricsStore = builder.metricsStore;
        this.healthTracker = builder.healthTracker;
        this.requestTracker = builder.requestTracker;
        this.scorer = builder.scorer;
        this.strategyRef = new AtomicReference<>(builder.strategy);
        this.recorder = builder.recorder;
        this.metricsRegistry = builder.metricsRegistry;
        this.timeSource = builder.timeSource;
        this.settings = builder.settings;
    }

    /**
     * Routes one request.
     *
     * @throws NoProvidersAvailableException if no provider is registered or all are disabled
     */
    public RoutingDecision selectProvider(RequestContext context, RoutingRequirement requirement) {
        RoutingRequirement effective = requirement != null ? requirement : RoutingRequirement.none();

        List<Provider> providers = providerRegistry.getEnabled();
        if (providers.isEmpty()) {
            NoProvidersAvailableException.Reason reason = providerRegistry.isEmpty()
                    ? NoProvidersAvailableException.Reason.REGISTRY_EMPTY
                    : NoProvidersAvailableException.Reason.ALL_DISABLED;
            log.error("Routing failed: requestId={}, reason={}", context.requestId(), reason);
            throw new NoProvidersAvailableException(reason);
        }

        List<ProviderScore> ranked = rank(providers, effective);
        lastRanking = ranked;

        LoadBalancingStrategy strategy = strategyRef.get();
        LoadBalancingStrategy.Selection selection = strategy.select(ranked);
        ProviderScore chosen = selection.chosen();

        Provider provider = providers.stream()
                .filter(p -> p.getId().equals(chosen.providerId()))
                .findFirst()
                .orElseThrow();
        String service = selectService(context.complexity());

        StatsSnapshot serviceStats = metricsStore.snapshot(SubjectKind.SERVICE, service).orElse(null);
        boolean serviceObserved = serviceStats != null && serviceStats.hasData();
        double serviceLatency = serviceObserved ? serviceStats.averageDurationMs() : settings.priorServiceLatencyMs();
        double serviceSuccess = serviceObserved ? serviceStats.successRate() : settings.priorServiceSuccessRate();

        RoutingDecision decision = new RoutingDecision(
                context.requestId(),
                chosen.providerId(),
                provider.getDefaultModel(),
                service,
                chosen.score(),
                chosen.meanLatencyMs() + serviceLatency,
                chosen.successRate() * serviceSuccess,
                chosen.qualityScore() * 0.9,
                alternatives(ranked, chosen),
                strategy.getName(),
                selection.reason(),
                selection.loadImpact(),
                selection.fallback(),
                factors(chosen),
                timeSource.now()
        );

        recorder.record(decision);
        metricsRegistry.incrementDecisionCount(decision.selectedProvider(), decision.strategy(), decision.fallback());

        if (decision.fallback()) {
            log.warn("Fallback routing: requestId={}, provider={}, score={}",
                    decision.requestId(), decision.selectedProvider(), decision.score());
        } else {
            log.debug("Routing decision: requestId={}, provider={}, service={}, strategy={}, score={}",
                    decision.requestId(), decision.selectedProvider(), decision.selectedService(),
                    decision.strategy(), decision.score());
        }
        return decision;
    }

    /**
     * Scores every given provider, best first, ties ordered by id.
     */
    List<ProviderScore> rank(List<Provider> providers, RoutingRequirement requirement) {
        List<ProviderScore> scores = new ArrayList<>(providers.size());
        for (Provider provider : providers) {
            StatsSnapshot stats = metricsStore.snapshot(SubjectKind.PROVIDER, provider.getId()).orElse(null);
            scores.add(scorer.score(
                    provider,
                    stats,
                    healthTracker.getState(provider.getId()),
                    requestTracker.getInFlight(provider.getId()),
                    requirement
            ));
        }
        scores.sort(Comparator.comparingDouble(ProviderScore::score).reversed()
                .thenComparing(ProviderScore::providerId));
        return scores;
    }

    private List<RoutingDecision.Alternative> alternatives(List<ProviderScore> ranked, ProviderScore chosen) {
        return ranked.stream()
                .filter(s -> !s.providerId().equals(chosen.providerId()))
                .limit(MAX_ALTERNATIVES)
                .map(s -> new RoutingDecision.Alternative(s.providerId(), s.score(), s.reason()))
                .toList();
    }

    private RoutingDecision.Factors factors(ProviderScore chosen) {
        double currentLoad = Math.min(1.0, (double) requestTracker.getTotalInFlight() / settings.systemCapacity());
        double latencyScore = ProviderScorer.clamp(1.0 - chosen.meanLatencyMs() / settings.referenceLatencyMs());
        double realTime = 0.4 * latencyScore + 0.3 * chosen.successRate() + 0.3 * chosen.loadScore();
        return new RoutingDecision.Factors(
                currentLoad,
                historicalPerformance(chosen.providerId()),
                realTime,
                chosen.alignmentScore()
        );
    }

    /**
     * Success rate and latency over the provider's most recent history, 0.5 when there is none.
     */
    double historicalPerformance(String providerId) {
        List<HistoryRecord> history = requestTracker.getProviderHistory(providerId, HISTORY_WINDOW);
        if (history.isEmpty()) {
            return 0.5;
        }
        long successes = history.stream().filter(HistoryRecord::success).count();
        double avgDuration = history.stream().mapToDouble(HistoryRecord::durationMs).average().orElse(0.0);
        double successRate = (double) successes / history.size();
        return successRate * 0.6 + Math.max(0.0, 1.0 - avgDuration / settings.referenceLatencyMs()) * 0.4;
    }

    /**
     * Service path for a complexity: the first tier whose threshold the complexity exceeds,
     * else the lowest tier.
     */
    String selectService(double complexity) {
        List<ServiceTier> tiers = settings.serviceTiers();
        if (tiers.isEmpty()) {
            return "default";
        }
        for (ServiceTier tier : tiers) {
            if (complexity > tier.minComplexity()) {
                return tier.serviceId();
            }
        }
        return tiers.get(tiers.size() - 1).serviceId();
    }

    /**
     * Changes the load balancing strategy at runtime.
     */
    public void setStrategy(LoadBalancingStrategy strategy) {
        LoadBalancingStrategy old = strategyRef.getAndSet(Objects.requireNonNull(strategy));
        log.info("Load balancing strategy changed: {} -> {}", old.getName(), strategy.getName());
    }

    public LoadBalancingStrategy getStrategy() {
        return strategyRef.get();
    }

    /**
     * Ranking computed by the most recent routing request.
     */
    public List<ProviderScore> getLastRanking() {
        return lastRanking;
    }

    /**
     * Scores every enabled provider against a requirement without selecting one.
     */
    public List<ProviderScore> preview(RoutingRequirement requirement) {
        return rank(providerRegistry.getEnabled(),
                Optional.ofNullable(requirement).orElse(RoutingRequirement.none()));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Internal service path chosen above a complexity threshold.
     */
    public record ServiceTier(String serviceId, double minComplexity) {
    }

    /**
     * Decision-level constants.
     *
     * @param serviceTiers   tiers sorted by descending threshold
     * @param systemCapacity in-flight total at which current load reads 1.0
     * @param referenceLatencyMs latency at which the real-time and history latency scores reach 0
     */
    public record Settings(
            List<ServiceTier> serviceTiers,
            int systemCapacity,
            double referenceLatencyMs,
            double priorServiceLatencyMs,
            double priorServiceSuccessRate
    ) {
        public Settings {
            serviceTiers = serviceTiers.stream()
                    .sorted(Comparator.comparingDouble(ServiceTier::minComplexity).reversed())
                    .toList();
            if (systemCapacity <= 0) {
                throw new IllegalArgumentException("systemCapacity must be > 0");
            }
        }

        public static Settings defaults() {
            return new Settings(List.of(
                    new ServiceTier("enhanced-autonomous-activation", 0.8),
                    new ServiceTier("smart-context-manager", 0.6),
                    new ServiceTier("advanced-intent-detection", 0.4),
                    new ServiceTier("unified-message-analysis", 0.0)
            ), 50, 5000, 500, 0.98);
        }
    }

    /**
     * Builder for RoutingDecisionEngine.
     */
    public static final class Builder {
        private ProviderRegistry providerRegistry;
        private MetricsStore metricsStore;
        private HealthTracker healthTracker;
        private RequestTracker requestTracker;
        private ProviderScorer scorer = new ProviderScorer(ProviderScorer.Settings.defaults());
        private LoadBalancingStrategy strategy;
        private DecisionRecorder recorder = DecisionRecorder.NONE;
        private MetricsRegistry metricsRegistry;
        private TimeSource timeSource = TimeSource.system();
        private Settings settings = Settings.defaults();

        public Builder providerRegistry(ProviderRegistry registry) {
            this.providerRegistry = registry;
            return this;
        }

        public Builder metricsStore(MetricsStore store) {
            this.metricsStore = store;
            return this;
        }

        public Builder healthTracker(HealthTracker tracker) {
            this.healthTracker = tracker;
            return this;
        }

        public Builder requestTracker(RequestTracker tracker) {
            this.requestTracker = tracker;
            return this;
        }

        public Builder scorer(ProviderScorer scorer) {
            this.scorer = scorer;
            return this;
        }

        public Builder strategy(LoadBalancingStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder recorder(DecisionRecorder recorder) {
            this.recorder = recorder;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder timeSource(TimeSource timeSource) {
            this.timeSource = timeSource;
            return this;
        }

        public Builder settings(Settings settings) {
            this.settings = settings;
            return this;
        }

        public RoutingDecisionEngine build() {
            if (providerRegistry == null) {
                throw new IllegalStateException("ProviderRegistry is required");
            }
            if (metricsStore == null) {
                throw new IllegalStateException("MetricsStore is required");
            }
            if (healthTracker == null) {
                throw new IllegalStateException("HealthTracker is required");
            }
            if (requestTracker == null) {
                throw new IllegalStateException("RequestTracker is required");
            }
            if (strategy == null) {
                throw new IllegalStateException("Initial LoadBalancingStrategy is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new RoutingDecisionEngine(this);
        }
    }
}
