package fr.lapetina.airouting.routing;

import fr.lapetina.airouting.domain.model.Provider;
import fr.lapetina.airouting.domain.model.RequestContext;
import fr.lapetina.airouting.domain.model.RoutingDecision;
import fr.lapetina.airouting.domain.model.RoutingRequirement;
import fr.lapetina.airouting.domain.model.SubjectKind;
import fr.lapetina.airouting.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.airouting.domain.strategy.PerformanceBasedStrategy;
import fr.lapetina.airouting.domain.strategy.RoundRobinStrategy;
import fr.lapetina.airouting.domain.strategy.TieBreaker;
import fr.lapetina.airouting.domain.strategy.WeightedStrategy;
import fr.lapetina.airouting.infrastructure.health.HealthTracker;
import fr.lapetina.airouting.infrastructure.health.ProviderRegistry;
import fr.lapetina.airouting.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.airouting.infrastructure.metrics.MetricsStore;
import fr.lapetina.airouting.infrastructure.time.ManualTimeSource;
import fr.lapetina.airouting.infrastructure.tracking.RequestTracker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RoutingDecisionEngineTest {

    private static final double EPS = 1e-9;

    private ManualTimeSource time;
    private ProviderRegistry providerRegistry;
    private MetricsStore metricsStore;
    private HealthTracker healthTracker;
    private RequestTracker requestTracker;
    private MetricsRegistry metricsRegistry;
    private List<RoutingDecision> recorded;

    @BeforeEach
    void setUp() {
        time = new ManualTimeSource();
        providerRegistry = new ProviderRegistry();
        metricsStore = new MetricsStore(MetricsStore.Settings.defaults(), new Random(42));
        healthTracker = new HealthTracker(time);
        metricsRegistry = new MetricsRegistry("test");
        requestTracker = new RequestTracker(metricsStore, healthTracker, providerRegistry, metricsRegistry,
                time, RequestTracker.Settings.defaults());
        recorded = new ArrayList<>();
    }

    @AfterEach
    void tearDown() {
        metricsRegistry.close();
    }

    private RoutingDecisionEngine engine(LoadBalancingStrategy strategy) {
        return RoutingDecisionEngine.builder()
                .providerRegistry(providerRegistry)
                .metricsStore(metricsStore)
                .healthTracker(healthTracker)
                .requestTracker(requestTracker)
                .strategy(strategy)
                .recorder(recorded::add)
                .metricsRegistry(metricsRegistry)
                .timeSource(time)
                .build();
    }

    private RoutingDecisionEngine performanceEngine(long seed) {
        return engine(new PerformanceBasedStrategy(new TieBreaker(new Random(seed), 1e-6)));
    }

    private RoutingDecisionEngine weightedEngine(long seed) {
        return engine(new WeightedStrategy(new TieBreaker(new Random(seed), 1e-6)));
    }

    private void recordProvider(String providerId, int total, int failures, double durationMs) {
        for (int i = 0; i < total; i++) {
            metricsStore.record(SubjectKind.PROVIDER, providerId, durationMs, i >= failures, time.now());
        }
    }

    private void registerProviders(String... ids) {
        for (String id : ids) {
            providerRegistry.register(Provider.builder().id(id).addModel(id + "-model").build());
        }
    }

    private void complete(String requestId, String providerId, long durationMs, boolean success) {
        requestTracker.trackRequestStart(requestId, providerId, null, null);
        time.advanceMillis(durationMs);
        requestTracker.trackRequestComplete(requestId, success, success ? null : "ERROR", null);
    }

    @Nested
    @DisplayName("Service tiers")
    class ServiceTierTests {

        @Test
        @DisplayName("should map complexity to the first tier it exceeds")
        void shouldSelectTier() {
            RoutingDecisionEngine engine = performanceEngine(42);

            assertThat(engine.selectService(0.9)).isEqualTo("enhanced-autonomous-activation");
            assertThat(engine.selectService(0.8)).isEqualTo("smart-context-manager");
            assertThat(engine.selectService(0.5)).isEqualTo("advanced-intent-detection");
            assertThat(engine.selectService(0.4)).isEqualTo("unified-message-analysis");
            assertThat(engine.selectService(0.0)).isEqualTo("unified-message-analysis");
        }
    }

    @Nested
    @DisplayName("Decisions")
    class DecisionTests {

        @Test
        @DisplayName("should estimate from priors when nothing is observed")
        void shouldEstimateFromPriors() {
            registerProviders("alpha");

            RoutingDecision decision = performanceEngine(42)
                    .selectProvider(RequestContext.of("req-1", 0.5), RoutingRequirement.none());

            assertThat(decision.requestId()).isEqualTo("req-1");
            assertThat(decision.selectedProvider()).isEqualTo("alpha");
            assertThat(decision.selectedModel()).isEqualTo("alpha-model");
            assertThat(decision.selectedService()).isEqualTo("advanced-intent-detection");
            assertThat(decision.responseTimeEstimateMs()).isCloseTo(2000.0, within(EPS));
            assertThat(decision.reliabilityEstimate()).isCloseTo(0.9604, within(EPS));
            assertThat(decision.qualityEstimate()).isCloseTo(0.765, within(EPS));
            assertThat(decision.score()).isCloseTo(0.9316, within(EPS));
            assertThat(decision.strategy()).isEqualTo("performance_based");
            assertThat(decision.fallback()).isFalse();
            assertThat(decision.timestamp()).isEqualTo(time.now());
        }

        @Test
        @DisplayName("should use observed service statistics in the estimates")
        void shouldUseServiceStatistics() {
            registerProviders("alpha");
            metricsStore.record(SubjectKind.SERVICE, "advanced-intent-detection", 300, true, time.now());

            RoutingDecision decision = performanceEngine(42)
                    .selectProvider(RequestContext.of("req-1", 0.5), RoutingRequirement.none());

            assertThat(decision.responseTimeEstimateMs()).isCloseTo(1800.0, within(EPS));
            assertThat(decision.reliabilityEstimate()).isCloseTo(0.98, within(EPS));
        }

        @Test
        @DisplayName("should prefer the provider with better observed performance")
        void shouldPreferBetterProvider() {
            registerProviders("alpha", "beta");
            complete("a1", "alpha", 200, true);
            complete("b1", "beta", 4000, false);

            RoutingDecision decision = performanceEngine(42)
                    .selectProvider(RequestContext.of("req-1", 0.5), RoutingRequirement.none());

            assertThat(decision.selectedProvider()).isEqualTo("alpha");
            assertThat(decision.alternatives()).extracting(RoutingDecision.Alternative::providerId)
                    .containsExactly("beta");
        }

        @Test
        @DisplayName("should report at most three alternatives, never the chosen one")
        void shouldLimitAlternatives() {
            registerProviders("a", "b", "c", "d", "e");

            RoutingDecision decision = performanceEngine(42)
                    .selectProvider(RequestContext.of("req-1", 0.5), RoutingRequirement.none());

            assertThat(decision.alternatives()).hasSize(3);
            assertThat(decision.alternatives()).extracting(RoutingDecision.Alternative::providerId)
                    .doesNotContain(decision.selectedProvider());
        }

        @Test
        @DisplayName("should flag a fallback when no provider meets the requirements")
        void shouldFlagFallback() {
            registerProviders("alpha", "beta");
            RoutingRequirement impossible = RoutingRequirement.builder().maxResponseTimeMs(100).build();

            RoutingDecision decision = performanceEngine(42)
                    .selectProvider(RequestContext.of("req-1", 0.5), impossible);

            assertThat(decision.fallback()).isTrue();
            assertThat(decision.loadBalancingReason()).endsWith("(fallback - requirements not fully met)");
        }

        @Test
        @DisplayName("should pick the provider within the latency limit over a slow and failing one")
        void shouldHonorLatencyRequirement() {
            registerProviders("A", "B");
            recordProvider("A", 100, 1, 1000);
            recordProvider("B", 10, 2, 3000);
            RoutingRequirement requirement = RoutingRequirement.builder().maxResponseTimeMs(2000).build();

            RoutingDecision decision = performanceEngine(42)
                    .selectProvider(RequestContext.of("req-1", 0.5), requirement);

            assertThat(decision.selectedProvider()).isEqualTo("A");
            assertThat(decision.fallback()).isFalse();
            assertThat(decision.alternatives()).extracting(RoutingDecision.Alternative::providerId)
                    .containsExactly("B");
        }

        @Test
        @DisplayName("should hand every decision to the recorder")
        void shouldRecordDecisions() {
            registerProviders("alpha");
            RoutingDecisionEngine engine = performanceEngine(42);

            engine.selectProvider(RequestContext.of("req-1", 0.1), null);
            engine.selectProvider(RequestContext.of("req-2", 0.9), null);

            assertThat(recorded).extracting(RoutingDecision::requestId).containsExactly("req-1", "req-2");
        }

        @Test
        @DisplayName("should fill the decision factors")
        void shouldComputeFactors() {
            registerProviders("alpha");
            complete("a1", "alpha", 1000, true);
            for (int i = 0; i < 5; i++) {
                requestTracker.trackRequestStart("open-" + i, "alpha", null, null);
            }

            RoutingDecision decision = performanceEngine(42)
                    .selectProvider(RequestContext.of("req-1", 0.5), null);

            assertThat(decision.factors().currentLoad()).isCloseTo(0.1, within(EPS));
            // 1.0 * 0.6 + (1 - 1000 / 5000) * 0.4
            assertThat(decision.factors().historicalPerformance()).isCloseTo(0.92, within(EPS));
            assertThat(decision.factors().requirementAlignment()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should report neutral history for an unobserved provider")
        void shouldReportNeutralHistory() {
            assertThat(performanceEngine(42).historicalPerformance("alpha")).isEqualTo(0.5);
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("should fail when no provider is registered")
        void shouldFailOnEmptyRegistry() {
            assertThatThrownBy(() -> performanceEngine(42).selectProvider(RequestContext.of("r", 0.5), null))
                    .isInstanceOf(NoProvidersAvailableException.class)
                    .extracting(e -> ((NoProvidersAvailableException) e).getReason())
                    .isEqualTo(NoProvidersAvailableException.Reason.REGISTRY_EMPTY);
        }

        @Test
        @DisplayName("should fail when every provider is disabled")
        void shouldFailWhenAllDisabled() {
            registerProviders("alpha");
            providerRegistry.setEnabled("alpha", false);

            assertThatThrownBy(() -> performanceEngine(42).selectProvider(RequestContext.of("r", 0.5), null))
                    .isInstanceOf(NoProvidersAvailableException.class)
                    .extracting(e -> ((NoProvidersAvailableException) e).getReason())
                    .isEqualTo(NoProvidersAvailableException.Reason.ALL_DISABLED);
        }

        @Test
        @DisplayName("should route around disabled providers")
        void shouldSkipDisabled() {
            registerProviders("alpha", "beta");
            providerRegistry.setEnabled("alpha", false);

            RoutingDecision decision = performanceEngine(42).selectProvider(RequestContext.of("r", 0.5), null);

            assertThat(decision.selectedProvider()).isEqualTo("beta");
        }
    }

    @Nested
    @DisplayName("Strategies")
    class StrategyTests {

        @Test
        @DisplayName("should break ties identically for the same seed")
        void shouldBeDeterministicPerSeed() {
            registerProviders("alpha", "beta", "gamma");
            RoutingDecisionEngine first = performanceEngine(7);
            RoutingDecisionEngine second = performanceEngine(7);

            List<String> a = new ArrayList<>();
            List<String> b = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                a.add(first.selectProvider(RequestContext.of("a" + i, 0.5), null).selectedProvider());
                b.add(second.selectProvider(RequestContext.of("b" + i, 0.5), null).selectedProvider());
            }

            assertThat(a).isEqualTo(b);
            assertThat(a).isSubsetOf("alpha", "beta", "gamma");
        }

        @Test
        @DisplayName("should break weighted ties identically for the same seed")
        void shouldBeDeterministicPerSeedWhenWeighted() {
            registerProviders("alpha", "beta", "gamma");
            RoutingDecisionEngine first = weightedEngine(7);
            RoutingDecisionEngine second = weightedEngine(7);

            List<String> a = new ArrayList<>();
            List<String> b = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                a.add(first.selectProvider(RequestContext.of("a" + i, 0.5), null).selectedProvider());
                b.add(second.selectProvider(RequestContext.of("b" + i, 0.5), null).selectedProvider());
            }

            assertThat(a).isEqualTo(b);
            assertThat(a).isSubsetOf("alpha", "beta", "gamma");
            assertThat(recorded).extracting(RoutingDecision::strategy).containsOnly("weighted");
        }

        @Test
        @DisplayName("should cycle providers with round robin")
        void shouldRoundRobin() {
            registerProviders("alpha", "beta", "gamma");
            RoutingDecisionEngine engine = engine(new RoundRobinStrategy());

            List<String> picks = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                picks.add(engine.selectProvider(RequestContext.of("r" + i, 0.5), null).selectedProvider());
            }

            assertThat(picks).containsExactly("alpha", "beta", "gamma", "alpha");
        }

        @Test
        @DisplayName("should switch strategy at runtime")
        void shouldSwitchStrategy() {
            registerProviders("alpha");
            RoutingDecisionEngine engine = performanceEngine(42);

            engine.setStrategy(new RoundRobinStrategy());

            assertThat(engine.getStrategy().getName()).isEqualTo("round_robin");
            assertThat(engine.selectProvider(RequestContext.of("r", 0.5), null).strategy()).isEqualTo("round_robin");
        }

        @Test
        @DisplayName("should expose the last ranking and previews")
        void shouldExposeRanking() {
            registerProviders("beta", "alpha");
            RoutingDecisionEngine engine = performanceEngine(42);

            engine.selectProvider(RequestContext.of("r", 0.5), null);

            assertThat(engine.getLastRanking()).hasSize(2);
            assertThat(engine.preview(null)).extracting(s -> s.providerId()).containsExactly("alpha", "beta");
        }
    }
}
