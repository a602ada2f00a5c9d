package fr.lapetina.airouting.integration;

import fr.lapetina.airouting.analytics.Recommendation;
import fr.lapetina.airouting.dashboard.DashboardSummary;
import fr.lapetina.airouting.dashboard.SystemStatus;
import fr.lapetina.airouting.domain.model.Alert;
import fr.lapetina.airouting.domain.model.AlertType;
import fr.lapetina.airouting.domain.model.HistoryRecord;
import fr.lapetina.airouting.domain.model.OperationHandle;
import fr.lapetina.airouting.domain.model.OperationRecord;
import fr.lapetina.airouting.domain.model.RequestContext;
import fr.lapetina.airouting.domain.model.RoutingDecision;
import fr.lapetina.airouting.domain.model.RoutingRequirement;
import fr.lapetina.airouting.domain.model.StatsSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests of the monitor wired from test-config.yaml.
 */
class RoutingMonitorIntegrationTest {

    private TestRoutingMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = TestRoutingMonitor.create();
    }

    @AfterEach
    void tearDown() {
        if (monitor != null) {
            monitor.close();
        }
    }

    private void runRequest(String requestId, String provider, String service, long durationMs, boolean success) {
        monitor.trackRequestStart(requestId, provider, null, service);
        monitor.getTime().advanceMillis(durationMs);
        monitor.trackRequestComplete(requestId, success, success ? null : "TIMEOUT", null);
    }

    @Test
    @DisplayName("should register configured providers with their weights")
    void shouldLoadProviders() {
        assertThat(monitor.getProviderRegistry().getAll()).hasSize(3);
        assertThat(monitor.getProviderRegistry().get("alpha").orElseThrow().getWeight()).isEqualTo(2.0);
        assertThat(monitor.getProviderRegistry().get("gamma").orElseThrow().getWeight()).isEqualTo(0.5);
        assertThat(monitor.getStrategyName()).isEqualTo("performance_based");
    }

    @Test
    @DisplayName("should route, track and record a full request cycle")
    void shouldRunFullCycle() {
        RoutingDecision decision = monitor.selectProvider(
                RequestContext.of("req-1", 0.7), RoutingRequirement.none());

        assertThat(decision.selectedService()).isEqualTo("smart-context-manager");
        assertThat(decision.selectedModel()).isIn("alpha-large", "beta-1", "gamma-1");

        monitor.trackRequestStart(decision.requestId(), decision.selectedProvider(),
                decision.selectedModel(), decision.selectedService());
        assertThat(monitor.getRequestTracker().getInFlight(decision.selectedProvider())).isEqualTo(1);

        monitor.getTime().advanceMillis(1800);
        HistoryRecord record = monitor.trackRequestComplete(decision.requestId(), true, null, 0.9).orElseThrow();

        assertThat(record.durationMs()).isEqualTo(1800.0);
        StatsSnapshot provider = monitor.getProviderStats(decision.selectedProvider()).orElseThrow();
        assertThat(provider.totalOperations()).isEqualTo(1);
        assertThat(monitor.getServiceStats("smart-context-manager")).isPresent();
        assertThat(monitor.getRequestTracker().getTotalInFlight()).isZero();
    }

    @Test
    @DisplayName("should steer traffic away from a failing provider")
    void shouldAvoidFailingProvider() {
        for (int i = 0; i < 6; i++) {
            runRequest("fail-" + i, "alpha", null, 3000, false);
        }
        runRequest("ok-beta", "beta", null, 200, true);
        runRequest("ok-gamma", "gamma", null, 200, true);

        RoutingDecision decision = monitor.selectProvider(RequestContext.of("req", 0.5), null);

        assertThat(decision.selectedProvider()).isNotEqualTo("alpha");
        assertThat(decision.alternatives()).extracting(RoutingDecision.Alternative::providerId).contains("alpha");
    }

    @Test
    @DisplayName("should switch strategies by name")
    void shouldSwitchStrategy() {
        assertThat(monitor.setStrategy("round-robin")).isTrue();
        assertThat(monitor.getStrategyName()).isEqualTo("round_robin");

        assertThat(monitor.setStrategy("fastest")).isFalse();
        assertThat(monitor.getStrategyName()).isEqualTo("round_robin");
    }

    @Test
    @DisplayName("should time operations and stop when monitoring is disabled")
    void shouldTimeOperations() {
        OperationHandle handle = monitor.startOperation("advanced-intent-detection", "classify");
        monitor.getTime().advanceMillis(40);
        OperationRecord record = monitor.endOperation(handle, true).orElseThrow();
        assertThat(record.durationMs()).isEqualTo(40.0);

        monitor.setMonitoringEnabled(false);
        OperationHandle disabled = monitor.startOperation("advanced-intent-detection", "classify");

        assertThat(disabled.isDisabled()).isTrue();
        assertThat(monitor.endOperation(disabled, true)).isEmpty();
        assertThat(monitor.getServiceStats("advanced-intent-detection").orElseThrow().totalOperations())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("should raise and resolve alerts through the scheduler tasks")
    void shouldRaiseAndResolveAlerts() {
        runRequest("slow", "beta", null, 12_000, true);

        assertThat(monitor.getScheduler().runAlertSweepNow()).isTrue();

        List<Alert> active = monitor.getAlertEngine().getActiveAlerts(10);
        assertThat(active).singleElement().satisfies(alert -> {
            assertThat(alert.subjectId()).isEqualTo("beta");
            assertThat(alert.type()).isEqualTo(AlertType.LATENCY);
        });
        assertThat(monitor.getSummary().status()).isEqualTo(SystemStatus.CRITICAL);

        assertThat(monitor.resolveAlert(active.get(0).id())).isTrue();
        assertThat(monitor.getSummary().status()).isEqualTo(SystemStatus.HEALTHY);
    }

    @Test
    @DisplayName("should recommend configuration review for an erroring provider")
    void shouldRecommend() {
        for (int i = 0; i < 4; i++) {
            runRequest("ko-" + i, "gamma", null, 100, i == 0);
        }

        List<Recommendation> recommendations = monitor.getRecommendations();

        assertThat(recommendations).extracting(Recommendation::type).contains(Recommendation.Type.CONFIGURATION);
    }

    @Test
    @DisplayName("should answer history and time range queries")
    void shouldQueryHistory() {
        Instant start = monitor.getTime().now();
        runRequest("r1", "alpha", null, 100, true);
        monitor.getTime().advance(Duration.ofMinutes(1));
        Instant middle = monitor.getTime().now();
        runRequest("r2", "beta", null, 100, true);

        assertThat(monitor.getHistory("alpha", 10)).extracting(OperationRecord::subjectId).containsExactly("alpha");
        assertThat(monitor.getMetricsForTimeRange(start, middle)).hasSize(1);
        assertThat(monitor.getMetricsForTimeRange(start, monitor.getTime().now())).hasSize(2);
    }

    @Test
    @DisplayName("should expose a summary and metrics scrape")
    void shouldExposeViews() {
        runRequest("r1", "alpha", "unified-message-analysis", 100, true);

        DashboardSummary summary = monitor.getSummary();
        assertThat(summary.totalOperations()).isEqualTo(1);
        assertThat(monitor.getDashboard().providers()).hasSize(1);
        assertThat(monitor.scrapeMetrics()).contains("test_router");
        assertThat(monitor.exportSnapshot().summary().totalOperations()).isEqualTo(1);
    }

    @Test
    @DisplayName("should track unknown providers on first sight")
    void shouldAutoRegisterProviders() {
        runRequest("r1", "delta", null, 100, true);

        assertThat(monitor.getProviderRegistry().get("delta")).isPresent();
        RoutingDecision decision = monitor.selectProvider(RequestContext.of("req", 0.5), null);
        assertThat(decision.selectedProvider()).isIn("alpha", "beta", "gamma", "delta");
        assertThat(monitor.getProviderRegistry().size()).isEqualTo(4);
    }
}
