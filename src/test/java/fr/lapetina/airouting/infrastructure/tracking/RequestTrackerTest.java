package fr.lapetina.airouting.infrastructure.tracking;

import fr.lapetina.airouting.domain.model.HealthState;
import fr.lapetina.airouting.domain.model.HistoryRecord;
import fr.lapetina.airouting.domain.model.OperationHandle;
import fr.lapetina.airouting.domain.model.OperationRecord;
import fr.lapetina.airouting.domain.model.StatsSnapshot;
import fr.lapetina.airouting.domain.model.SubjectKind;
import fr.lapetina.airouting.infrastructure.health.HealthTracker;
import fr.lapetina.airouting.infrastructure.health.ProviderRegistry;
import fr.lapetina.airouting.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.airouting.infrastructure.metrics.MetricsStore;
import fr.lapetina.airouting.infrastructure.time.ManualTimeSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RequestTrackerTest {

    private ManualTimeSource time;
    private MetricsStore store;
    private HealthTracker healthTracker;
    private ProviderRegistry providerRegistry;
    private MetricsRegistry metricsRegistry;
    private RequestTracker tracker;

    @BeforeEach
    void setUp() {
        time = new ManualTimeSource();
        store = new MetricsStore(MetricsStore.Settings.defaults(), new Random(42));
        healthTracker = new HealthTracker(time);
        providerRegistry = new ProviderRegistry();
        metricsRegistry = new MetricsRegistry("test");
        tracker = new RequestTracker(store, healthTracker, providerRegistry, metricsRegistry, time,
                new RequestTracker.Settings(true, 5, 3, Duration.ofMinutes(10), Duration.ofHours(1)));
    }

    @AfterEach
    void tearDown() {
        metricsRegistry.close();
    }

    @Nested
    @DisplayName("Operations")
    class OperationTests {

        @Test
        @DisplayName("should measure the time between start and end")
        void shouldMeasureDuration() {
            OperationHandle handle = tracker.startOperation("intent-detection", "classify");
            time.advanceMillis(250);

            Optional<OperationRecord> record = tracker.endOperation(handle, true, null, Map.of("k", "v"));

            assertThat(record).isPresent();
            assertThat(record.get().durationMs()).isEqualTo(250.0);
            assertThat(record.get().metadata()).containsEntry("k", "v");
            StatsSnapshot stats = store.snapshot(SubjectKind.SERVICE, "intent-detection").orElseThrow();
            assertThat(stats.totalOperations()).isEqualTo(1);
            assertThat(stats.averageDurationMs()).isEqualTo(250.0);
        }

        @Test
        @DisplayName("should record a zero duration as one millisecond")
        void shouldClampZeroDuration() {
            OperationHandle handle = tracker.startOperation("svc", "op");

            OperationRecord record = tracker.endOperation(handle, true, null, Map.of()).orElseThrow();

            assertThat(record.durationMs()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should ignore an unknown handle")
        void shouldIgnoreUnknownHandle() {
            Optional<OperationRecord> record = tracker.endOperation(
                    new OperationHandle("svc:op:missing", "svc", "op"), true, null, Map.of());

            assertThat(record).isEmpty();
            assertThat(store.snapshot(SubjectKind.SERVICE, "svc")).isEmpty();
        }

        @Test
        @DisplayName("should record a handle only once")
        void shouldRecordHandleOnce() {
            OperationHandle handle = tracker.startOperation("svc", "op");

            assertThat(tracker.endOperation(handle, true, null, Map.of())).isPresent();
            assertThat(tracker.endOperation(handle, true, null, Map.of())).isEmpty();
            assertThat(store.snapshot(SubjectKind.SERVICE, "svc").orElseThrow().totalOperations()).isEqualTo(1);
        }

        @Test
        @DisplayName("should hand out a disabled handle while monitoring is off")
        void shouldReturnDisabledHandle() {
            tracker.setEnabled(false);

            OperationHandle handle = tracker.startOperation("svc", "op");

            assertThat(handle.isDisabled()).isTrue();
            assertThat(tracker.endOperation(handle, true, null, Map.of())).isEmpty();
            assertThat(store.snapshot(SubjectKind.SERVICE, "svc")).isEmpty();
        }

        @Test
        @DisplayName("should bound the operation history")
        void shouldBoundHistory() {
            for (int i = 0; i < 8; i++) {
                OperationHandle handle = tracker.startOperation("svc", "op-" + i);
                tracker.endOperation(handle, true, null, Map.of());
            }

            List<OperationRecord> history = tracker.getAllOperations();
            assertThat(history).hasSize(5);
            assertThat(history.get(0).operationName()).isEqualTo("op-3");
            assertThat(history.get(4).operationName()).isEqualTo("op-7");
        }

        @Test
        @DisplayName("should count every concurrent operation exactly once")
        void shouldCountConcurrentOperations() throws Exception {
            int operations = 100;
            ExecutorService executor = Executors.newFixedThreadPool(10);
            CountDownLatch done = new CountDownLatch(operations);

            for (int i = 0; i < operations; i++) {
                executor.submit(() -> {
                    try {
                        OperationHandle handle = tracker.startOperation("svc", "concurrent");
                        tracker.endOperation(handle, true, null, Map.of());
                    } finally {
                        done.countDown();
                    }
                });
            }

            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();

            StatsSnapshot stats = store.snapshot(SubjectKind.SERVICE, "svc").orElseThrow();
            assertThat(stats.totalOperations()).isEqualTo(operations);
            assertThat(stats.successfulOperations()).isEqualTo(operations);
        }
    }

    @Nested
    @DisplayName("Provider requests")
    class ProviderRequestTests {

        @Test
        @DisplayName("should count in-flight requests per provider")
        void shouldCountInFlight() {
            tracker.trackRequestStart("r1", "alpha", "m", null);
            tracker.trackRequestStart("r2", "alpha", "m", null);
            tracker.trackRequestStart("r3", "beta", "m", null);

            assertThat(tracker.getInFlight("alpha")).isEqualTo(2);
            assertThat(tracker.getInFlight("beta")).isEqualTo(1);
            assertThat(tracker.getTotalInFlight()).isEqualTo(3);

            tracker.trackRequestComplete("r1", true, null, null);

            assertThat(tracker.getInFlight("alpha")).isEqualTo(1);
            assertThat(tracker.getTotalInFlight()).isEqualTo(2);
        }

        @Test
        @DisplayName("should reject a duplicate start")
        void shouldRejectDuplicateStart() {
            assertThat(tracker.trackRequestStart("r1", "alpha", "m", null)).isTrue();
            assertThat(tracker.trackRequestStart("r1", "alpha", "m", null)).isFalse();

            assertThat(tracker.getInFlight("alpha")).isEqualTo(1);
        }

        @Test
        @DisplayName("should ignore completion of an unknown request")
        void shouldIgnoreUnknownCompletion() {
            tracker.trackRequestStart("r1", "alpha", "m", null);

            assertThat(tracker.trackRequestComplete("nope", true, null, null)).isEmpty();
            assertThat(tracker.getInFlight("alpha")).isEqualTo(1);
            assertThat(store.snapshot(SubjectKind.PROVIDER, "alpha")).isEmpty();
        }

        @Test
        @DisplayName("should never drive in-flight below zero")
        void shouldNotGoNegative() {
            tracker.trackRequestStart("r1", "alpha", "m", null);
            tracker.trackRequestComplete("r1", true, null, null);
            tracker.trackRequestComplete("r1", true, null, null);

            assertThat(tracker.getInFlight("alpha")).isZero();
        }

        @Test
        @DisplayName("should record provider and service statistics on completion")
        void shouldRecordStatistics() {
            tracker.trackRequestStart("r1", "alpha", "alpha-large", "smart-context-manager");
            time.advanceMillis(1200);

            HistoryRecord record = tracker.trackRequestComplete("r1", true, null, 0.95).orElseThrow();

            assertThat(record.durationMs()).isEqualTo(1200.0);
            assertThat(record.model()).isEqualTo("alpha-large");
            assertThat(store.snapshot(SubjectKind.PROVIDER, "alpha").orElseThrow().totalOperations()).isEqualTo(1);
            assertThat(store.snapshot(SubjectKind.SERVICE, "smart-context-manager").orElseThrow().averageDurationMs())
                    .isEqualTo(1200.0);
            assertThat(store.snapshot(SubjectKind.PROVIDER, "alpha").orElseThrow().qualityScore())
                    .isGreaterThan(0.85);
        }

        @Test
        @DisplayName("should feed outcomes into provider health")
        void shouldFeedHealth() {
            for (int i = 0; i < 3; i++) {
                tracker.trackRequestStart("f" + i, "alpha", "m", null);
                tracker.trackRequestComplete("f" + i, false, "TIMEOUT", null);
            }
            assertThat(healthTracker.getState("alpha")).isEqualTo(HealthState.DEGRADED);

            tracker.trackRequestStart("ok", "alpha", "m", null);
            tracker.trackRequestComplete("ok", true, null, null);
            assertThat(healthTracker.getState("alpha")).isEqualTo(HealthState.HEALTHY);
        }

        @Test
        @DisplayName("should auto-register unknown providers")
        void shouldAutoRegister() {
            tracker.trackRequestStart("r1", "delta", "m", null);

            assertThat(providerRegistry.get("delta")).isPresent();
            assertThat(healthTracker.getStatus("delta")).isPresent();
        }

        @Test
        @DisplayName("should keep a bounded history per provider")
        void shouldBoundProviderHistory() {
            for (int i = 0; i < 5; i++) {
                tracker.trackRequestStart("r" + i, "alpha", "m", null);
                tracker.trackRequestComplete("r" + i, true, null, null);
            }

            List<HistoryRecord> history = tracker.getProviderHistory("alpha", 10);
            assertThat(history).extracting(HistoryRecord::requestId).containsExactly("r2", "r3", "r4");
        }
    }

    @Nested
    @DisplayName("Sweeps")
    class SweepTests {

        @Test
        @DisplayName("should drop abandoned requests without recording them")
        void shouldDropStaleRequests() {
            tracker.trackRequestStart("old", "alpha", "m", null);
            time.advance(Duration.ofMinutes(11));
            tracker.trackRequestStart("new", "alpha", "m", null);

            int dropped = tracker.sweepStaleRequests();

            assertThat(dropped).isEqualTo(1);
            assertThat(tracker.getInFlight("alpha")).isEqualTo(1);
            assertThat(tracker.getActiveRequest("old")).isEmpty();
            assertThat(store.snapshot(SubjectKind.PROVIDER, "alpha")).isEmpty();
        }

        @Test
        @DisplayName("should drop operations that were started but never ended")
        void shouldDropAbandonedOperations() {
            for (int i = 0; i < 1000; i++) {
                tracker.startOperation("svc", "abandoned");
            }
            time.advance(Duration.ofMinutes(11));
            OperationHandle live = tracker.startOperation("svc", "live");

            int dropped = tracker.sweepAbandonedOperations();

            assertThat(dropped).isEqualTo(1000);
            assertThat(tracker.getPendingOperationCount()).isEqualTo(1);
            assertThat(tracker.endOperation(live, true, null, Map.of())).isPresent();
            assertThat(tracker.getPendingOperationCount()).isZero();
            assertThat(store.snapshot(SubjectKind.SERVICE, "svc").orElseThrow().totalOperations()).isEqualTo(1);
        }

        @Test
        @DisplayName("should keep operations younger than the maximum age")
        void shouldKeepRecentOperations() {
            OperationHandle handle = tracker.startOperation("svc", "slow");
            time.advance(Duration.ofMinutes(9));

            assertThat(tracker.sweepAbandonedOperations()).isZero();
            assertThat(tracker.endOperation(handle, true, null, Map.of())).isPresent();
        }

        @Test
        @DisplayName("should drop history past retention")
        void shouldCleanupHistory() {
            tracker.endOperation(tracker.startOperation("svc", "old"), true, null, Map.of());
            time.advance(Duration.ofHours(2));
            tracker.endOperation(tracker.startOperation("svc", "recent"), true, null, Map.of());

            int removed = tracker.cleanupHistory();

            assertThat(removed).isEqualTo(1);
            assertThat(tracker.getAllOperations()).extracting(OperationRecord::operationName)
                    .containsExactly("recent");
        }
    }
}
