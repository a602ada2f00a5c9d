package fr.lapetina.airouting.infrastructure.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MonitoringSchedulerTest {

    private static final MonitoringScheduler.Intervals FAST = new MonitoringScheduler.Intervals(
            Duration.ofMillis(10), Duration.ofMillis(10), Duration.ofMillis(10), Duration.ofMillis(10));

    /**
     * Counts every run; collection always fails.
     */
    private static final class CountingTasks implements MonitoringTasks {
        final AtomicInteger collections = new AtomicInteger();
        final AtomicInteger alertSweeps = new AtomicInteger();
        final AtomicInteger healthSweeps = new AtomicInteger();
        final AtomicInteger cleanups = new AtomicInteger();
        final CountDownLatch repeatedFailures = new CountDownLatch(3);
        final CountDownLatch alertRuns = new CountDownLatch(3);

        @Override
        public void collect() {
            collections.incrementAndGet();
            repeatedFailures.countDown();
            throw new IllegalStateException("collection failed");
        }

        @Override
        public void sweepAlerts() {
            alertSweeps.incrementAndGet();
            alertRuns.countDown();
        }

        @Override
        public void sweepHealth() {
            healthSweeps.incrementAndGet();
        }

        @Override
        public void cleanup() {
            cleanups.incrementAndGet();
        }
    }

    @Test
    @DisplayName("should report a failing task without propagating")
    void shouldGuardManualRuns() {
        CountingTasks tasks = new CountingTasks();
        try (MonitoringScheduler scheduler = new MonitoringScheduler(tasks, MonitoringScheduler.Intervals.defaults())) {
            assertThat(scheduler.runCollectionNow()).isFalse();
            assertThat(scheduler.runAlertSweepNow()).isTrue();
            assertThat(scheduler.runHealthSweepNow()).isTrue();
            assertThat(scheduler.runCleanupNow()).isTrue();

            assertThat(tasks.collections).hasValue(1);
            assertThat(tasks.cleanups).hasValue(1);
            assertThat(scheduler.isRunning()).isFalse();
        }
    }

    @Test
    @DisplayName("should keep running every task after one of them fails")
    void shouldSurviveFailingTask() throws InterruptedException {
        CountingTasks tasks = new CountingTasks();
        try (MonitoringScheduler scheduler = new MonitoringScheduler(tasks, FAST)) {
            scheduler.start();
            assertThat(scheduler.isRunning()).isTrue();

            assertThat(tasks.repeatedFailures.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(tasks.alertRuns.await(5, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Test
    @DisplayName("should stop scheduling after close")
    void shouldStopOnClose() throws InterruptedException {
        CountingTasks tasks = new CountingTasks();
        MonitoringScheduler scheduler = new MonitoringScheduler(tasks, FAST);
        scheduler.start();
        assertThat(tasks.alertRuns.await(5, TimeUnit.SECONDS)).isTrue();

        scheduler.close();
        int afterClose = tasks.alertSweeps.get();
        Thread.sleep(100);

        assertThat(scheduler.isRunning()).isFalse();
        assertThat(tasks.alertSweeps.get()).isEqualTo(afterClose);
    }

    @Test
    @DisplayName("should reject non-positive intervals")
    void shouldRejectInvalidIntervals() {
        assertThatThrownBy(() -> new MonitoringScheduler.Intervals(
                Duration.ZERO, Duration.ofSeconds(1), Duration.ofSeconds(1), Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("collection");
    }
}
