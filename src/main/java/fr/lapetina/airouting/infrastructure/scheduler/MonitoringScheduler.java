package fr.lapetina.airouting.infrastructure.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the periodic monitoring tasks on one daemon thread.
 *
 * <p>Each task is scheduled with a fixed delay and guarded: an exception is logged and
 * the next run still happens. The {@code run*Now} methods execute a task on the calling
 * thread with the same guard, whether or not the scheduler is started.
 */
public final class MonitoringScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MonitoringScheduler.class);

    private final MonitoringTasks tasks;
    private final Intervals intervals;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public MonitoringScheduler(MonitoringTasks tasks, Intervals intervals) {
        this.tasks = tasks;
        this.intervals = intervals;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "monitoring-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            schedule("collection", intervals.collection(), this::runCollectionNow);
            schedule("alert-check", intervals.alertCheck(), this::runAlertSweepNow);
            schedule("health-check", intervals.healthCheck(), this::runHealthSweepNow);
            schedule("cleanup", intervals.cleanup(), this::runCleanupNow);
            log.info("Monitoring scheduler started: collection={}, alertCheck={}, healthCheck={}, cleanup={}",
                    intervals.collection(), intervals.alertCheck(), intervals.healthCheck(), intervals.cleanup());
        }
    }

    private void schedule(String name, Duration interval, Runnable task) {
        long millis = interval.toMillis();
        scheduler.scheduleWithFixedDelay(task, millis, millis, TimeUnit.MILLISECONDS);
        log.debug("Task scheduled: task={}, intervalMs={}", name, millis);
    }

    public boolean runCollectionNow() {
        return guarded("collection", tasks::collect);
    }

    public boolean runAlertSweepNow() {
        return guarded("alert-check", tasks::sweepAlerts);
    }

    public boolean runHealthSweepNow() {
        return guarded("health-check", tasks::sweepHealth);
    }

    public boolean runCleanupNow() {
        return guarded("cleanup", tasks::cleanup);
    }

    /**
     * @return false if the task threw
     */
    private boolean guarded(String name, Runnable task) {
        try {
            task.run();
            return true;
        } catch (RuntimeException e) {
            log.error("Monitoring task failed, will retry next interval: task={}", name, e);
            return false;
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Monitoring scheduler stopped");
        } else {
            scheduler.shutdownNow();
        }
    }

    /**
     * Delays between runs of each task.
     */
    public record Intervals(Duration collection, Duration alertCheck, Duration healthCheck, Duration cleanup) {
        public Intervals {
            requirePositive("collection", collection);
            requirePositive("alertCheck", alertCheck);
            requirePositive("healthCheck", healthCheck);
            requirePositive("cleanup", cleanup);
        }

        public static Intervals defaults() {
            return new Intervals(Duration.ofSeconds(10), Duration.ofSeconds(30),
                    Duration.ofSeconds(30), Duration.ofHours(1));
        }

        private static void requirePositive(String name, Duration value) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " interval must be > 0");
            }
        }
    }
}
