package fr.lapetina.airouting.infrastructure.scheduler;

/**
 * The periodic work run by {@link MonitoringScheduler}.
 */
public interface MonitoringTasks {

    /**
     * Samples system-wide statistics and refreshes trends.
     */
    void collect();

    /**
     * Evaluates alert rules over every provider and service.
     */
    void sweepAlerts();

    /**
     * Marks stale health entries and drops abandoned in-flight requests.
     */
    void sweepHealth();

    /**
     * Drops history and alerts past retention.
     */
    void cleanup();
}
