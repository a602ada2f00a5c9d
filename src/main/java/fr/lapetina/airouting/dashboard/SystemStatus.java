package fr.lapetina.airouting.dashboard;

/**
 * Overall status shown on the summary, worst first.
 */
public enum SystemStatus {
    CRITICAL,
    WARNING,
    DEGRADED,
    HEALTHY
}
