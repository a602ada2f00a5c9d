package fr.lapetina.airouting.dashboard;

/**
 * Threshold classification of a subject's statistics.
 */
public enum HealthLevel {
    HEALTHY,
    WARNING,
    CRITICAL
}
