package fr.lapetina.airouting.analytics;

/**
 * An operator action suggested by current provider statistics.
 */
public record Recommendation(
        String subjectId,
        Type type,
        Priority priority,
        String description,
        String action
) {
    public enum Type {
        CONFIGURATION,
        SCALING,
        OPTIMIZATION
    }

    public enum Priority {
        LOW,
        MEDIUM,
        HIGH
    }
}
