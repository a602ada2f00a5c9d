package fr.lapetina.airouting.domain.model;

/**
 * Health state of a provider, driven by consecutive failures.
 *
 * HEALTHY: provider is answering normally
 * DEGRADED: recent run of failures, still routable at a reduced score
 * UNHEALTHY: long run of failures, routable only as a last resort
 */
public enum HealthState {
    HEALTHY(1.0),
    DEGRADED(0.5),
    UNHEALTHY(0.1);

    private final double score;

    HealthState(double score) {
        this.score = score;
    }

    /**
     * Contribution of this state to the composite routing score.
     */
    public double score() {
        return score;
    }
}
