package fr.lapetina.airouting.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Point-in-time health of a single provider.
 */
public record HealthStatus(
        String providerId,
        HealthState state,
        int consecutiveFailures,
        Instant lastCheckAt,
        Instant lastActivityAt,
        boolean stale
) {
    public HealthStatus {
        Objects.requireNonNull(providerId, "Provider ID is required");
        Objects.requireNonNull(state, "State is required");
        if (consecutiveFailures < 0) {
            throw new IllegalArgumentException("consecutiveFailures must be >= 0");
        }
    }

    public static HealthStatus initial(String providerId, Instant now) {
        return new HealthStatus(providerId, HealthState.HEALTHY, 0, now, now, false);
    }

    public HealthStatus withState(HealthState newState, int failures, Instant now) {
        return new HealthStatus(providerId, newState, failures, now, now, false);
    }

    public HealthStatus withStale(boolean isStale, Instant now) {
        return new HealthStatus(providerId, state, consecutiveFailures, now, lastActivityAt, isStale);
    }
}
