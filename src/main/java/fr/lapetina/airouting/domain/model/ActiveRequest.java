package fr.lapetina.airouting.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A request that has started but not yet completed.
 */
public record ActiveRequest(
        String requestId,
        String providerId,
        String model,
        String serviceId,
        long startNanos,
        Instant startedAt,
        long heapUsedAtStart
) {
    public ActiveRequest {
        Objects.requireNonNull(requestId, "Request ID is required");
        Objects.requireNonNull(providerId, "Provider ID is required");
    }
}
