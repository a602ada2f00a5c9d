package fr.lapetina.airouting.domain.model;

import java.time.Instant;

/**
 * Outcome of one completed provider request, kept in the per-provider history ring.
 */
public record HistoryRecord(
        String requestId,
        String providerId,
        String model,
        String serviceId,
        double durationMs,
        boolean success,
        String errorType,
        Double quality,
        long heapDeltaBytes,
        Instant timestamp
) {
}
