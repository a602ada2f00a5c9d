package fr.lapetina.airouting.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable copy of the running statistics of one provider or service.
 *
 * <p>{@code totalOperations == successfulOperations + failedOperations} always holds,
 * and {@code errorRate} is {@code failedOperations / totalOperations} (0 when empty).
 */
public record StatsSnapshot(
        String subjectId,
        SubjectKind kind,
        long totalOperations,
        long successfulOperations,
        long failedOperations,
        double totalDurationMs,
        double minDurationMs,
        double maxDurationMs,
        double p95DurationMs,
        double qualityScore,
        Instant lastOperationAt
) {
    public StatsSnapshot {
        Objects.requireNonNull(subjectId, "Subject ID is required");
        Objects.requireNonNull(kind, "Kind is required");
    }

    public double averageDurationMs() {
        return totalOperations == 0 ? 0.0 : totalDurationMs / totalOperations;
    }

    public double errorRate() {
        return totalOperations == 0 ? 0.0 : (double) failedOperations / totalOperations;
    }

    public double successRate() {
        return totalOperations == 0 ? 1.0 : (double) successfulOperations / totalOperations;
    }

    public boolean hasData() {
        return totalOperations > 0;
    }
}
