package fr.lapetina.airouting.domain.model;

import java.time.Instant;
import java.util.Map;

/**
 * One measured operation in the global operation history.
 */
public record OperationRecord(
        String subjectId,
        String operationName,
        double durationMs,
        boolean success,
        String errorMessage,
        Map<String, Object> metadata,
        Instant timestamp
) {
    public OperationRecord {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }
}
