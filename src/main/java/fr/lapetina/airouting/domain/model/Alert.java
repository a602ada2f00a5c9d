package fr.lapetina.airouting.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * An operator-visible alert raised for one subject.
 * Immutable: resolving produces a new instance.
 */
public record Alert(
        String id,
        String subjectId,
        SubjectKind subjectKind,
        AlertType type,
        AlertSeverity severity,
        String message,
        double threshold,
        double observedValue,
        Instant createdAt,
        Instant resolvedAt
) {
    public Alert {
        Objects.requireNonNull(id, "Alert ID is required");
        Objects.requireNonNull(subjectId, "Subject ID is required");
        Objects.requireNonNull(subjectKind, "Subject kind is required");
        Objects.requireNonNull(type, "Type is required");
        Objects.requireNonNull(severity, "Severity is required");
        Objects.requireNonNull(createdAt, "Creation time is required");
    }

    public boolean isResolved() {
        return resolvedAt != null;
    }

    public Alert resolve(Instant at) {
        return new Alert(id, subjectId, subjectKind, type, severity, message,
                threshold, observedValue, createdAt, at);
    }
}
