package fr.lapetina.airouting.domain.model;

/**
 * Opaque token returned when an operation starts, handed back when it ends.
 */
public record OperationHandle(String id, String subjectId, String operationName) {

    /**
     * Returned while monitoring is disabled. Ending it is a no-op.
     */
    public static final OperationHandle DISABLED = new OperationHandle("disabled", "", "");

    public boolean isDisabled() {
        return this == DISABLED || "disabled".equals(id);
    }
}
