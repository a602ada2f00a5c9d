package fr.lapetina.airouting.routing;

/**
 * Thrown when a routing request cannot be answered at all.
 *
 * This is distinct from a fallback decision: it only occurs when there is nothing
 * to route to, never because providers are slow or failing.
 */
public final class NoProvidersAvailableException extends RuntimeException {

    private final Reason reason;

    public NoProvidersAvailableException(Reason reason) {
        super("No providers available: " + reason.getMessage());
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        REGISTRY_EMPTY("No providers are registered"),
        ALL_DISABLED("Every registered provider is disabled");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }
}
