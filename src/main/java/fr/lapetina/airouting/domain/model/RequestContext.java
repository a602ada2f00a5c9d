package fr.lapetina.airouting.domain.model;

import java.util.Map;
import java.util.UUID;

/**
 * What the router knows about an incoming request. Content is never inspected,
 * only the caller-estimated complexity in [0, 1].
 */
public record RequestContext(
        String requestId,
        double complexity,
        Map<String, String> attributes
) {
    public RequestContext {
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (complexity < 0.0 || complexity > 1.0 || Double.isNaN(complexity)) {
            throw new IllegalArgumentException("complexity must be in [0, 1]: " + complexity);
        }
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public static RequestContext of(String requestId, double complexity) {
        return new RequestContext(requestId, complexity, null);
    }
}
