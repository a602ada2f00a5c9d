package fr.lapetina.airouting.routing;

import fr.lapetina.airouting.domain.model.RoutingDecision;

/**
 * Sink for routing decisions. Implementations must not block the caller.
 */
@FunctionalInterface
public interface DecisionRecorder {

    DecisionRecorder NONE = decision -> { };

    void record(RoutingDecision decision);
}
