package fr.lapetina.airouting.domain.event;

import fr.lapetina.airouting.domain.model.RoutingDecision;

/**
 * Mutable ring buffer slot carrying one routing decision.
 *
 * Slots are pre-allocated and reused: {@link #initialize} on publish,
 * {@link #clear} once consumed.
 */
public final class DecisionEvent {

    private RoutingDecision decision;
    private long publishedNanos;

    public void initialize(RoutingDecision decision, long publishedNanos) {
        this.decision = decision;
        this.publishedNanos = publishedNanos;
    }

    public void clear() {
        this.decision = null;
        this.publishedNanos = 0L;
    }

    public RoutingDecision getDecision() {
        return decision;
    }

    public long getPublishedNanos() {
        return publishedNanos;
    }

    @Override
    public String toString() {
        return "DecisionEvent{" +
                "requestId=" + (decision != null ? decision.requestId() : null) +
                ", provider=" + (decision != null ? decision.selectedProvider() : null) +
                '}';
    }
}
