package fr.lapetina.airouting.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates {@link DecisionEvent} slots for the journal ring buffer.
 */
public final class DecisionEventFactory implements EventFactory<DecisionEvent> {

    @Override
    public DecisionEvent newInstance() {
        return new DecisionEvent();
    }
}
