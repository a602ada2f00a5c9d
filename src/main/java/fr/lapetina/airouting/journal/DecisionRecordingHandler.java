package fr.lapetina.airouting.journal;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.airouting.domain.event.DecisionEvent;
import fr.lapetina.airouting.domain.model.RoutingDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Consumer side of the journal: keeps the most recent decisions by request id.
 */
final class DecisionRecordingHandler implements EventHandler<DecisionEvent> {

    private static final Logger log = LoggerFactory.getLogger(DecisionRecordingHandler.class);

    private final Map<String, RoutingDecision> recent;
    private long recorded;

    DecisionRecordingHandler(int retained) {
        this.recent = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, RoutingDecision> eldest) {
                return size() > retained;
            }
        };
    }

    @Override
    public void onEvent(DecisionEvent event, long sequence, boolean endOfBatch) {
        RoutingDecision decision = event.getDecision();
        if (decision == null) {
            return;
        }
        try {
            MDC.put("requestId", decision.requestId());
            MDC.put("provider", decision.selectedProvider());
            synchronized (recent) {
                recent.put(decision.requestId(), decision);
                recorded++;
            }
            log.debug("Decision journaled: sequence={}, strategy={}, score={}, fallback={}",
                    sequence, decision.strategy(), decision.score(), decision.fallback());
        } finally {
            event.clear();
            MDC.remove("requestId");
            MDC.remove("provider");
        }
    }

    Optional<RoutingDecision> find(String requestId) {
        synchronized (recent) {
            return Optional.ofNullable(recent.get(requestId));
        }
    }

    Optional<RoutingDecision> take(String requestId) {
        synchronized (recent) {
            return Optional.ofNullable(recent.remove(requestId));
        }
    }

    long getRecorded() {
        synchronized (recent) {
            return recorded;
        }
    }
}
