package fr.lapetina.airouting.domain.strategy;

import fr.lapetina.airouting.domain.model.ProviderScore;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simple round-robin over the ranked provider list.
 *
 * Successive calls with the same provider set visit every provider once before
 * repeating. Thread-safe via atomic counter.
 *
 * <p>The counter starts at 0, so the first call returns the top-ranked provider
 * rather than the second one.
 */
public final class RoundRobinStrategy implements LoadBalancingStrategy {

    private final AtomicInteger counter = new AtomicInteger(0);

    @Override
    public String getName() {
        return "round_robin";
    }

    @Override
    public Selection select(List<ProviderScore> ranked) {
        int index = Math.floorMod(counter.getAndIncrement(), ranked.size());
        ProviderScore chosen = ranked.get(index);
        return new Selection(chosen,
                chosen.reason() + " (round-robin: index " + index + ")",
                chosen.inFlight() * 0.04,
                false);
    }

    @Override
    public void reset() {
        counter.set(0);
    }
}
