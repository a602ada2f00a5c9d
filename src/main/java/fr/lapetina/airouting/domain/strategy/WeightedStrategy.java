package fr.lapetina.airouting.domain.strategy;

import fr.lapetina.airouting.domain.model.ProviderScore;

import java.util.List;

/**
 * Highest composite score multiplied by the provider's static weight.
 *
 * <p>Requirement filtering is not applied here: a provider that misses the caller's
 * hard requirements can still win on weight. The decision is never flagged as fallback.
 */
public final class WeightedStrategy implements LoadBalancingStrategy {

    private final TieBreaker tieBreaker;

    public WeightedStrategy(TieBreaker tieBreaker) {
        this.tieBreaker = tieBreaker;
    }

    @Override
    public String getName() {
        return "weighted";
    }

    @Override
    public Selection select(List<ProviderScore> ranked) {
        ProviderScore best = tieBreaker.pick(ranked, s -> s.score() * s.weight());
        return new Selection(best, best.reason() + " (weighted selection)", best.inFlight() * 0.03, false);
    }
}
