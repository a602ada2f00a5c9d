package fr.lapetina.airouting.domain.strategy;

import fr.lapetina.airouting.domain.model.ProviderScore;

import java.util.List;

/**
 * Best composite score among providers that meet the caller's requirements.
 *
 * When none does, the best provider overall is returned and flagged as a fallback
 * instead of failing the request.
 */
public final class PerformanceBasedStrategy implements LoadBalancingStrategy {

    private final TieBreaker tieBreaker;

    public PerformanceBasedStrategy(TieBreaker tieBreaker) {
        this.tieBreaker = tieBreaker;
    }

    @Override
    public String getName() {
        return "performance_based";
    }

    @Override
    public Selection select(List<ProviderScore> ranked) {
        List<ProviderScore> eligible = ranked.stream()
                .filter(ProviderScore::meetsRequirements)
                .toList();

        if (eligible.isEmpty()) {
            ProviderScore best = tieBreaker.pick(ranked, ProviderScore::score);
            return new Selection(best, best.reason() + " (fallback - requirements not fully met)", 0.1, true);
        }

        ProviderScore best = tieBreaker.pick(eligible, ProviderScore::score);
        return new Selection(best,
                best.reason() + " (performance-based selection)",
                Math.min(0.8, best.inFlight() * 0.05),
                false);
    }
}
