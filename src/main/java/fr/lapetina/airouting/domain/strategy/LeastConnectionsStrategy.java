package fr.lapetina.airouting.domain.strategy;

import fr.lapetina.airouting.domain.model.ProviderScore;

import java.util.List;

/**
 * Fewest in-flight requests among providers scoring within 10% of the best.
 */
public final class LeastConnectionsStrategy implements LoadBalancingStrategy {

    private static final double SCORE_BAND = 0.9;

    private final TieBreaker tieBreaker;

    public LeastConnectionsStrategy(TieBreaker tieBreaker) {
        this.tieBreaker = tieBreaker;
    }

    @Override
    public String getName() {
        return "least_connections";
    }

    @Override
    public Selection select(List<ProviderScore> ranked) {
        double bestScore = ranked.stream().mapToDouble(ProviderScore::score).max().orElse(0.0);
        List<ProviderScore> competitive = ranked.stream()
                .filter(s -> s.score() >= bestScore * SCORE_BAND)
                .toList();

        int fewest = competitive.stream().mapToInt(ProviderScore::inFlight).min().orElse(0);
        List<ProviderScore> leastLoaded = competitive.stream()
                .filter(s -> s.inFlight() == fewest)
                .toList();

        ProviderScore chosen = tieBreaker.pick(leastLoaded, ProviderScore::score);
        return new Selection(chosen,
                chosen.reason() + " (least connections: " + chosen.inFlight() + ")",
                chosen.inFlight() * 0.02,
                false);
    }
}
