package fr.lapetina.airouting.domain.strategy;

import fr.lapetina.airouting.domain.model.ProviderScore;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.ToDoubleFunction;

/**
 * Picks the best candidate by a key, choosing pseudo-randomly among near-equal leaders.
 *
 * <p>Candidates whose key is within {@code epsilon} of the maximum are tied. With a
 * seeded {@link Random} the outcome for a given input sequence is reproducible.
 */
public final class TieBreaker {

    private final Random random;
    private final double epsilon;

    public TieBreaker(Random random, double epsilon) {
        if (epsilon < 0) {
            throw new IllegalArgumentException("Epsilon must be >= 0: " + epsilon);
        }
        this.random = random;
        this.epsilon = epsilon;
    }

    public ProviderScore pick(List<ProviderScore> candidates, ToDoubleFunction<ProviderScore> key) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("No candidates to pick from");
        }
        double best = Double.NEGATIVE_INFINITY;
        for (ProviderScore candidate : candidates) {
            best = Math.max(best, key.applyAsDouble(candidate));
        }
        List<ProviderScore> leaders = new ArrayList<>();
        for (ProviderScore candidate : candidates) {
            if (best - key.applyAsDouble(candidate) <= epsilon) {
                leaders.add(candidate);
            }
        }
        if (leaders.size() == 1) {
            return leaders.get(0);
        }
        return leaders.get(random.nextInt(leaders.size()));
    }
}
