package fr.lapetina.airouting.domain.strategy;

import fr.lapetina.airouting.domain.model.ProviderScore;

import java.util.List;

/**
 * Policy that picks one provider from a scored, ranked list.
 *
 * Implementations must be thread-safe as they are called from every request thread
 * concurrently.
 */
public interface LoadBalancingStrategy {

    /**
     * Returns the name of this strategy for configuration and metrics.
     */
    String getName();

    /**
     * Selects a provider.
     *
     * @param ranked every enabled provider, sorted by descending score then id; never empty
     * @return the selection with its rationale
     */
    Selection select(List<ProviderScore> ranked);

    /**
     * Resets any internal state. Called when providers are reloaded.
     */
    default void reset() {
        // Default no-op
    }

    /**
     * Result of a policy.
     *
     * @param chosen     the selected provider
     * @param reason     human-readable rationale
     * @param loadImpact expected relative load added to the chosen provider
     * @param fallback   true when no provider met the caller's hard requirements
     */
    record Selection(ProviderScore chosen, String reason, double loadImpact, boolean fallback) {
    }
}
