package fr.lapetina.airouting.routing;

import fr.lapetina.airouting.domain.model.HealthState;
import fr.lapetina.airouting.domain.model.Provider;
import fr.lapetina.airouting.domain.model.ProviderScore;
import fr.lapetina.airouting.domain.model.RoutingRequirement;
import fr.lapetina.airouting.domain.model.StatsSnapshot;

import java.util.Locale;

/**
 * Computes the composite routing score of one provider.
 *
 * <pre>
 * performance = 0.4 * latencyScore + 0.3 * successRate + 0.3 * quality
 * load        = clamp(1 - inFlight / assumedCapacity)
 * health      = 1.0 healthy, 0.5 degraded, 0.1 unhealthy
 * alignment   = 1.0, times 0.7 / 0.8 / 0.6 per unmet latency / quality / reliability limit
 * score       = 0.4 * performance + 0.2 * load + 0.2 * health + 0.2 * alignment
 * </pre>
 *
 * Preferred providers get the score multiplied by the preferred bonus, capped at 1.0.
 * Providers with no observations are scored from the configured priors.
 */
public final class ProviderScorer {

    private static final double LATENCY_PENALTY = 0.7;
    private static final double QUALITY_PENALTY = 0.8;
    private static final double RELIABILITY_PENALTY = 0.6;

    private final Settings settings;

    public ProviderScorer(Settings settings) {
        this.settings = settings;
    }

    public ProviderScore score(
            Provider provider,
            StatsSnapshot stats,
            HealthState health,
            int inFlight,
            RoutingRequirement requirement
    ) {
        boolean observed = stats != null && stats.hasData();
        double meanLatency = observed ? stats.averageDurationMs() : settings.priorLatencyMs();
        double successRate = observed ? stats.successRate() : settings.priorSuccessRate();
        double quality = stats != null ? stats.qualityScore() : settings.priorQuality();

        double maxAcceptable = requirement.maxResponseTimeMs() != null
                ? requirement.maxResponseTimeMs()
                : settings.defaultMaxLatencyMs();
        double latencyScore = clamp(1.0 - meanLatency / maxAcceptable);
        double performance = 0.4 * latencyScore + 0.3 * successRate + 0.3 * quality;

        double load = clamp(1.0 - (double) inFlight / settings.assumedCapacity());
        double healthScore = health.score();

        double alignment = 1.0;
        boolean meets = true;
        if (requirement.maxResponseTimeMs() != null && meanLatency > requirement.maxResponseTimeMs()) {
            alignment *= LATENCY_PENALTY;
            meets = false;
        }
        if (requirement.qualityThreshold() != null && quality < requirement.qualityThreshold()) {
            alignment *= QUALITY_PENALTY;
            meets = false;
        }
        if (requirement.reliabilityRequirement() != null && successRate < requirement.reliabilityRequirement()) {
            alignment *= RELIABILITY_PENALTY;
            meets = false;
        }

        double score = 0.4 * performance + 0.2 * load + 0.2 * healthScore + 0.2 * alignment;
        boolean preferred = requirement.isPreferred(provider.getId());
        if (preferred) {
            score *= settings.preferredBonus();
        }
        score = Math.min(1.0, score);

        String reason = String.format(Locale.ROOT,
                "Performance: %.1f%%, Load: %.1f%%, Health: %s, Alignment: %.1f%%",
                performance * 100, load * 100, health.name().toLowerCase(Locale.ROOT), alignment * 100);
        if (preferred) {
            reason += ", Preferred provider";
        }

        return new ProviderScore(
                provider.getId(),
                score,
                performance,
                load,
                healthScore,
                alignment,
                health,
                inFlight,
                provider.getWeight(),
                meanLatency,
                successRate,
                quality,
                meets,
                reason
        );
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    public Settings getSettings() {
        return settings;
    }

    /**
     * Scoring constants and priors.
     */
    public record Settings(
            double defaultMaxLatencyMs,
            int assumedCapacity,
            double preferredBonus,
            double priorLatencyMs,
            double priorSuccessRate,
            double priorQuality
    ) {
        public Settings {
            if (defaultMaxLatencyMs <= 0 || assumedCapacity <= 0) {
                throw new IllegalArgumentException("Latency bound and capacity must be > 0");
            }
        }

        public static Settings defaults() {
            return new Settings(5000, 20, 1.1, 1500, 0.98, 0.85);
        }
    }
}
