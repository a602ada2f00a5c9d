package fr.lapetina.airouting.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * The outcome of a routing request.
 */
public record RoutingDecision(
        String requestId,
        String selectedProvider,
        String selectedModel,
        String selectedService,
        double score,
        double responseTimeEstimateMs,
        double reliabilityEstimate,
        double qualityEstimate,
        List<Alternative> alternatives,
        String strategy,
        String loadBalancingReason,
        double expectedLoadImpact,
        boolean fallback,
        Factors factors,
        Instant timestamp
) {
    public RoutingDecision {
        Objects.requireNonNull(selectedProvider, "Selected provider is required");
        alternatives = alternatives != null ? List.copyOf(alternatives) : List.of();
    }

    /**
     * A runner-up provider, reported for operator insight.
     */
    public record Alternative(String providerId, double score, String reason) {
    }

    /**
     * Breakdown of the signals behind the decision.
     */
    public record Factors(
            double currentLoad,
            double historicalPerformance,
            double realTimeScore,
            double requirementAlignment
    ) {
    }
}
