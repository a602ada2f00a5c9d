package fr.lapetina.airouting.domain.model;

/**
 * Composite score of one provider for one routing request, with its parts and the
 * observed values it was computed from.
 */
public record ProviderScore(
        String providerId,
        double score,
        double performanceScore,
        double loadScore,
        double healthScore,
        double alignmentScore,
        HealthState healthState,
        int inFlight,
        double weight,
        double meanLatencyMs,
        double successRate,
        double qualityScore,
        boolean meetsRequirements,
        String reason
) {
}
