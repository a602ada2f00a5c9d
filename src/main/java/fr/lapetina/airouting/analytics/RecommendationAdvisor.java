package fr.lapetina.airouting.analytics;

import fr.lapetina.airouting.domain.model.StatsSnapshot;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Derives operator recommendations from provider statistics.
 */
public final class RecommendationAdvisor {

    private final double errorRateCritical;
    private final double latencyCriticalMs;
    private final double qualityMinimum;

    public RecommendationAdvisor(double errorRateCritical, double latencyCriticalMs, double qualityMinimum) {
        this.errorRateCritical = errorRateCritical;
        this.latencyCriticalMs = latencyCriticalMs;
        this.qualityMinimum = qualityMinimum;
    }

    /**
     * Recommendations for providers with data, highest priority first.
     */
    public List<Recommendation> recommend(List<StatsSnapshot> providers) {
        List<Recommendation> result = new ArrayList<>();
        for (StatsSnapshot stats : providers) {
            if (!stats.hasData()) {
                continue;
            }
            String id = stats.subjectId();
            if (stats.errorRate() > errorRateCritical) {
                result.add(new Recommendation(id, Recommendation.Type.CONFIGURATION, Recommendation.Priority.HIGH,
                        String.format(Locale.ROOT, "High error rate detected for %s: %.1f%%", id, stats.errorRate() * 100),
                        "Review provider configuration and API limits"));
            }
            if (stats.averageDurationMs() > latencyCriticalMs) {
                result.add(new Recommendation(id, Recommendation.Type.SCALING, Recommendation.Priority.HIGH,
                        String.format(Locale.ROOT, "Slow response times for %s: %.0fms", id, stats.averageDurationMs()),
                        "Consider load balancing or switching to a faster model"));
            }
            if (stats.qualityScore() < qualityMinimum) {
                result.add(new Recommendation(id, Recommendation.Type.OPTIMIZATION, Recommendation.Priority.MEDIUM,
                        String.format(Locale.ROOT, "Low quality scores for %s: %.2f", id, stats.qualityScore()),
                        "Review prompts and model parameters"));
            }
        }
        result.sort(Comparator.comparing(Recommendation::priority).reversed()
                .thenComparing(Recommendation::subjectId));
        return result;
    }
}
