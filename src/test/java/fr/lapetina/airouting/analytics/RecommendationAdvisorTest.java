package fr.lapetina.airouting.analytics;

import fr.lapetina.airouting.domain.model.StatsSnapshot;
import fr.lapetina.airouting.domain.model.SubjectKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecommendationAdvisorTest {

    private final RecommendationAdvisor advisor = new RecommendationAdvisor(0.30, 10000, 0.7);

    private static StatsSnapshot provider(String id, long total, long failed, double avgMs, double quality) {
        return new StatsSnapshot(id, SubjectKind.PROVIDER, total, total - failed, failed, avgMs * total,
                avgMs, avgMs, avgMs, quality, null);
    }

    @Test
    @DisplayName("should recommend nothing for healthy providers")
    void shouldStayQuiet() {
        assertThat(advisor.recommend(List.of(provider("alpha", 100, 1, 800, 0.9)))).isEmpty();
    }

    @Test
    @DisplayName("should skip providers without data")
    void shouldSkipEmpty() {
        assertThat(advisor.recommend(List.of(provider("idle", 0, 0, 0, 0.1)))).isEmpty();
    }

    @Test
    @DisplayName("should rank recommendations by priority then provider")
    void shouldRankRecommendations() {
        List<Recommendation> recommendations = advisor.recommend(List.of(
                provider("meh", 100, 0, 800, 0.5),
                provider("slow", 100, 0, 12000, 0.9),
                provider("bad", 100, 50, 800, 0.9)));

        assertThat(recommendations).extracting(Recommendation::subjectId).containsExactly("bad", "slow", "meh");
        assertThat(recommendations).extracting(Recommendation::type).containsExactly(
                Recommendation.Type.CONFIGURATION, Recommendation.Type.SCALING, Recommendation.Type.OPTIMIZATION);
        assertThat(recommendations.get(0).description()).isEqualTo("High error rate detected for bad: 50.0%");
        assertThat(recommendations.get(1).description()).isEqualTo("Slow response times for slow: 12000ms");
        assertThat(recommendations.get(2).priority()).isEqualTo(Recommendation.Priority.MEDIUM);
    }
}
