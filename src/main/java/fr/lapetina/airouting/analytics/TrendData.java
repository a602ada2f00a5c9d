package fr.lapetina.airouting.analytics;

/**
 * Movement of one system metric between two collection ticks.
 *
 * @param changePercent relative change as a fraction of the previous value
 * @param confidence    grows with the number of observed operations, capped at 1
 */
public record TrendData(
        String metric,
        double current,
        double previous,
        double change,
        double changePercent,
        TrendDirection direction,
        double confidence
) {
}
