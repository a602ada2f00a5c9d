/**
 * Load balancing policies applied to a ranked list of provider scores.
 *
 * <p>Every policy receives the full ranked list and returns one
 * {@link fr.lapetina.airouting.domain.strategy.LoadBalancingStrategy.Selection}. All
 * implementations are thread-safe.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Description</th><th>Requirement filter</th></tr>
 *   <tr><td>{@code performance_based}</td><td>Best composite score</td><td>yes, with fallback</td></tr>
 *   <tr><td>{@code weighted}</td><td>Score times static weight</td><td>no</td></tr>
 *   <tr><td>{@code least_connections}</td><td>Fewest in-flight within 10% of best</td><td>no</td></tr>
 *   <tr><td>{@code round_robin}</td><td>Cycles through the ranked list</td><td>no</td></tr>
 * </table>
 *
 * <p>Near-equal leaders are separated by a {@link fr.lapetina.airouting.domain.strategy.TieBreaker}
 * backed by an injectable {@link java.util.Random}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * TieBreaker tieBreaker = new TieBreaker(new Random(42), 1e-6);
 * LoadBalancingStrategy strategy = StrategyFactory.create("least_connections", tieBreaker).orElseThrow();
 * Selection selection = strategy.select(rankedScores);
 * }</pre>
 */
package fr.lapetina.airouting.domain.strategy;
