/**
 * Provider scoring and the routing decision.
 *
 * <p>{@link fr.lapetina.airouting.routing.ProviderScorer} turns statistics, health and load
 * into a composite score:
 * <pre>
 * score = performance * 0.4 + load * 0.2 + health * 0.2 + alignment * 0.2
 * </pre>
 * multiplied by the preferred-provider bonus and capped at 1.0.
 * {@link fr.lapetina.airouting.routing.RoutingDecisionEngine} ranks every enabled provider,
 * hands the ranking to the active strategy and assembles the decision with its estimates
 * and alternatives.
 */
package fr.lapetina.airouting.routing;
