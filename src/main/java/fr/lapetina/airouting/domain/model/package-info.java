/**
 * Value types shared by tracking, health, alerting and routing.
 *
 * <p>Nearly everything here is an immutable record. Mutable state lives in the
 * infrastructure components that own it and is only ever handed out as one of these
 * snapshots.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.airouting.domain.model.StatsSnapshot} - running statistics of a provider or service</li>
 *   <li>{@link fr.lapetina.airouting.domain.model.HealthStatus} - health state machine output</li>
 *   <li>{@link fr.lapetina.airouting.domain.model.Alert} - threshold breach raised by the alert engine</li>
 *   <li>{@link fr.lapetina.airouting.domain.model.RoutingDecision} - result of a routing request</li>
 *   <li>{@link fr.lapetina.airouting.domain.model.Provider} - a routable backend</li>
 * </ul>
 *
 * @see fr.lapetina.airouting.domain.model.RoutingRequirement
 */
package fr.lapetina.airouting.domain.model;
