/**
 * Running statistics used for routing, and the Micrometer export of what is observed.
 *
 * <p>{@link fr.lapetina.airouting.infrastructure.metrics.MetricsStore} is the source of truth
 * for routing. {@link fr.lapetina.airouting.infrastructure.metrics.MetricsRegistry} only
 * publishes to Prometheus; nothing reads it back.
 *
 * <h2>Exported Metrics</h2>
 * <table border="1">
 *   <tr><th>Name</th><th>Type</th><th>Tags</th></tr>
 *   <tr><td>{@code ai_router_operations_total}</td><td>counter</td><td>kind, subject, outcome</td></tr>
 *   <tr><td>{@code ai_router_operation_latency}</td><td>timer</td><td>kind, subject</td></tr>
 *   <tr><td>{@code ai_router_provider_inflight}</td><td>gauge</td><td>provider</td></tr>
 *   <tr><td>{@code ai_router_provider_health}</td><td>gauge</td><td>provider</td></tr>
 *   <tr><td>{@code ai_router_alerts_raised_total}</td><td>counter</td><td>type, severity</td></tr>
 *   <tr><td>{@code ai_router_alerts_active}</td><td>gauge</td><td></td></tr>
 *   <tr><td>{@code ai_router_routing_decisions_total}</td><td>counter</td><td>provider, strategy, fallback</td></tr>
 *   <tr><td>{@code ai_router_decisions_dropped_total}</td><td>counter</td><td></td></tr>
 *   <tr><td>{@code ai_router_unknown_completions_total}</td><td>counter</td><td></td></tr>
 *   <tr><td>{@code ai_router_decision_estimate_error_ms}</td><td>summary</td><td></td></tr>
 * </table>
 */
package fr.lapetina.airouting.infrastructure.metrics;
