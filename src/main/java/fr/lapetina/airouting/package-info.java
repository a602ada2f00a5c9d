/**
 * AI Provider Router - performance-aware routing and monitoring for AI provider calls.
 *
 * <p>The router measures every call an application makes to its AI providers and to its
 * own internal services, keeps running statistics and health per provider, raises alerts
 * when thresholds are crossed, and uses all of it to pick the provider, model and service
 * path for the next request.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.airouting.RoutingMonitor} - Main entry point, wires every component
 *       from YAML configuration</li>
 *   <li>{@link fr.lapetina.airouting.RoutingMonitorApplication} - Standalone HTTP server</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (RoutingMonitor monitor = RoutingMonitor.create("config.yaml").start()) {
 *     RoutingRequirement requirement = RoutingRequirement.builder()
 *             .maxResponseTimeMs(3000)
 *             .preferredProviders("anthropic")
 *             .build();
 *     RoutingDecision decision = monitor.selectProvider(RequestContext.of(null, 0.7), requirement);
 *
 *     monitor.trackRequestStart(decision.requestId(), decision.selectedProvider(),
 *             decision.selectedModel(), decision.selectedService());
 *     // call the provider...
 *     monitor.trackRequestComplete(decision.requestId(), true, null, 0.92);
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Four load balancing policies: performance-based, weighted, least connections, round robin</li>
 *   <li>Per-provider health derived from consecutive failures</li>
 *   <li>Latency, error rate and inactivity alerts with de-duplication and cooldown</li>
 *   <li>Hot-reload of providers and strategy without restart</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 *   <li>Non-blocking decision journal on an LMAX Disruptor ring buffer</li>
 * </ul>
 *
 * @see fr.lapetina.airouting.RoutingMonitor
 * @see fr.lapetina.airouting.routing.RoutingDecisionEngine
 */
package fr.lapetina.airouting;
