/**
 * Provider registry and health state.
 *
 * <p>Health is driven only by request outcomes: a success resets a provider to HEALTHY,
 * consecutive failures move it to DEGRADED and then UNHEALTHY. Staleness is reported
 * separately and never changes the state.
 */
package fr.lapetina.airouting.infrastructure.health;
