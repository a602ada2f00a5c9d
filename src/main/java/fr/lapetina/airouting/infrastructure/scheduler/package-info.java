/**
 * Periodic collection, alert, health and cleanup sweeps on a single scheduler.
 */
package fr.lapetina.airouting.infrastructure.scheduler;
