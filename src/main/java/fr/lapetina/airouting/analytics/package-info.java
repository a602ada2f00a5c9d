/**
 * Trend detection and operator recommendations.
 */
package fr.lapetina.airouting.analytics;
