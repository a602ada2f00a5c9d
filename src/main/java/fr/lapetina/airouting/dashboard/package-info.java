/**
 * Read-only views over the monitoring state: the dashboard, the one-line summary and
 * the JSON export.
 *
 * <p>Summary status, worst first:
 * <table border="1">
 *   <caption>Summary status</caption>
 *   <tr><th>Status</th><th>Condition</th></tr>
 *   <tr><td>CRITICAL</td><td>any unresolved CRITICAL alert</td></tr>
 *   <tr><td>WARNING</td><td>any unresolved alert</td></tr>
 *   <tr><td>DEGRADED</td><td>overall error rate above 10%</td></tr>
 *   <tr><td>HEALTHY</td><td>otherwise</td></tr>
 * </table>
 */
package fr.lapetina.airouting.dashboard;
