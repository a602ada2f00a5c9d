/**
 * Threshold alerts over provider and service statistics.
 *
 * <table border="1">
 *   <caption>Alert rules</caption>
 *   <tr><th>Type</th><th>Condition</th><th>Severity</th></tr>
 *   <tr><td>LATENCY</td><td>mean above warning / critical</td><td>HIGH / CRITICAL</td></tr>
 *   <tr><td>ERROR_RATE</td><td>failure ratio above warning / critical</td><td>HIGH / CRITICAL</td></tr>
 *   <tr><td>INACTIVITY</td><td>no operation within the window</td><td>MEDIUM</td></tr>
 * </table>
 */
package fr.lapetina.airouting.infrastructure.alert;
