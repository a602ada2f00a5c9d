/**
 * YAML configuration for the router.
 *
 * <p>{@link fr.lapetina.airouting.infrastructure.config.RoutingConfig} is a plain JavaBean
 * tree bound by SnakeYAML. {@link fr.lapetina.airouting.infrastructure.config.ConfigLoader}
 * reads it from the file system or the classpath, validates it and can watch the file
 * for changes.
 *
 * <h2>Reloadable Settings</h2>
 * <table border="1">
 *   <tr><th>Section</th><th>Applied on reload</th></tr>
 *   <tr><td>{@code providers}</td><td>yes, registry is replaced</td></tr>
 *   <tr><td>{@code loadBalancing.algorithm}</td><td>yes, strategy is swapped</td></tr>
 *   <tr><td>{@code loadBalancing.weights}</td><td>yes, through the provider weights</td></tr>
 *   <tr><td>everything else</td><td>no, requires a restart</td></tr>
 * </table>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * loadBalancing:
 *   algorithm: performance_based
 *   weights:
 *     openai: 1.0
 *     local: 0.6
 * }</pre>
 */
package fr.lapetina.airouting.infrastructure.config;
