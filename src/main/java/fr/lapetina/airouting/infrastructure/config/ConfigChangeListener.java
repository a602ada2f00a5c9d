package fr.lapetina.airouting.infrastructure.config;

/**
 * Listener for configuration changes.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Called when configuration is reloaded.
     *
     * @param oldConfig the previous configuration, null on first load
     * @param newConfig the new configuration
     */
    void onConfigChanged(RoutingConfig oldConfig, RoutingConfig newConfig);
}
