package fr.lapetina.airouting.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Configuration loader with hot-reload support.
 *
 * Supports:
 * - Loading from file system, falling back to the classpath
 * - Validation of loaded values
 * - File watching for automatic reload
 * - Listener notification on changes
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<RoutingConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(RoutingConfig.class, loaderOptions));
    }

    /**
     * Loads and validates configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public RoutingConfig load() {
        RoutingConfig config = validate(loadFromPath());
        RoutingConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private RoutingConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private RoutingConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private RoutingConfig parse(InputStream is, String source) {
        try {
            RoutingConfig config = yaml.load(is);
            return config != null ? config : new RoutingConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public RoutingConfig loadFromStream(InputStream inputStream) {
        RoutingConfig config = validate(parse(inputStream, "stream"));
        RoutingConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    /**
     * Returns the current configuration.
     */
    public RoutingConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Checks cross-field constraints that YAML binding cannot express.
     *
     * @throws ConfigurationException on the first violated constraint
     */
    public static RoutingConfig validate(RoutingConfig config) {
        RoutingConfig.MonitoringConfig monitoring = config.getMonitoring();
        requirePositive("monitoring.collectionIntervalMs", monitoring.getCollectionIntervalMs());
        requirePositive("monitoring.alertCheckIntervalMs", monitoring.getAlertCheckIntervalMs());
        requirePositive("monitoring.cleanupIntervalMs", monitoring.getCleanupIntervalMs());
        requirePositive("monitoring.maxOperationHistory", monitoring.getMaxOperationHistory());
        requirePositive("monitoring.reservoirCapacity", monitoring.getReservoirCapacity());
        requirePositive("monitoring.percentileRecomputeInterval", monitoring.getPercentileRecomputeInterval());
        requirePositive("health.checkIntervalMs", config.getHealth().getCheckIntervalMs());
        requirePositive("adaptiveRouting.historicalWindowSize",
                config.getAdaptiveRouting().getHistoricalWindowSize());
        requirePositive("loadBalancing.assumedCapacity", config.getLoadBalancing().getAssumedCapacity());
        requirePositive("loadBalancing.systemCapacity", config.getLoadBalancing().getSystemCapacity());
        requirePositive("loadBalancing.defaultMaxLatencyMs", config.getLoadBalancing().getDefaultMaxLatencyMs());

        RoutingConfig.HealthConfig health = config.getHealth();
        if (health.getDegradedThreshold() < 1 || health.getUnhealthyThreshold() < health.getDegradedThreshold()) {
            throw new ConfigurationException("health thresholds must satisfy 1 <= degradedThreshold <= unhealthyThreshold, got "
                    + health.getDegradedThreshold() + " and " + health.getUnhealthyThreshold());
        }

        double learningRate = config.getAdaptiveRouting().getLearningRate();
        if (learningRate <= 0.0 || learningRate > 1.0) {
            throw new ConfigurationException("adaptiveRouting.learningRate must be in (0, 1]: " + learningRate);
        }

        int ringBufferSize = config.getJournal().getRingBufferSize();
        if (Integer.bitCount(ringBufferSize) != 1) {
            throw new ConfigurationException("journal.ringBufferSize must be a power of 2: " + ringBufferSize);
        }

        Set<String> ids = new HashSet<>();
        for (RoutingConfig.ProviderConfig provider : config.getProviders()) {
            if (provider.getId() == null || provider.getId().isBlank()) {
                throw new ConfigurationException("Every provider needs an id");
            }
            if (!ids.add(provider.getId())) {
                throw new ConfigurationException("Duplicate provider id: " + provider.getId());
            }
        }
        return config;
    }

    private static void requirePositive(String name, double value) {
        if (value <= 0) {
            throw new ConfigurationException(name + " must be > 0: " + value);
        }
    }

    /**
     * Starts watching the configuration file for changes.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent == null) {
                parent = Paths.get(".");
            }
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });

            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);

        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
        }
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                Path changed = (Path) event.context();
                if (changed.equals(configPath.getFileName())) {
                    // Editors fire several events per save
                    long newLastModified = Files.getLastModifiedTime(configPath).toMillis();
                    if (newLastModified > lastModified) {
                        log.info("Configuration file changed, reloading...");
                        reload();
                    }
                }
            }

            key.reset();
        } catch (Exception e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Forces a configuration reload. A failed reload keeps the current configuration.
     */
    public RoutingConfig reload() {
        try {
            return load();
        } catch (Exception e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(RoutingConfig oldConfig, RoutingConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
