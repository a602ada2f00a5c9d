package fr.lapetina.airouting.domain.strategy;

import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Factory for creating load balancing strategies by configuration name.
 *
 * Supports runtime strategy switching without service restart. Names are matched
 * case-insensitively and {@code -} is treated as {@code _}.
 */
public final class StrategyFactory {

    private static final Map<String, Function<TieBreaker, LoadBalancingStrategy>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register("performance_based", PerformanceBasedStrategy::new);
        register("weighted", WeightedStrategy::new);
        register("least_connections", LeastConnectionsStrategy::new);
        register("round_robin", tieBreaker -> new RoundRobinStrategy());
    }

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Registers a custom strategy.
     *
     * @param name    Strategy name (used in configuration)
     * @param creator Factory receiving the shared tie-breaker
     */
    public static void register(String name, Function<TieBreaker, LoadBalancingStrategy> creator) {
        REGISTRY.put(normalize(name), creator);
    }

    /**
     * Creates a strategy by name.
     *
     * @return Strategy instance, or empty if not found
     */
    public static Optional<LoadBalancingStrategy> create(String name, TieBreaker tieBreaker) {
        if (name == null) {
            return Optional.empty();
        }
        Function<TieBreaker, LoadBalancingStrategy> creator = REGISTRY.get(normalize(name));
        if (creator == null) {
            return Optional.empty();
        }
        return Optional.of(creator.apply(tieBreaker));
    }

    /**
     * Creates a strategy by name, falling back to performance-based selection.
     */
    public static LoadBalancingStrategy createOrDefault(String name, TieBreaker tieBreaker) {
        return create(name, tieBreaker).orElseGet(() -> new PerformanceBasedStrategy(tieBreaker));
    }

    /**
     * Returns all registered strategy names, sorted.
     */
    public static Iterable<String> getRegisteredNames() {
        return new TreeSet<>(REGISTRY.keySet());
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase().replace('-', '_');
    }
}
