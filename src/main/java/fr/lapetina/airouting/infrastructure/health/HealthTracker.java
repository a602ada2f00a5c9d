package fr.lapetina.airouting.infrastructure.health;

import fr.lapetina.airouting.domain.model.HealthState;
import fr.lapetina.airouting.domain.model.HealthStatus;
import fr.lapetina.airouting.infrastructure.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Per-provider health state machine fed by request outcomes.
 *
 * <p>Consecutive failures move a provider from HEALTHY to DEGRADED at
 * {@code degradedThreshold} and to UNHEALTHY at {@code unhealthyThreshold}. A single
 * success resets it to HEALTHY. Staleness is tracked separately by
 * {@link #sweepStaleness()} and never changes the state or the failure count.
 *
 * <p>Each provider entry is updated atomically through {@link ConcurrentHashMap#compute}.
 */
public final class HealthTracker {

    private static final Logger log = LoggerFactory.getLogger(HealthTracker.class);

    private final Map<String, HealthStatus> statuses = new ConcurrentHashMap<>();
    private final List<Consumer<HealthTransition>> listeners = new CopyOnWriteArrayList<>();
    private final TimeSource timeSource;
    private final int degradedThreshold;
    private final int unhealthyThreshold;
    private final Duration staleAfter;

    public HealthTracker(TimeSource timeSource, int degradedThreshold, int unhealthyThreshold, Duration staleAfter) {
        if (degradedThreshold < 1 || unhealthyThreshold < degradedThreshold) {
            throw new IllegalArgumentException("Require 1 <= degradedThreshold <= unhealthyThreshold");
        }
        this.timeSource = timeSource;
        this.degradedThreshold = degradedThreshold;
        this.unhealthyThreshold = unhealthyThreshold;
        this.staleAfter = staleAfter;
    }

    public HealthTracker(TimeSource timeSource) {
        this(timeSource, 3, 6, Duration.ofMinutes(5));
    }

    /**
     * Starts tracking a provider as HEALTHY if it is not tracked yet.
     */
    public void register(String providerId) {
        statuses.computeIfAbsent(providerId, id -> HealthStatus.initial(id, timeSource.now()));
    }

    public void recordSuccess(String providerId) {
        Instant now = timeSource.now();
        HealthStatus[] previous = new HealthStatus[1];
        HealthStatus updated = statuses.compute(providerId, (id, current) -> {
            previous[0] = current;
            HealthStatus base = current != null ? current : HealthStatus.initial(id, now);
            return base.withState(HealthState.HEALTHY, 0, now);
        });
        fireIfChanged(previous[0], updated);
    }

    public void recordFailure(String providerId) {
        Instant now = timeSource.now();
        HealthStatus[] previous = new HealthStatus[1];
        HealthStatus updated = statuses.compute(providerId, (id, current) -> {
            previous[0] = current;
            HealthStatus base = current != null ? current : HealthStatus.initial(id, now);
            int failures = base.consecutiveFailures() + 1;
            return base.withState(stateFor(failures, base.state()), failures, now);
        });
        if (updated.state() != HealthState.HEALTHY) {
            log.warn("Provider failure recorded: provider={}, consecutiveFailures={}, state={}",
                    providerId, updated.consecutiveFailures(), updated.state());
        }
        fireIfChanged(previous[0], updated);
    }

    private HealthState stateFor(int failures, HealthState current) {
        if (failures >= unhealthyThreshold) {
            return HealthState.UNHEALTHY;
        }
        if (failures >= degradedThreshold) {
            return HealthState.DEGRADED;
        }
        return current;
    }

    /**
     * Flags providers with no activity within the staleness window.
     *
     * @return number of providers currently stale
     */
    public int sweepStaleness() {
        Instant now = timeSource.now();
        Instant cutoff = now.minus(staleAfter);
        int stale = 0;
        for (String providerId : statuses.keySet()) {
            HealthStatus updated = statuses.computeIfPresent(providerId, (id, current) -> {
                boolean isStale = current.lastActivityAt() != null && current.lastActivityAt().isBefore(cutoff);
                if (isStale && !current.stale()) {
                    log.info("Provider marked stale: provider={}, lastActivityAt={}", id, current.lastActivityAt());
                }
                return current.withStale(isStale, now);
            });
            if (updated != null && updated.stale()) {
                stale++;
            }
        }
        return stale;
    }

    public Optional<HealthStatus> getStatus(String providerId) {
        return Optional.ofNullable(statuses.get(providerId));
    }

    /**
     * Returns the state of a provider, HEALTHY when it has never been observed.
     */
    public HealthState getState(String providerId) {
        HealthStatus status = statuses.get(providerId);
        return status != null ? status.state() : HealthState.HEALTHY;
    }

    public List<HealthStatus> getAllStatuses() {
        return statuses.values().stream()
                .sorted(Comparator.comparing(HealthStatus::providerId))
                .toList();
    }

    public void remove(String providerId) {
        statuses.remove(providerId);
    }

    public void addListener(Consumer<HealthTransition> listener) {
        listeners.add(listener);
    }

    private void fireIfChanged(HealthStatus previous, HealthStatus updated) {
        HealthState from = previous != null ? previous.state() : HealthState.HEALTHY;
        if (from == updated.state()) {
            return;
        }
        log.info("Provider health changed: provider={}, previousState={}, newState={}, consecutiveFailures={}",
                updated.providerId(), from, updated.state(), updated.consecutiveFailures());
        HealthTransition transition = new HealthTransition(updated.providerId(), from, updated.state());
        for (Consumer<HealthTransition> listener : listeners) {
            try {
                listener.accept(transition);
            } catch (Exception e) {
                log.error("Error notifying health listener", e);
            }
        }
    }

    /**
     * A change of health state.
     */
    public record HealthTransition(String providerId, HealthState from, HealthState to) {
    }
}
