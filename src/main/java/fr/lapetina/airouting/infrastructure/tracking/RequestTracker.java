package fr.lapetina.airouting.infrastructure.tracking;

import fr.lapetina.airouting.domain.model.ActiveRequest;
import fr.lapetina.airouting.domain.model.HistoryRecord;
import fr.lapetina.airouting.domain.model.OperationHandle;
import fr.lapetina.airouting.domain.model.OperationRecord;
import fr.lapetina.airouting.domain.model.SubjectKind;
import fr.lapetina.airouting.infrastructure.health.HealthTracker;
import fr.lapetina.airouting.infrastructure.health.ProviderRegistry;
import fr.lapetina.airouting.infrastructure.metrics.HistoryRing;
import fr.lapetina.airouting.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.airouting.infrastructure.metrics.MetricsStore;
import fr.lapetina.airouting.infrastructure.time.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns start/end pairs into duration measurements.
 *
 * <p>Two entry points share the same bookkeeping:
 * <ul>
 *   <li>{@link #startOperation}/{@link #endOperation} time an internal operation of a service
 *       and can be switched off with {@link #setEnabled(boolean)}</li>
 *   <li>{@link #trackRequestStart}/{@link #trackRequestComplete} time a request sent to a provider,
 *       maintain the per-provider in-flight counter and history ring, and feed the health tracker</li>
 * </ul>
 *
 * <p>Instrumentation never fails the caller: misuse is logged at WARN and ignored, internal
 * errors are logged at ERROR and swallowed.
 */
public final class RequestTracker {

    private static final Logger log = LoggerFactory.getLogger(RequestTracker.class);

    private final MetricsStore metricsStore;
    private final HealthTracker healthTracker;
    private final ProviderRegistry providerRegistry;
    private final MetricsRegistry metricsRegistry;
    private final TimeSource timeSource;
    private final Settings settings;
    private final AtomicBoolean enabled;

    private final Map<String, PendingOperation> pendingOperations = new ConcurrentHashMap<>();
    private final Map<String, ActiveRequest> activeRequests = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();
    private final Map<String, HistoryRing<HistoryRecord>> providerHistory = new ConcurrentHashMap<>();
    private final HistoryRing<OperationRecord> operationHistory;

    public RequestTracker(
            MetricsStore metricsStore,
            HealthTracker healthTracker,
            ProviderRegistry providerRegistry,
            MetricsRegistry metricsRegistry,
            TimeSource timeSource,
            Settings settings
    ) {
        this.metricsStore = metricsStore;
        this.healthTracker = healthTracker;
        this.providerRegistry = providerRegistry;
        this.metricsRegistry = metricsRegistry;
        this.timeSource = timeSource;
        this.settings = settings;
        this.enabled = new AtomicBoolean(settings.enabled());
        this.operationHistory = new HistoryRing<>(settings.maxOperationHistory());
    }

    // ==================== OPERATIONS ====================

    /**
     * Starts timing an operation.
     *
     * @return a handle to pass to {@link #endOperation}, or {@link OperationHandle#DISABLED}
     */
    public OperationHandle startOperation(String subjectId, String operationName) {
        if (!enabled.get()) {
            return OperationHandle.DISABLED;
        }
        try {
            OperationHandle handle = new OperationHandle(
                    subjectId + ":" + operationName + ":" + UUID.randomUUID(), subjectId, operationName);
            pendingOperations.put(handle.id(),
                    new PendingOperation(handle, timeSource.nanoTime(), timeSource.now()));
            log.debug("Operation started: subject={}, operation={}", subjectId, operationName);
            return handle;
        } catch (RuntimeException e) {
            log.error("Failed to start operation: subject={}, operation={}", subjectId, operationName, e);
            return OperationHandle.DISABLED;
        }
    }

    /**
     * Ends an operation. Unknown handles are ignored.
     *
     * @return the recorded operation, empty if nothing was recorded
     */
    public Optional<OperationRecord> endOperation(
            OperationHandle handle,
            boolean success,
            String errorMessage,
            Map<String, Object> metadata
    ) {
        if (handle == null || handle.isDisabled()) {
            return Optional.empty();
        }
        try {
            PendingOperation pending = pendingOperations.remove(handle.id());
            if (pending == null) {
                log.warn("End called for unknown operation handle: handle={}", handle.id());
                metricsRegistry.incrementUnknownCompletions();
                return Optional.empty();
            }
            double rawMs = (timeSource.nanoTime() - pending.startNanos()) / 1_000_000.0;
            Instant now = timeSource.now();
            double durationMs = metricsStore.record(SubjectKind.SERVICE, handle.subjectId(), rawMs, success, now);
            metricsRegistry.recordOperation(SubjectKind.SERVICE, handle.subjectId(), durationMs, success);

            OperationRecord record = new OperationRecord(handle.subjectId(), handle.operationName(),
                    durationMs, success, errorMessage, metadata, now);
            operationHistory.add(record);

            if (!success) {
                log.warn("Operation failed: subject={}, operation={}, durationMs={}, error={}",
                        handle.subjectId(), handle.operationName(), durationMs, errorMessage);
            } else {
                log.debug("Operation completed: subject={}, operation={}, durationMs={}",
                        handle.subjectId(), handle.operationName(), durationMs);
            }
            return Optional.of(record);
        } catch (RuntimeException e) {
            log.error("Failed to record operation: handle={}", handle.id(), e);
            return Optional.empty();
        }
    }

    // ==================== PROVIDER REQUESTS ====================

    /**
     * Marks a provider request as in flight.
     *
     * @return false if the request id is already in flight
     */
    public boolean trackRequestStart(String requestId, String providerId, String model, String serviceId) {
        MDC.put("requestId", requestId);
        MDC.put("provider", providerId);
        try {
            ActiveRequest request = new ActiveRequest(requestId, providerId, model, serviceId,
                    timeSource.nanoTime(), timeSource.now(), heapUsed());
            if (activeRequests.putIfAbsent(requestId, request) != null) {
                log.warn("Duplicate start ignored for in-flight request: requestId={}", requestId);
                return false;
            }
            providerRegistry.registerIfAbsent(providerId);
            healthTracker.register(providerId);
            int current = counterFor(providerId).incrementAndGet();
            log.debug("Request started: requestId={}, provider={}, model={}, service={}, inFlight={}",
                    requestId, providerId, model, serviceId, current);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to track request start: requestId={}", requestId, e);
            return false;
        } finally {
            MDC.remove("requestId");
            MDC.remove("provider");
        }
    }

    /**
     * Completes a provider request. Unknown request ids are ignored.
     *
     * @param quality caller-assessed response quality in [0, 1], or null if not assessed
     * @return the history record appended, empty if nothing was recorded
     */
    public Optional<HistoryRecord> trackRequestComplete(
            String requestId,
            boolean success,
            String errorType,
            Double quality
    ) {
        MDC.put("requestId", requestId);
        try {
            ActiveRequest request = activeRequests.remove(requestId);
            if (request == null) {
                log.warn("Completion reported for unknown request: requestId={}", requestId);
                metricsRegistry.incrementUnknownCompletions();
                return Optional.empty();
            }
            MDC.put("provider", request.providerId());
            release(request.providerId());

            double rawMs = (timeSource.nanoTime() - request.startNanos()) / 1_000_000.0;
            Instant now = timeSource.now();
            double durationMs = metricsStore.record(SubjectKind.PROVIDER, request.providerId(), rawMs, success, now);
            metricsRegistry.recordOperation(SubjectKind.PROVIDER, request.providerId(), durationMs, success);
            if (request.serviceId() != null) {
                metricsStore.record(SubjectKind.SERVICE, request.serviceId(), durationMs, success, now);
                metricsRegistry.recordOperation(SubjectKind.SERVICE, request.serviceId(), durationMs, success);
            }
            if (quality != null) {
                metricsStore.recordQuality(request.providerId(), quality);
            }
            if (success) {
                healthTracker.recordSuccess(request.providerId());
            } else {
                healthTracker.recordFailure(request.providerId());
            }

            HistoryRecord record = new HistoryRecord(requestId, request.providerId(), request.model(),
                    request.serviceId(), durationMs, success, errorType, quality,
                    heapUsed() - request.heapUsedAtStart(), now);
            historyFor(request.providerId()).add(record);
            operationHistory.add(toOperationRecord(record));

            if (success) {
                log.debug("Request completed: requestId={}, provider={}, durationMs={}",
                        requestId, request.providerId(), durationMs);
            } else {
                log.warn("Request failed: requestId={}, provider={}, durationMs={}, errorType={}",
                        requestId, request.providerId(), durationMs, errorType);
            }
            return Optional.of(record);
        } catch (RuntimeException e) {
            log.error("Failed to track request completion: requestId={}", requestId, e);
            return Optional.empty();
        } finally {
            MDC.remove("requestId");
            MDC.remove("provider");
        }
    }

    private OperationRecord toOperationRecord(HistoryRecord record) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("requestId", record.requestId());
        metadata.put("provider", record.providerId());
        if (record.model() != null) {
            metadata.put("model", record.model());
        }
        if (record.serviceId() != null) {
            metadata.put("service", record.serviceId());
        }
        return new OperationRecord(record.providerId(), "request", record.durationMs(), record.success(),
                record.errorType(), metadata, record.timestamp());
    }

    // ==================== SWEEPS ====================

    /**
     * Drops in-flight requests older than the maximum age without recording a measurement.
     *
     * @return number of requests dropped
     */
    public int sweepStaleRequests() {
        Instant cutoff = timeSource.now().minus(settings.staleRequestMaxAge());
        int dropped = 0;
        for (ActiveRequest request : new ArrayList<>(activeRequests.values())) {
            if (request.startedAt().isBefore(cutoff) && activeRequests.remove(request.requestId(), request)) {
                release(request.providerId());
                dropped++;
                log.warn("Stale in-flight request dropped: requestId={}, provider={}, startedAt={}",
                        request.requestId(), request.providerId(), request.startedAt());
            }
        }
        return dropped;
    }

    /**
     * Drops started operations that never ended once they exceed the maximum age.
     *
     * @return number of operations dropped
     */
    public int sweepAbandonedOperations() {
        Instant cutoff = timeSource.now().minus(settings.staleRequestMaxAge());
        int dropped = 0;
        for (Map.Entry<String, PendingOperation> entry : new ArrayList<>(pendingOperations.entrySet())) {
            PendingOperation pending = entry.getValue();
            if (pending.startedAt().isBefore(cutoff) && pendingOperations.remove(entry.getKey(), pending)) {
                dropped++;
                log.warn("Abandoned operation dropped: subject={}, operation={}, startedAt={}",
                        pending.handle().subjectId(), pending.handle().operationName(), pending.startedAt());
            }
        }
        return dropped;
    }

    /**
     * Drops operation history older than the retention window.
     *
     * @return number of entries removed
     */
    public int cleanupHistory() {
        Instant cutoff = timeSource.now().minus(settings.historyRetention());
        int removed = operationHistory.removeIf(r -> r.timestamp().isBefore(cutoff));
        if (removed > 0) {
            log.info("Operation history cleaned up: removed={}, retained={}", removed, operationHistory.size());
        }
        return removed;
    }

    // ==================== QUERIES ====================

    public int getInFlight(String providerId) {
        AtomicInteger counter = inFlight.get(providerId);
        return counter != null ? counter.get() : 0;
    }

    public int getTotalInFlight() {
        int total = 0;
        for (AtomicInteger counter : inFlight.values()) {
            total += counter.get();
        }
        return total;
    }

    public List<ActiveRequest> getActiveRequests() {
        return activeRequests.values().stream()
                .sorted(Comparator.comparing(ActiveRequest::startedAt))
                .toList();
    }

    public int getPendingOperationCount() {
        return pendingOperations.size();
    }

    public Optional<ActiveRequest> getActiveRequest(String requestId) {
        return Optional.ofNullable(activeRequests.get(requestId));
    }

    /**
     * Most recent history of a provider, oldest first.
     */
    public List<HistoryRecord> getProviderHistory(String providerId, int limit) {
        HistoryRing<HistoryRecord> ring = providerHistory.get(providerId);
        return ring != null ? ring.latest(limit) : List.of();
    }

    public List<OperationRecord> getRecentOperations(int limit) {
        return operationHistory.latest(limit);
    }

    /**
     * Operation history filtered by subject and time range. Null filters match everything.
     */
    public List<OperationRecord> getOperations(String subjectId, Instant start, Instant end, int limit) {
        List<OperationRecord> matching = operationHistory.snapshot().stream()
                .filter(r -> subjectId == null || subjectId.equals(r.subjectId()))
                .filter(r -> start == null || !r.timestamp().isBefore(start))
                .filter(r -> end == null || !r.timestamp().isAfter(end))
                .toList();
        int skip = Math.max(0, matching.size() - limit);
        return matching.subList(skip, matching.size());
    }

    public List<OperationRecord> getAllOperations() {
        return operationHistory.snapshot();
    }

    public void setEnabled(boolean value) {
        boolean previous = enabled.getAndSet(value);
        if (previous != value) {
            log.info("Performance monitoring {}", value ? "enabled" : "disabled");
        }
    }

    public boolean isEnabled() {
        return enabled.get();
    }

    private AtomicInteger counterFor(String providerId) {
        return inFlight.computeIfAbsent(providerId, id -> {
            AtomicInteger counter = new AtomicInteger(0);
            metricsRegistry.registerProvider(id, counter::get,
                    () -> 2 - healthTracker.getState(id).ordinal());
            return counter;
        });
    }

    private void release(String providerId) {
        counterFor(providerId).updateAndGet(v -> Math.max(0, v - 1));
    }

    private HistoryRing<HistoryRecord> historyFor(String providerId) {
        return providerHistory.computeIfAbsent(providerId,
                id -> new HistoryRing<>(settings.providerHistorySize()));
    }

    private static long heapUsed() {
        Runtime runtime = Runtime.getRuntime();
        return runtime.totalMemory() - runtime.freeMemory();
    }

    private record PendingOperation(OperationHandle handle, long startNanos, Instant startedAt) {
    }

    /**
     * Tracker tuning.
     */
    public record Settings(
            boolean enabled,
            int maxOperationHistory,
            int providerHistorySize,
            Duration staleRequestMaxAge,
            Duration historyRetention
    ) {
        public static Settings defaults() {
            return new Settings(true, 10_000, 1000, Duration.ofMinutes(10), Duration.ofHours(24));
        }
    }
}
