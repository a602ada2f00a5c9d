package fr.lapetina.airouting.journal;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.airouting.domain.event.DecisionEvent;
import fr.lapetina.airouting.domain.event.DecisionEventFactory;
import fr.lapetina.airouting.domain.model.RoutingDecision;
import fr.lapetina.airouting.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.airouting.routing.DecisionRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Records routing decisions off the request path.
 *
 * <p>Request threads publish into a pre-allocated ring buffer with {@code tryNext()}
 * and never wait: when the buffer is full the decision is dropped and counted. A single
 * consumer keeps the most recent decisions so that a completion can later be matched
 * with the estimate it was routed on.
 *
 * <p>PRODUCER TYPE: MULTI, since every request thread publishes.
 */
public final class DecisionJournal implements DecisionRecorder, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DecisionJournal.class);

    private final Disruptor<DecisionEvent> disruptor;
    private final RingBuffer<DecisionEvent> ringBuffer;
    private final DecisionRecordingHandler handler;
    private final MetricsRegistry metricsRegistry;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private DecisionJournal(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;
        this.handler = new DecisionRecordingHandler(builder.retainedDecisions);

        this.disruptor = new Disruptor<>(
                new DecisionEventFactory(),
                builder.ringBufferSize,
                new JournalThreadFactory("decision-journal"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );
        disruptor.handleEventsWith(handler);
        disruptor.setDefaultExceptionHandler(new JournalExceptionHandler());
        this.ringBuffer = disruptor.getRingBuffer();

        log.info("DecisionJournal created: ringBufferSize={}, waitStrategy={}, retained={}",
                builder.ringBufferSize, builder.waitStrategy, builder.retainedDecisions);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("DecisionJournal started");
        }
    }

    /**
     * Publishes a decision without blocking. Dropped if the journal is stopped or full.
     */
    @Override
    public void record(RoutingDecision decision) {
        if (!running.get()) {
            log.debug("Journal not running, decision not recorded: requestId={}", decision.requestId());
            return;
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            metricsRegistry.incrementDroppedDecisions();
            log.debug("Journal full, decision dropped: requestId={}", decision.requestId());
            return;
        }

        try {
            ringBuffer.get(sequence).initialize(decision, System.nanoTime());
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    /**
     * Looks up a journaled decision. Recording is asynchronous, so a decision made
     * a moment ago may not be visible yet.
     */
    public Optional<RoutingDecision> find(String requestId) {
        return handler.find(requestId);
    }

    /**
     * Looks up and forgets a journaled decision.
     */
    public Optional<RoutingDecision> take(String requestId) {
        return handler.take(requestId);
    }

    public long getRecordedCount() {
        return handler.getRecorded();
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down DecisionJournal...");
            try {
                disruptor.shutdown(5, TimeUnit.SECONDS);
                log.info("DecisionJournal shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("DecisionJournal shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class JournalThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        JournalThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    private static class JournalExceptionHandler implements ExceptionHandler<DecisionEvent> {

        @Override
        public void handleEventException(Throwable ex, long sequence, DecisionEvent event) {
            log.error("Exception journaling decision: sequence={}, event={}", sequence, event, ex);
            event.clear();
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during journal start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during journal shutdown", ex);
        }
    }

    /**
     * Builder for DecisionJournal.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int retainedDecisions = 1000;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder retainedDecisions(int retained) {
            if (retained <= 0) {
                throw new IllegalArgumentException("Retained decisions must be > 0");
            }
            this.retainedDecisions = retained;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public DecisionJournal build() {
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new DecisionJournal(this);
        }
    }
}
