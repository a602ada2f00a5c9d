package fr.lapetina.airouting.infrastructure.time;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Time source that only moves when told to. Monotonic and wall clock advance together.
 */
public final class ManualTimeSource implements TimeSource {

    private static final Instant EPOCH = Instant.parse("2024-01-01T00:00:00Z");

    private final AtomicLong elapsedNanos = new AtomicLong(0);

    @Override
    public long nanoTime() {
        return elapsedNanos.get();
    }

    @Override
    public Instant now() {
        return EPOCH.plusNanos(elapsedNanos.get());
    }

    public void advance(Duration duration) {
        elapsedNanos.addAndGet(duration.toNanos());
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }
}
