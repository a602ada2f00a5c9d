package fr.lapetina.airouting.infrastructure.time;

import java.time.Instant;

/**
 * Source of monotonic and wall-clock time.
 *
 * <p>Durations are always measured with {@link #nanoTime()}; {@link #now()} is only
 * used for timestamps and age comparisons. Tests substitute a manually advanced source.
 */
public interface TimeSource {

    long nanoTime();

    Instant now();

    static TimeSource system() {
        return SystemTimeSource.INSTANCE;
    }

    final class SystemTimeSource implements TimeSource {
        private static final SystemTimeSource INSTANCE = new SystemTimeSource();

        private SystemTimeSource() {
        }

        @Override
        public long nanoTime() {
            return System.nanoTime();
        }

        @Override
        public Instant now() {
            return Instant.now();
        }
    }
}
