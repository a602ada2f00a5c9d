package fr.lapetina.airouting.infrastructure.metrics;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Bounded FIFO buffer. Appending past capacity evicts the oldest entry.
 */
public final class HistoryRing<T> {

    private final ArrayDeque<T> entries;
    private final int capacity;

    public HistoryRing(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("History capacity must be > 0: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    public synchronized void add(T entry) {
        if (entries.size() == capacity) {
            entries.pollFirst();
        }
        entries.addLast(entry);
    }

    /**
     * Returns up to {@code limit} most recent entries, oldest first.
     */
    public synchronized List<T> latest(int limit) {
        int skip = Math.max(0, entries.size() - limit);
        List<T> result = new ArrayList<>(entries.size() - skip);
        int i = 0;
        for (T entry : entries) {
            if (i++ >= skip) {
                result.add(entry);
            }
        }
        return result;
    }

    public synchronized List<T> snapshot() {
        return new ArrayList<>(entries);
    }

    /**
     * Drops every entry matching the predicate.
     *
     * @return number of entries removed
     */
    public synchronized int removeIf(Predicate<T> predicate) {
        int before = entries.size();
        entries.removeIf(predicate);
        return before - entries.size();
    }

    public synchronized int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }
}
