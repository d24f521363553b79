package membership;

import utilities.LongRingBuffer;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A {@link BloomFilter} with a circular history of the last {@code historySize} added items.
 *
 * <p>{@link #test(byte[])} answers true only when the filter bits are set and the item's first
 * seed hash is among the recent history, so items that dropped out of the window stop testing
 * positive even though their bits remain. Merge and serialization live on the underlying
 * filter ({@link #filter()}); the history itself is never persisted.
 */
public class RecentHistoryFilter implements Membership {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final BloomFilter filter;
    private final LongRingBuffer history;

    public RecentHistoryFilter(BloomFilter filter, int historySize) {
        this.filter = Objects.requireNonNull(filter, "filter");
        if (historySize <= 0) {
            throw FilterException.invalidParameters("historySize must be > 0, got " + historySize);
        }
        this.history = new LongRingBuffer(historySize);
    }

    @Override
    public void add(byte[] data) {
        long[] h = filter.seedHash().hash(data);
        lock.writeLock().lock();
        try {
            filter.add(h);
            history.append(h[0]);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean test(byte[] data) {
        long[] h = filter.seedHash().hash(data);
        lock.readLock().lock();
        try {
            return filter.test(h) && history.contains(h[0]);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void reset() {
        lock.writeLock().lock();
        try {
            filter.reset();
            history.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public double approximateFalsePositiveRate() {
        return filter.approximateFalsePositiveRate();
    }

    public int historySize() {
        return history.capacity();
    }

    public BloomFilter filter() {
        return filter;
    }

    @Override
    public String toString() {
        return filter + ", history=" + history.capacity();
    }
}
