package fun.fengwk.readex.core.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongSupplier;

/**
 * Size-bounded cache with least-recently-used eviction and per-entry expiration.
 *
 * <p>Reads run under the shared lock and record their access in a buffer; the buffer is replayed
 * into the recency list under the exclusive lock before every write, so eviction always sees
 * every access that happened before it. Expired entries are invisible to {@link #get(Object)} and are
 * removed by a background sweep.</p>
 *
 * @author fengwk
 */
@Slf4j
public class LruTtlCache<K, V> implements AutoCloseable {

    private static final int MIN_DRAIN_THRESHOLD = 64;

    private final String name;
    private final int maxSize;
    private final LongSupplier clock;
    private final Map<K, Entry<K, V>> entries = new HashMap<>();
    private final Entry<K, V> sentinel = new Entry<>(null, null, 0L);
    private final Queue<Entry<K, V>> accessBuffer = new ConcurrentLinkedQueue<>();
    private final AtomicInteger accessBufferSize = new AtomicInteger();
    private final int drainThreshold;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final ScheduledExecutorService sweeper;

    public LruTtlCache(String name, int maxSize, Duration sweepInterval) {
        this(name, maxSize, sweepInterval, System::currentTimeMillis);
    }

    LruTtlCache(String name, int maxSize, Duration sweepInterval, LongSupplier clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("cache max size must be positive: " + maxSize);
        }
        this.name = name;
        this.maxSize = maxSize;
        this.clock = clock;
        this.drainThreshold = Math.max(MIN_DRAIN_THRESHOLD, maxSize);
        sentinel.previous = sentinel;
        sentinel.next = sentinel;
        this.sweeper = startSweeper(sweepInterval);
    }

    public Optional<V> get(K key) {
        V value = null;
        boolean expired = false;
        lock.readLock().lock();
        try {
            Entry<K, V> entry = entries.get(key);
            if (entry != null && clock.getAsLong() < entry.expiresAt) {
                value = entry.value;
                accessBuffer.offer(entry);
                accessBufferSize.incrementAndGet();
                hits.increment();
            } else {
                expired = entry != null;
                misses.increment();
            }
        } finally {
            lock.readLock().unlock();
        }
        if (expired) {
            removeIfExpired(key);
        } else if (accessBufferSize.get() > drainThreshold && lock.writeLock().tryLock()) {
            try {
                drainAccessBuffer();
            } finally {
                lock.writeLock().unlock();
            }
        }
        return Optional.ofNullable(value);
    }

    public void set(K key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        long expiresAt = clock.getAsLong() + ttl.toMillis();
        lock.writeLock().lock();
        try {
            drainAccessBuffer();
            Entry<K, V> existing = entries.get(key);
            if (existing != null) {
                existing.value = value;
                existing.expiresAt = expiresAt;
                moveToFront(existing);
                return;
            }
            if (entries.size() >= maxSize) {
                evictEldest();
            }
            Entry<K, V> entry = new Entry<>(key, value, expiresAt);
            entries.put(key, entry);
            linkFirst(entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void remove(K key) {
        lock.writeLock().lock();
        try {
            Entry<K, V> entry = entries.remove(key);
            if (entry != null) {
                unlink(entry);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            accessBuffer.clear();
            accessBufferSize.set(0);
            entries.clear();
            sentinel.previous = sentinel;
            sentinel.next = sentinel;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public CacheStats stats() {
        return CacheStats.of(size(), hits.sum(), misses.sum());
    }

    /**
     * Removes every expired entry.
     *
     * @return number of removed entries.
     */
    public int sweep() {
        int removed = 0;
        lock.writeLock().lock();
        try {
            drainAccessBuffer();
            long now = clock.getAsLong();
            Iterator<Entry<K, V>> iterator = entries.values().iterator();
            while (iterator.hasNext()) {
                Entry<K, V> entry = iterator.next();
                if (now >= entry.expiresAt) {
                    iterator.remove();
                    unlink(entry);
                    removed++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed > 0) {
            log.debug("cache sweep finished, name={}, removed={}", name, removed);
        }
        return removed;
    }

    public String getName() {
        return name;
    }

    @Override
    public void close() {
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
    }

    private ScheduledExecutorService startSweeper(Duration sweepInterval) {
        if (sweepInterval == null || sweepInterval.isZero() || sweepInterval.isNegative()) {
            return null;
        }
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("readex-cache-sweeper-" + name);
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = sweepInterval.toMillis();
        executor.scheduleWithFixedDelay(this::safeSweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        return executor;
    }

    private void safeSweep() {
        try {
            sweep();
        } catch (RuntimeException ex) {
            log.warn("cache sweep failed, name={}", name, ex);
        }
    }

    private void removeIfExpired(K key) {
        lock.writeLock().lock();
        try {
            Entry<K, V> entry = entries.get(key);
            if (entry != null && clock.getAsLong() >= entry.expiresAt) {
                entries.remove(key);
                unlink(entry);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void drainAccessBuffer() {
        Entry<K, V> entry;
        while ((entry = accessBuffer.poll()) != null) {
            accessBufferSize.decrementAndGet();
            if (entry.linked) {
                moveToFront(entry);
            }
        }
    }

    private void evictEldest() {
        Entry<K, V> eldest = sentinel.previous;
        if (eldest == sentinel) {
            return;
        }
        entries.remove(eldest.key);
        unlink(eldest);
        log.debug("cache entry evicted, name={}, size={}", name, entries.size());
    }

    private void moveToFront(Entry<K, V> entry) {
        unlink(entry);
        linkFirst(entry);
    }

    private void linkFirst(Entry<K, V> entry) {
        entry.previous = sentinel;
        entry.next = sentinel.next;
        sentinel.next.previous = entry;
        sentinel.next = entry;
        entry.linked = true;
    }

    private void unlink(Entry<K, V> entry) {
        if (!entry.linked) {
            return;
        }
        entry.previous.next = entry.next;
        entry.next.previous = entry.previous;
        entry.previous = null;
        entry.next = null;
        entry.linked = false;
    }

    private static class Entry<K, V> {

        private final K key;
        private V value;
        private long expiresAt;
        private Entry<K, V> previous;
        private Entry<K, V> next;
        private boolean linked;

        private Entry(K key, V value, long expiresAt) {
            this.key = key;
            this.value = value;
            this.expiresAt = expiresAt;
        }

    }

}
