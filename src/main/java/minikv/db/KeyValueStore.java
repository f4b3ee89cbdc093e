package minikv.db;

import minikv.utils.Time;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The server's single keyspace, shared by every connection.
 * <p>
 * Reads take the shared lock and run in parallel; a write takes the exclusive lock.
 * Expiry is lazy: {@link #get} hides an expired row but leaves it in place until the
 * next {@link #set} of the same key replaces it.
 */
public class KeyValueStore {

    /** TTL applied when SET carries none. */
    public static final long DEFAULT_TTL_MILLIS = TimeUnit.DAYS.toMillis(365);

    private final Map<String, ValueEntry> entries = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Inserts or replaces {@code key}.
     *
     * @param ttlMillis time to live, or {@code null} for {@link #DEFAULT_TTL_MILLIS}
     */
    public void set(String key, String value, Long ttlMillis) {
        long ttl = ttlMillis != null ? ttlMillis : DEFAULT_TTL_MILLIS;
        if (ttl < 0) throw new IllegalArgumentException("negative ttl: " + ttl);

        lock.writeLock().lock();
        try {
            entries.put(key, new ValueEntry(value, Time.deadlineAfter(ttl)));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void set(String key, String value) {
        set(key, value, null);
    }

    /** The live value of {@code key}, or {@code null} if absent or expired. */
    public String get(String key) {
        ValueEntry entry;
        lock.readLock().lock();
        try {
            entry = entries.get(key);
        } finally {
            lock.readLock().unlock();
        }
        if (entry == null || entry.isExpired(Time.now())) return null;
        return entry.getValue();
    }

    /** Raw row lookup that ignores expiry. */
    ValueEntry getEntry(String key) {
        lock.readLock().lock();
        try {
            return entries.get(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    ReentrantReadWriteLock getLock() {
        return lock;
    }

    /** Physical row count, expired rows included. */
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
