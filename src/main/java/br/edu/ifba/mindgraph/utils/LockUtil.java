package br.edu.ifba.mindgraph.utils;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Pool of per-key locks that serialize read-merge-write cycles on one logical
 * element: a node identity, an edge identity or a conversation turn.
 *
 * <p>Readers never take these locks. They only order writers touching the same key;
 * the store's version check still guards every write.</p>
 *
 * <p>An entry lives only while some thread holds or waits for its lock. Users are
 * counted inside {@link ConcurrentHashMap#compute}, so a lock is never dropped
 * while another thread is about to acquire it.</p>
 */
public final class LockUtil {

    private static final ConcurrentHashMap<String, PooledLock> LOCK_POOL = new ConcurrentHashMap<>();

    private LockUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Runs {@code action} while holding the fair lock for {@code key}.
     */
    public static <T> T withLock(@NotNull String key, @NotNull Supplier<T> action) {
        PooledLock pooled = LOCK_POOL.compute(key, (k, existing) -> {
            PooledLock next = existing != null ? existing : new PooledLock();
            next.users++;
            return next;
        });
        try {
            pooled.lock.lock();
            try {
                return action.get();
            } finally {
                pooled.lock.unlock();
            }
        } finally {
            LOCK_POOL.computeIfPresent(key, (k, existing) -> --existing.users == 0 ? null : existing);
        }
    }

    static int poolSize() {
        return LOCK_POOL.size();
    }

    static boolean isPooled(String key) {
        return LOCK_POOL.containsKey(key);
    }

    /**
     * Clears the lock pool (tests only).
     */
    public static void clearLockPool() {
        LOCK_POOL.clear();
    }

    private static final class PooledLock {
        final ReentrantLock lock = new ReentrantLock(true);
        // guarded by the pool's per-key compute
        int users;
    }
}
