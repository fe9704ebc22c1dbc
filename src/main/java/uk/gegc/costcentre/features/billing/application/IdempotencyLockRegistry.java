package uk.gegc.costcentre.features.billing.application;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process mutex per idempotency tuple.
 *
 * <p>Held around the recorder's whole check-and-insert transaction, so callers in this JVM
 * serialize even when the database cannot lock a row that does not exist yet. Entries are
 * removed once the last holder leaves.
 */
@Component
public class IdempotencyLockRegistry {

    private final ConcurrentHashMap<String, LockEntry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String key, Supplier<T> action) {
        LockEntry entry = locks.compute(key, (k, existing) -> {
            LockEntry e = existing != null ? existing : new LockEntry();
            e.holders++;
            return e;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, e) -> --e.holders == 0 ? null : e);
        }
    }

    int activeKeys() {
        return locks.size();
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }
}
