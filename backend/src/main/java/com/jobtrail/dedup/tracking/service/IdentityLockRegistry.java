package com.jobtrail.dedup.tracking.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded set of striped locks keyed by identity string. Two keys may share a stripe,
 * which only costs throughput; the same key always maps to the same stripe.
 */
@Component
public class IdentityLockRegistry {
    private static final int STRIPES = 256;

    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];

    public IdentityLockRegistry() {
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    /**
     * @return the held lock, or null when it could not be acquired within {@code waitMillis}
     */
    public ReentrantLock tryAcquire(String key, long waitMillis) throws InterruptedException {
        ReentrantLock lock = lockFor(key);
        return lock.tryLock(waitMillis, TimeUnit.MILLISECONDS) ? lock : null;
    }

    ReentrantLock lockFor(String key) {
        int hash = key == null ? 0 : key.hashCode();
        hash ^= (hash >>> 16);
        return locks[Math.floorMod(hash, STRIPES)];
    }
}
