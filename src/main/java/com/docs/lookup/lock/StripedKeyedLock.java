package com.docs.lookup.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process {@link KeyedLock} backed by a fixed array of {@link ReentrantLock} stripes.
 * Different keys may share a stripe; the same key always maps to the same stripe.
 */
public class StripedKeyedLock implements KeyedLock {
    private static final Logger log = LoggerFactory.getLogger(StripedKeyedLock.class);

    private final ReentrantLock[] stripes;
    private final LockConfig config;

    public StripedKeyedLock() {
        this(LockConfig.defaults());
    }

    public StripedKeyedLock(LockConfig config) {
        this.config = config;
        this.stripes = new ReentrantLock[config.stripes()];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    @Override
    public void lock(String key) {
        ReentrantLock lock = stripeFor(key);
        try {
            if (!lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS)) {
                throw new LockAcquisitionException(
                        "Failed to acquire lock for key '" + key + "' within " + config.timeoutMs() + "ms");
            }
            log.trace("Lock acquired: {}", key);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while acquiring lock for key: " + key, e);
        }
    }

    @Override
    public void unlock(String key) {
        ReentrantLock lock = stripeFor(key);
        if (lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.trace("Lock released: {}", key);
        }
    }

    int stripeIndex(String key) {
        return Math.floorMod(key.hashCode(), stripes.length);
    }

    private ReentrantLock stripeFor(String key) {
        return stripes[stripeIndex(key)];
    }
}
