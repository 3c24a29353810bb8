package com.cred.freestyle.erp.infrastructure.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * System-wide serialization point for the archive store and the live data directory.
 *
 * Lock Pattern:
 * - Write side: any operation that mutates the store or the live data (create, delete,
 *   retention cleanup, restore). Exclusive with everything else.
 * - Read side: verification and download lookups. Shared between readers.
 * - Both sides are reentrant, and the write holder may take the read side
 *   (restore verifies and takes its safety backup while holding the write lock).
 * - Acquisition is bounded; callers treat a timeout as "busy" instead of blocking forever.
 *
 * Usage:
 * if (dataStoreLock.acquireWrite(timeout)) {
 *     try {
 *         // mutate the store
 *     } finally {
 *         dataStoreLock.releaseWrite();
 *     }
 * }
 *
 * @author ERP Platform Team
 */
@Component
public class DataStoreLock {

    private static final Logger logger = LoggerFactory.getLogger(DataStoreLock.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    /**
     * Attempt to acquire exclusive access.
     *
     * @param timeout Maximum time to wait
     * @return true if acquired, false on timeout or interruption
     */
    public boolean acquireWrite(Duration timeout) {
        try {
            boolean acquired = lock.writeLock().tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (acquired) {
                logger.debug("Acquired data store write lock (hold count: {})", lock.getWriteHoldCount());
            } else {
                logger.warn("Timed out after {} waiting for data store write lock", timeout);
            }
            return acquired;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for data store write lock");
            return false;
        }
    }

    public void releaseWrite() {
        lock.writeLock().unlock();
        logger.debug("Released data store write lock");
    }

    /**
     * Attempt to acquire shared access.
     *
     * @param timeout Maximum time to wait
     * @return true if acquired, false on timeout or interruption
     */
    public boolean acquireRead(Duration timeout) {
        try {
            boolean acquired = lock.readLock().tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                logger.warn("Timed out after {} waiting for data store read lock", timeout);
            }
            return acquired;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for data store read lock");
            return false;
        }
    }

    public void releaseRead() {
        lock.readLock().unlock();
    }

    /**
     * @return true while any thread holds exclusive access
     */
    public boolean isWriteLocked() {
        return lock.isWriteLocked();
    }
}
