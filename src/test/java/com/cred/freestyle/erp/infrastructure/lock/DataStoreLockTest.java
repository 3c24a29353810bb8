package com.cred.freestyle.erp.infrastructure.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for DataStoreLock.
 */
@DisplayName("DataStoreLock Tests")
class DataStoreLockTest {

    private static final Duration SHORT = Duration.ofMillis(100);

    private final DataStoreLock lock = new DataStoreLock();

    @Test
    @DisplayName("Write held elsewhere: readers and writers time out")
    void writeHeld_OtherThreadsTimeOut() throws Exception {
        assertThat(lock.acquireWrite(SHORT)).isTrue();
        try {
            assertThat(lock.isWriteLocked()).isTrue();
            assertThat(CompletableFuture.supplyAsync(() -> lock.acquireRead(SHORT)).get(5, TimeUnit.SECONDS)).isFalse();
            assertThat(CompletableFuture.supplyAsync(() -> lock.acquireWrite(SHORT)).get(5, TimeUnit.SECONDS)).isFalse();
        } finally {
            lock.releaseWrite();
        }
        assertThat(lock.isWriteLocked()).isFalse();
    }

    @Test
    @DisplayName("Write holder can re-enter and take the read side")
    void writeHolder_Reenters() {
        assertThat(lock.acquireWrite(SHORT)).isTrue();
        assertThat(lock.acquireWrite(SHORT)).isTrue();
        assertThat(lock.acquireRead(SHORT)).isTrue();

        lock.releaseRead();
        lock.releaseWrite();
        lock.releaseWrite();

        assertThat(lock.isWriteLocked()).isFalse();
    }

    @Test
    @DisplayName("Readers share the lock")
    void readers_Share() throws Exception {
        assertThat(lock.acquireRead(SHORT)).isTrue();
        try {
            boolean otherReader = CompletableFuture.supplyAsync(() -> {
                boolean acquired = lock.acquireRead(SHORT);
                if (acquired) {
                    lock.releaseRead();
                }
                return acquired;
            }).get(5, TimeUnit.SECONDS);
            assertThat(otherReader).isTrue();
        } finally {
            lock.releaseRead();
        }
    }

    @Test
    @DisplayName("Interrupted waiter gives up and keeps its interrupt flag")
    void interruptedWaiter_ReturnsFalse() {
        Thread.currentThread().interrupt();
        try {
            assertThat(lock.acquireWrite(Duration.ofSeconds(5))).isFalse();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
