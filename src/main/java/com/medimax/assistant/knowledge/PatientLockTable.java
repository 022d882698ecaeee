package com.medimax.assistant.knowledge;

import com.medimax.assistant.config.GraphStoreConfig;
import com.medimax.assistant.exception.GraphTransactionException;
import com.medimax.assistant.exception.OrchestrationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One fair lock per patient ID. Graph writes for the same patient run one at
 * a time; different patients never wait on each other.
 *
 * <p>Locks are created on first use and kept for the life of the process.
 *
 * <p>A lock is released when the action returns or throws. A timed-out attempt
 * is cancelled by interrupting its worker thread, so an action blocked in a call
 * that ignores interrupts (a driver write waiting on the server, for one) keeps
 * the lock until that call returns. The {@code graph} retry policy's per-attempt
 * timeout bounds how long that can be; other writers for the same patient give
 * up after {@code app.graph.lock-timeout} with a retryable
 * {@link GraphTransactionException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PatientLockTable {

    private final ConcurrentMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final GraphStoreConfig config;

    /**
     * Runs {@code action} while holding the patient's lock.
     *
     * @throws GraphTransactionException if the lock is not acquired within {@code app.graph.lock-timeout}
     */
    public <T> T withLock(long patientId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(patientId, id -> new ReentrantLock(true));
        boolean acquired;
        try {
            acquired = lock.tryLock(config.getLockTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrchestrationException("Interrupted waiting for graph lock of patient " + patientId, e);
        }
        if (!acquired) {
            throw new GraphTransactionException("Timed out waiting for graph lock of patient " + patientId);
        }
        try {
            log.debug("Acquired graph lock for patient {}", patientId);
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked(long patientId) {
        ReentrantLock lock = locks.get(patientId);
        return lock != null && lock.isLocked();
    }
}
