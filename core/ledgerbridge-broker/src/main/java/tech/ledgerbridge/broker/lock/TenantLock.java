package tech.ledgerbridge.broker.lock;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Mutual exclusion keyed by tenant id.
 *
 * <p>Serializes everything that reads-then-writes a tenant's provider credentials:
 * first-connection creation, session fan-out, token refresh and disconnect.
 * Distinct tenants never contend with each other.
 *
 * <p>Handles must be released on the thread that acquired them; use
 * try-with-resources:
 * <pre>
 * try (TenantLock.LockHandle ignored = tenantLock.acquire(tenantId, timeout)) {
 *     ...
 * }
 * </pre>
 */
public interface TenantLock {

    /**
     * Try to acquire the lock for a tenant.
     *
     * @param tenantId Tenant whose credentials are about to change
     * @param timeout Maximum time to wait for the lock
     * @return A lock handle if acquired, empty on timeout or interruption
     */
    Optional<LockHandle> tryAcquire(String tenantId, Duration timeout);

    /**
     * Acquire the lock for a tenant or fail.
     *
     * @throws LockTimeoutException if the lock is not obtained within the timeout
     */
    default LockHandle acquire(String tenantId, Duration timeout) {
        return tryAcquire(tenantId, timeout)
            .orElseThrow(() -> new LockTimeoutException(tenantId, timeout));
    }

    /**
     * Execute a task while holding a tenant's lock.
     *
     * @return The task result if the lock was acquired, empty otherwise
     */
    default <T> Optional<T> withLock(String tenantId, Duration timeout, Supplier<T> task) {
        return tryAcquire(tenantId, timeout).map(handle -> {
            try {
                return task.get();
            } finally {
                handle.release();
            }
        });
    }

    /**
     * Handle to a held lock that can be released.
     */
    interface LockHandle extends AutoCloseable {
        /**
         * Release the lock. Releasing twice is a no-op.
         */
        void release();

        @Override
        default void close() {
            release();
        }
    }
}
