package tech.ledgerbridge.broker.lock;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tenant lock backed by one {@link ReentrantLock} per tenant in this JVM.
 *
 * <p>Entries are reference counted and dropped once no thread holds or waits on
 * them, so the table only grows with concurrent tenants.
 */
@ApplicationScoped
public class InProcessTenantLock implements TenantLock {

    private static final Logger LOG = Logger.getLogger(InProcessTenantLock.class);

    private final ConcurrentMap<String, LockEntry> locks = new ConcurrentHashMap<>();

    @Override
    public Optional<LockHandle> tryAcquire(String tenantId, Duration timeout) {
        LockEntry entry = locks.compute(tenantId, (key, existing) -> {
            LockEntry e = existing != null ? existing : new LockEntry();
            e.references++;
            return e;
        });

        boolean acquired = false;
        try {
            acquired = entry.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        if (!acquired) {
            dereference(tenantId);
            LOG.debugf("Failed to acquire tenant lock within %dms: %s", timeout.toMillis(), tenantId);
            return Optional.empty();
        }

        LOG.debugf("Acquired tenant lock: %s", tenantId);
        return Optional.of(new TenantLockHandle(tenantId, entry));
    }

    /**
     * Number of tenants with a holder or waiter.
     */
    int trackedTenants() {
        return locks.size();
    }

    private void dereference(String tenantId) {
        locks.computeIfPresent(tenantId, (key, e) -> --e.references == 0 ? null : e);
    }

    private static final class LockEntry {
        final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's compute on this key
        int references;
    }

    private class TenantLockHandle implements LockHandle {
        private final String tenantId;
        private final LockEntry entry;
        private final AtomicBoolean released = new AtomicBoolean(false);

        TenantLockHandle(String tenantId, LockEntry entry) {
            this.tenantId = tenantId;
            this.entry = entry;
        }

        @Override
        public void release() {
            if (released.compareAndSet(false, true)) {
                entry.lock.unlock();
                dereference(tenantId);
                LOG.debugf("Released tenant lock: %s", tenantId);
            }
        }
    }
}
