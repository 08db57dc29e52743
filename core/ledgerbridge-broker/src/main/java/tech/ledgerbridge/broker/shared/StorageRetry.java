package tech.ledgerbridge.broker.shared;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.persistence.PersistenceException;
import org.jboss.logging.Logger;
import tech.ledgerbridge.broker.BrokerConfig;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs durable-store calls with linear backoff on transient persistence failures.
 *
 * <p>Only {@link PersistenceException} is retried. Anything else, and the last
 * failure once attempts are exhausted, reaches the caller; the latter wrapped in
 * {@link StorageUnavailableException}.
 */
@Singleton
public class StorageRetry {

    private static final Logger LOG = Logger.getLogger(StorageRetry.class);

    private final int maxAttempts;
    private final Duration backoff;

    @Inject
    public StorageRetry(BrokerConfig config) {
        this(config.storage().retryAttempts(), config.storage().retryBackoff());
    }

    public StorageRetry(int maxAttempts, Duration backoff) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoff = backoff;
    }

    public <T> T call(String operation, Supplier<T> action) {
        PersistenceException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (PersistenceException e) {
                lastError = e;
                if (attempt == maxAttempts) {
                    break;
                }

                long delayMs = backoff.toMillis() * attempt;
                LOG.warnf("Storage operation [%s] attempt %d failed (%s), retrying in %dms",
                    operation, attempt, e.getMessage(), delayMs);
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new StorageUnavailableException(operation, attempt, ie);
                }
            }
        }

        LOG.errorf(lastError, "Storage operation [%s] failed after %d attempts", operation, maxAttempts);
        throw new StorageUnavailableException(operation, maxAttempts, lastError);
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }
}
