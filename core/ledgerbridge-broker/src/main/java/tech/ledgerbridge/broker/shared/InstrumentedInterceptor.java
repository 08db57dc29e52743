package tech.ledgerbridge.broker.shared;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.interceptor.AroundInvoke;
import jakarta.interceptor.Interceptor;
import jakarta.interceptor.InvocationContext;
import jakarta.persistence.EntityExistsException;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.QueryTimeoutException;
import org.hibernate.exception.ConstraintViolationException;
import org.hibernate.exception.JDBCConnectionException;
import org.jboss.logging.Logger;

import java.time.Duration;

/**
 * Times every call on an {@link Instrumented} durable store and counts failures by kind.
 *
 * Calls slower than {@link #SLOW_CALL} are logged at WARN.
 */
@Instrumented
@Interceptor
@Priority(Interceptor.Priority.APPLICATION)
public class InstrumentedInterceptor {

    private static final Logger LOG = Logger.getLogger(InstrumentedInterceptor.class);
    static final Duration SLOW_CALL = Duration.ofMillis(100);

    @Inject
    MeterRegistry registry;

    @AroundInvoke
    public Object instrument(InvocationContext ctx) throws Exception {
        String store = storeName(ctx);
        String operation = ctx.getMethod().getName();
        Timer.Sample sample = Timer.start(registry);
        String outcome = "success";

        try {
            return ctx.proceed();
        } catch (Exception e) {
            outcome = "failure";
            registry.counter("ledgerbridge.store.failures",
                Tags.of("store", store, "operation", operation, "kind", failureKind(e))).increment();
            throw e;
        } finally {
            long nanos = sample.stop(registry.timer("ledgerbridge.store.calls",
                Tags.of("store", store, "operation", operation, "outcome", outcome)));
            if (nanos > SLOW_CALL.toNanos()) {
                LOG.warnf("Slow %s.%s: %dms", store, operation, nanos / 1_000_000);
            }
        }
    }

    static String storeName(InvocationContext ctx) {
        Instrumented onMethod = ctx.getMethod().getAnnotation(Instrumented.class);
        if (onMethod != null && !onMethod.collection().isEmpty()) {
            return onMethod.collection();
        }
        // the bean instance is a generated subclass
        for (Class<?> type = ctx.getTarget().getClass(); type != null; type = type.getSuperclass()) {
            Instrumented onType = type.getAnnotation(Instrumented.class);
            if (onType != null) {
                return onType.collection().isEmpty() ? tableName(type.getSimpleName()) : onType.collection();
            }
        }
        return tableName(ctx.getTarget().getClass().getSimpleName());
    }

    /**
     * {@code PanacheBrokerTokenRepository} becomes {@code broker_tokens}.
     */
    static String tableName(String className) {
        int proxySuffix = className.indexOf('_');
        String base = (proxySuffix > 0 ? className.substring(0, proxySuffix) : className)
            .replaceFirst("^Panache", "")
            .replaceFirst("Repository$", "");
        return base.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase() + "s";
    }

    static String failureKind(Exception e) {
        if (e instanceof EntityExistsException || e.getCause() instanceof ConstraintViolationException
                || e instanceof ConstraintViolationException) {
            return "constraint";
        }
        if (e instanceof QueryTimeoutException || e instanceof jakarta.persistence.LockTimeoutException) {
            return "timeout";
        }
        if (e instanceof JDBCConnectionException || e.getCause() instanceof JDBCConnectionException) {
            return "connection";
        }
        if (e instanceof PersistenceException) {
            return "persistence";
        }
        return "other";
    }
}
