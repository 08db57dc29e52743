package tech.ledgerbridge.broker.shared;

import jakarta.interceptor.InterceptorBinding;

import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds {@link InstrumentedInterceptor} to a durable store.
 *
 * <pre>
 * {@code @Instrumented(collection = "company_sessions")}
 * class PanacheCompanySessionRepository implements CompanySessionRepository { ... }
 * </pre>
 *
 * Publishes {@code ledgerbridge_store_calls_seconds} and {@code ledgerbridge_store_failures_total}.
 */
@Inherited
@InterceptorBinding
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface Instrumented {

    /**
     * Store name used as the {@code store} tag. Derived from the class name when empty.
     */
    String collection() default "";
}
