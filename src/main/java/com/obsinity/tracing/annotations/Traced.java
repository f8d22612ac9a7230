package com.obsinity.tracing.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Traces a Spring bean's methods (or a single method) through the sink of {@code contract}, the same way a proxy from
 * {@code TracingEngine.createProxy} would.
 *
 * <pre>{@code
 * @Service
 * @Traced(contract = OrderOperations.class)
 * class OrderService implements OrderOperations { ... }
 * }</pre>
 */
@Documented
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
public @interface Traced {

	Class<?> contract();

	/** Open (or reuse) a correlation scope around each call. */
	boolean createCorrelationScope() default true;
}
