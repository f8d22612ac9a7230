package com.obsinity.tracing.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import com.obsinity.tracing.model.EventLevel;

/**
 * Declares contract-wide tracing settings on an interface whose methods are traced operations.
 *
 * <p>The annotation is optional: any interface can be used as a contract, in which case every default below applies.
 *
 * <pre>{@code
 * @TraceContract(name = "Checkout", level = EventLevel.INFORMATIONAL)
 * public interface CheckoutEvents {
 *     void cartPriced(String cartId, long totalCents);
 *
 *     @TraceEvent(id = 10, level = EventLevel.ERROR)
 *     void paymentDeclined(String cartId, String reason);
 * }
 * }</pre>
 */
@Documented
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface TraceContract {

	/** Display name of the event source. Defaults to the interface's simple name. */
	String name() default "";

	/** Stable identifier as a UUID string. Defaults to an id derived from {@link #name()}. */
	String id() default "";

	/** Default level for methods that do not declare one. */
	EventLevel level() default EventLevel.INHERIT;

	/** Default keyword bits for methods that do not declare any. */
	long keywords() default 0;

	/** Default event version. */
	int version() default 0;

	/**
	 * Class holding {@code public static final long} keyword constants. When set, keywords are not auto-generated;
	 * methods without explicit keywords take the constant named after the method, if any.
	 */
	Class<?> keywordTable() default void.class;

	/** Class holding {@code public static final int} task constants. */
	Class<?> taskTable() default void.class;

	/** Class holding {@code public static final int} opcode constants. */
	Class<?> opcodeTable() default void.class;

	/** Assign one keyword bit per (folded) method name when no keyword table is given. */
	boolean autoKeywords() default true;

	/** Rethrow backend write failures to the caller instead of logging and dropping them. */
	boolean throwOnWriteError() default false;

	/** Generate {@code _Completed} and {@code _Faulted} events for every method. */
	boolean implementComplementMethods() default true;
}
