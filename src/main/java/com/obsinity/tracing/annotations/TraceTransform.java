package com.obsinity.tracing.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Passes the parameter through a public static, single-argument, non-void method before tracing it. The method's
 * parameter must accept the declared parameter type; this is checked when the sink is built.
 *
 * <pre>{@code
 * void signup(@TraceTransform(type = Masking.class, method = "maskEmail") String email);
 * }</pre>
 */
@Documented
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
public @interface TraceTransform {

	Class<?> type();

	String method();

	/** Output field name; defaults to the parameter name. */
	String as() default "";
}
