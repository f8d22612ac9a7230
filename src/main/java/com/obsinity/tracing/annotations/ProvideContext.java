package com.obsinity.tracing.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import com.obsinity.tracing.model.InvocationKind;

/**
 * Controls whether the registered context provider contributes the trailing {@code Context} field. Method-level
 * beats contract-level; without the annotation context is provided for every kind.
 */
@Documented
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface ProvideContext {

	boolean value() default true;

	InvocationKind[] enabledFor() default {
		InvocationKind.METHOD_CALL,
		InvocationKind.METHOD_COMPLETION,
		InvocationKind.METHOD_FAULTED,
		InvocationKind.BUNDLE_PARAMETERS
	};
}
