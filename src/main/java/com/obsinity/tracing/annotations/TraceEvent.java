package com.obsinity.tracing.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import com.obsinity.tracing.model.EventLevel;

/**
 * Per-method event metadata. Unset attributes fall back to {@link TraceContract}, then to engine defaults
 * (informational level, no keywords).
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface TraceEvent {

	/** Explicit positive event id; {@code 0} lets the allocator assign one. */
	int id() default 0;

	EventLevel level() default EventLevel.INHERIT;

	long keywords() default 0;

	int task() default 0;

	int opcode() default 0;

	int version() default 0;

	/** Message template attached to every record of this event. */
	String message() default "";
}
