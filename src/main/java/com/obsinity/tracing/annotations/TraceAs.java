package com.obsinity.tracing.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import org.springframework.core.annotation.AliasFor;

/**
 * Renames a parameter's output field, optionally formatting it.
 *
 * <p>On a method, the name becomes the default field name for every parameter of that method, so all parameters are
 * bundled into a single serialized map:
 *
 * <pre>{@code
 * @TraceAs("data")
 * void login(String user, String realm);   // one field: data = {"user":"..","realm":".."}
 * }</pre>
 */
@Documented
@Target({ElementType.PARAMETER, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
public @interface TraceAs {

	@AliasFor("name")
	String value() default "";

	@AliasFor("value")
	String name() default "";

	/** {@link String#format} pattern applied to the value; blank means no formatting. */
	String format() default "";
}
