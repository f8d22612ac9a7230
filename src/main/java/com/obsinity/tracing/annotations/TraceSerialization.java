package com.obsinity.tracing.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import com.obsinity.tracing.model.EventLevel;

/**
 * Minimum level the backend must be enabled at before a non-native value is serialized. Below it the field is
 * emitted as {@code null} and the serializer is not called.
 *
 * <p>Precedence: parameter, then the parameter's type, then method, then contract, then the serializer's default.
 */
@Documented
@Target({ElementType.PARAMETER, ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface TraceSerialization {
	EventLevel value();
}
