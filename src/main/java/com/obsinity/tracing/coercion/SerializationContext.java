package com.obsinity.tracing.coercion;

import com.obsinity.tracing.model.EventLevel;
import com.obsinity.tracing.model.InvocationContext;

/**
 * What a serializer is asked to encode.
 *
 * @param invocation the event being emitted ({@code BUNDLE_PARAMETERS} when the value is a bundle map)
 * @param fieldName output field name
 * @param valueType declared type of the value
 * @param declaredLevel level from {@code @TraceSerialization}, or null when nothing was declared
 */
public record SerializationContext(
		InvocationContext invocation, String fieldName, Class<?> valueType, EventLevel declaredLevel) {}
