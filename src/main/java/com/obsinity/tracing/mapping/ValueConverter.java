package com.obsinity.tracing.mapping;

import java.lang.reflect.Type;

/**
 * Conversion step between a parameter value and its output field. The set is closed: member access
 * ({@link MemberAccessor}), static transform ({@link StaticTransform}), constant format ({@link FormatConverter}) and
 * context suppliers ({@link ContextSupplier}, {@link ProvidedContext}).
 */
public interface ValueConverter {

	Object convert(Object input);

	/** Type produced by {@link #convert}. */
	Class<?> outputType();

	default Type genericOutputType() {
		return outputType();
	}
}
