package com.obsinity.tracing.mapping;

import java.lang.reflect.Type;

import com.obsinity.tracing.model.ParameterDescriptor;

/**
 * Where one value of an output field comes from: an argument position (or the context slot) plus an optional
 * conversion.
 *
 * @param alias key of this value inside a bundle
 * @param position argument index, or {@link #CONTEXT_SLOT}
 * @param parameter the parameter read; null for the context slot
 * @param converter conversion applied to the argument; null passes it unchanged
 */
public record SourceAccessor(String alias, int position, ParameterDescriptor parameter, ValueConverter converter) {

	public static final int CONTEXT_SLOT = -1;

	public Object read(final Object[] args) {
		final Object input = (position >= 0 && args != null && position < args.length) ? args[position] : null;
		return converter == null ? input : converter.convert(input);
	}

	public Class<?> valueType() {
		if (converter != null) return converter.outputType();
		return parameter != null ? parameter.type() : Object.class;
	}

	public Type genericValueType() {
		if (converter != null) return converter.genericOutputType();
		return parameter != null ? parameter.genericType() : Object.class;
	}

	public boolean isContext() {
		return position == CONTEXT_SLOT;
	}
}
