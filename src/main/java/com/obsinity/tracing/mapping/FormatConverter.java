package com.obsinity.tracing.mapping;

import java.util.IllegalFormatException;

import com.obsinity.tracing.exceptions.TracingConfigurationException;

/** {@link String#format} with a constant pattern and the value as its single argument. */
public final class FormatConverter implements ValueConverter {

	private final String pattern;
	private final ValueConverter before;

	public FormatConverter(final String pattern) {
		this(pattern, null);
	}

	/** Formats the output of {@code before} (e.g. a member) instead of the raw value. */
	public FormatConverter(final String pattern, final ValueConverter before) {
		try {
			String.format(pattern, (Object) null);
		} catch (IllegalFormatException e) {
			throw new TracingConfigurationException(pattern, "Invalid format pattern '" + pattern + "'", e);
		}
		this.pattern = pattern;
		this.before = before;
	}

	@Override
	public Object convert(final Object input) {
		final Object value = (before == null) ? input : before.convert(input);
		return String.format(pattern, value);
	}

	@Override
	public Class<?> outputType() {
		return String.class;
	}

	@Override
	public String toString() {
		return "format(" + pattern + ")";
	}
}
