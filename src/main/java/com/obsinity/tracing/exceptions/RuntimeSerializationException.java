package com.obsinity.tracing.exceptions;

/** A user supplied accessor, transform, serializer or context provider failed while an event was being emitted. */
public final class RuntimeSerializationException extends TracingException {
	private final String field;

	public RuntimeSerializationException(String field, String message, Throwable cause) {
		super(message, cause);
		this.field = field;
	}

	/** Output field that was being produced. */
	public String field() {
		return field;
	}
}
