package com.obsinity.tracing.exceptions;

/** Base type for every error raised by the tracing engine itself. */
public class TracingException extends RuntimeException {

	public TracingException(String message) {
		super(message);
	}

	public TracingException(String message, Throwable cause) {
		super(message, cause);
	}
}
