package com.obsinity.tracing.exceptions;

/**
 * The sink backend rejected a record. Only surfaces to callers of contracts declared with
 * {@code @TraceContract(throwOnWriteError = true)}; otherwise it is logged and dropped.
 */
public final class SinkWriteException extends TracingException {
	private final int eventId;

	public SinkWriteException(int eventId, String message, Throwable cause) {
		super(message, cause);
		this.eventId = eventId;
	}

	public int eventId() {
		return eventId;
	}
}
