package com.obsinity.tracing.exceptions;

import java.util.UUID;

/** A correlation scope was closed while it was not the innermost live scope of its flow. */
public final class CorrelationConsistencyException extends TracingException {
	private final UUID scopeId;

	public CorrelationConsistencyException(UUID scopeId, String message) {
		super(message);
		this.scopeId = scopeId;
	}

	public UUID scopeId() {
		return scopeId;
	}
}
