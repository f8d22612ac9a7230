package com.obsinity.tracing.model;

/**
 * Severity of a traced event. Lower values are more severe; {@link #LOG_ALWAYS} bypasses level filtering.
 *
 * <p>{@link #INHERIT} is only meaningful as an annotation default: it means "take the level from the enclosing
 * declaration" and never reaches a sink backend.
 */
public enum EventLevel {
	INHERIT(-1),
	LOG_ALWAYS(0),
	CRITICAL(1),
	ERROR(2),
	WARNING(3),
	INFORMATIONAL(4),
	VERBOSE(5);

	private final int value;

	EventLevel(int value) {
		this.value = value;
	}

	public int value() {
		return value;
	}

	/** @return true if an event at this level passes a backend configured with {@code threshold}. */
	public boolean isEnabledAt(EventLevel threshold) {
		if (this == LOG_ALWAYS) return true;
		if (threshold == null || this == INHERIT) return false;
		return value <= threshold.value;
	}
}
