package com.obsinity.tracing.coercion;

import com.obsinity.tracing.model.EventLevel;

/**
 * Turns values that a sink backend cannot carry natively into text.
 *
 * <p>Each serializer has a default minimum level; {@code @TraceSerialization} overrides it per parameter, type, method
 * or contract. A {@code null} level means the serializer is never invoked and the field is emitted as {@code null}.
 */
public abstract class TraceSerializer {

	private final EventLevel defaultLevel;

	protected TraceSerializer(EventLevel defaultLevel) {
		this.defaultLevel = defaultLevel;
	}

	/** @return the serialized form; may be null */
	public abstract String serialize(Object value, SerializationContext context);

	/** Minimum backend level required before {@link #serialize} may run for the given field. */
	public EventLevel getEffectiveLevel(SerializationContext context) {
		return context.declaredLevel() != null ? context.declaredLevel() : defaultLevel;
	}

	public EventLevel getDefaultLevel() {
		return defaultLevel;
	}
}
