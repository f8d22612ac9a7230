package com.obsinity.tracing.coercion;

import com.obsinity.tracing.model.EventLevel;

/** Writes {@code toString()} of the value, at any level. */
public class ToStringTraceSerializer extends TraceSerializer {

	public ToStringTraceSerializer() {
		super(EventLevel.LOG_ALWAYS);
	}

	@Override
	public String serialize(Object value, SerializationContext context) {
		return value == null ? null : value.toString();
	}
}
