package com.obsinity.tracing.model;

import java.util.List;
import java.util.UUID;

/**
 * One record handed to a sink backend. {@code fieldNames} and {@code payload} are parallel lists in emission order.
 */
public record EventRecord(
		Identity source,
		int eventId,
		String eventName,
		InvocationKind kind,
		EventLevel level,
		long keywords,
		int task,
		int opcode,
		int version,
		String message,
		List<String> fieldNames,
		List<Object> payload,
		UUID correlationId,
		UUID relatedCorrelationId) {

	/** Payload value for a field name (case-insensitive), or null. */
	public Object field(String name) {
		for (int i = 0; i < fieldNames.size(); i++) {
			if (fieldNames.get(i).equalsIgnoreCase(name)) return payload.get(i);
		}
		return null;
	}
}
