package com.obsinity.tracing.model;

import java.lang.reflect.Method;
import java.util.List;

/**
 * Normalized view of one event: a contract method's call event, or the completion/fault complement generated for it.
 *
 * <p>Ids and keyword bits are filled in by the identifier allocator; until then {@code eventId} is the explicit id or
 * {@code 0}.
 *
 * @param contract contract the event belongs to
 * @param method the contract method (for complements, the method they complement)
 * @param name declared method name
 * @param eventName synthesized name: overload index and complement suffix applied
 * @param kind call, completion or fault
 * @param parameters the event's parameters in order
 * @param returnType declared return type of {@code method}
 * @param valueType the settled value type; equals {@code returnType} unless the method returns a deferred result
 * @param deferred whether {@code method} returns a {@link java.util.concurrent.CompletionStage}
 * @param generated whether this event was synthesized rather than declared on the contract
 */
public record MethodDescriptor(
		Class<?> contract,
		Method method,
		String name,
		String eventName,
		InvocationKind kind,
		List<ParameterDescriptor> parameters,
		Class<?> returnType,
		Class<?> valueType,
		boolean deferred,
		int eventId,
		EventLevel level,
		long keywords,
		int task,
		int opcode,
		int version,
		String message,
		boolean generated) {

	public MethodDescriptor {
		parameters = List.copyOf(parameters);
	}

	public MethodDescriptor withEventId(int id) {
		return new MethodDescriptor(contract, method, name, eventName, kind, parameters, returnType, valueType,
				deferred, id, level, keywords, task, opcode, version, message, generated);
	}

	public MethodDescriptor withKeywords(long bits) {
		return new MethodDescriptor(contract, method, name, eventName, kind, parameters, returnType, valueType,
				deferred, eventId, level, bits, task, opcode, version, message, generated);
	}

	public InvocationContext invocationContext() {
		return new InvocationContext(contract, method, eventName, kind);
	}

	public boolean returnsVoid() {
		return valueType == void.class || valueType == Void.class;
	}
}
