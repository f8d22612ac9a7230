package com.obsinity.tracing.model;

import java.lang.reflect.Method;

/**
 * What is being traced when a context provider or serializer is asked for a value.
 *
 * @param contract the contract type the sink was built for
 * @param method the contract method the event originates from
 * @param eventName the synthesized event name (overload and complement suffixes included)
 * @param kind call, completion, fault or bundle serialization
 */
public record InvocationContext(Class<?> contract, Method method, String eventName, InvocationKind kind) {

	public InvocationContext withKind(InvocationKind other) {
		return new InvocationContext(contract, method, eventName, other);
	}
}
