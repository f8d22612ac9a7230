package com.obsinity.tracing.proxy;

import java.lang.reflect.Array;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.util.Optional;

import com.obsinity.tracing.sink.MethodEmitters;
import com.obsinity.tracing.sink.Sink;

/**
 * Implements a contract by emitting: each event method writes its call event. Non-event default methods run their
 * body; anything else returns the return type's default value.
 */
public final class LoggerInvocationHandler implements InvocationHandler {

	private final Sink sink;

	public LoggerInvocationHandler(Sink sink) {
		this.sink = sink;
	}

	@Override
	public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
		if (method.getDeclaringClass() == Object.class) {
			return switch (method.getName()) {
				case "equals" -> proxy == args[0];
				case "hashCode" -> System.identityHashCode(proxy);
				default -> "Logger[" + sink.identity().name() + "]";
			};
		}

		final Optional<MethodEmitters> emitters = sink.emitters(method);
		if (emitters.isPresent()) {
			emitters.get().emitCall(args);
		} else if (method.isDefault()) {
			return InvocationHandler.invokeDefault(proxy, method, args);
		}
		return defaultValue(method.getReturnType());
	}

	private static Object defaultValue(Class<?> type) {
		if (!type.isPrimitive() || type == void.class) return null;
		return Array.get(Array.newInstance(type, 1), 0);
	}
}
