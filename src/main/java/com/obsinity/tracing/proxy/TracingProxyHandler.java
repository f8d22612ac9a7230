package com.obsinity.tracing.proxy;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.obsinity.tracing.sink.MethodEmitters;
import com.obsinity.tracing.sink.Sink;

/** Routes calls on a tracing proxy through {@link TracingInvocation}, or straight to the real object. */
final class TracingProxyHandler implements InvocationHandler {

	private final Object real;
	private final Sink logSink;
	private final TracingInvocation invocation;
	private final boolean createCorrelationScope;
	private final Map<Method, Optional<MethodEmitters>> resolved = new ConcurrentHashMap<>();

	TracingProxyHandler(Object real, Sink logSink, TracingInvocation invocation, boolean createCorrelationScope) {
		this.real = real;
		this.logSink = logSink;
		this.invocation = invocation;
		this.createCorrelationScope = createCorrelationScope;
	}

	@Override
	public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
		if (method.getDeclaringClass() == Object.class) {
			return switch (method.getName()) {
				case "equals" -> proxy == args[0];
				case "hashCode" -> System.identityHashCode(proxy);
				default -> invokeReal(method, args);
			};
		}

		final Optional<MethodEmitters> emitters =
				resolved.computeIfAbsent(method, m -> LogMethodResolver.resolve(logSink, m));
		if (emitters.isEmpty()) return invokeReal(method, args);

		return invocation.proceed(emitters.get(), args, () -> invokeReal(method, args), createCorrelationScope);
	}

	private Object invokeReal(Method method, Object[] args) throws Throwable {
		try {
			return method.invoke(real, args);
		} catch (InvocationTargetException e) {
			throw e.getTargetException();
		}
	}

	@Override
	public String toString() {
		return "TracingProxy[" + logSink.identity().name() + " -> " + real + "]";
	}
}
