package com.obsinity.tracing.proxy;

import java.lang.reflect.Proxy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

import com.obsinity.tracing.sink.Sink;

/**
 * Wraps a real implementation in a JDK proxy that traces every call through a log contract's sink.
 *
 * <pre>{@code
 * OrderOperations traced = engine.createProxy(OrderOperations.class, new OrderService());
 * traced.place(cart);   // place, then place_Completed (or place_Faulted)
 * }</pre>
 */
@Component
@RequiredArgsConstructor
public class ProxyGenerator {

	private static final Logger log = LoggerFactory.getLogger(ProxyGenerator.class);

	private final TracingInvocation invocation;

	public <T> T createProxy(Class<T> executeContract, Sink logSink, T real, boolean createCorrelationScope) {
		if (executeContract == null || !executeContract.isInterface()) {
			throw new IllegalArgumentException("Proxies can only be created for interfaces: " + executeContract);
		}
		if (!executeContract.isInstance(real)) {
			throw new IllegalArgumentException(
					"Real object " + (real == null ? "null" : real.getClass().getName()) + " does not implement "
							+ executeContract.getName());
		}

		final ClassLoader loader = executeContract.getClassLoader() != null
				? executeContract.getClassLoader()
				: Thread.currentThread().getContextClassLoader();
		final Object proxy = Proxy.newProxyInstance(loader, new Class<?>[] {executeContract},
				new TracingProxyHandler(real, logSink, invocation, createCorrelationScope));
		log.debug("Created tracing proxy for {} logging to {}", executeContract.getName(), logSink.identity().name());
		return executeContract.cast(proxy);
	}
}
