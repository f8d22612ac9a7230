package com.obsinity.tracing.proxy;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

import com.obsinity.tracing.correlation.CorrelationScope;
import com.obsinity.tracing.correlation.CorrelationScopeManager;
import com.obsinity.tracing.sink.MethodEmitters;

/**
 * Traces one call of a real implementation: call event, the call itself, then the completion or fault event. Errors
 * of the real call are rethrown unchanged. Shared by JDK proxies and {@code @Traced} beans.
 */
@Component
@RequiredArgsConstructor
public class TracingInvocation {

	/** The traced call; {@code InvocationTargetException} must already be unwrapped. */
	@FunctionalInterface
	public interface Call {
		Object proceed() throws Throwable; // NOSONAR
	}

	private final CorrelationScopeManager correlation;

	public Object proceed(final MethodEmitters emitters, final Object[] args, final Call call,
			final boolean createCorrelationScope) throws Throwable { // NOSONAR
		final CorrelationScope scope = createCorrelationScope ? correlation.begin(true, null) : null;
		try {
			emitters.emitCall(args);

			final Object result;
			try {
				result = call.proceed();
			} catch (final Throwable t) {
				try {
					emitters.fault(t);
				} catch (final RuntimeException traceFailure) {
					t.addSuppressed(traceFailure);
				}
				throw t;
			}
			return emitters.complete(result);
		} finally {
			if (scope != null) scope.close();
		}
	}
}
