package com.obsinity.tracing.aspect;

import java.lang.reflect.Method;
import java.util.Optional;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

import com.obsinity.tracing.TracingEngine;
import com.obsinity.tracing.annotations.Traced;
import com.obsinity.tracing.configuration.TracingProperties;
import com.obsinity.tracing.proxy.TracingInvocation;
import com.obsinity.tracing.sink.MethodEmitters;
import com.obsinity.tracing.sink.Sink;

/**
 * Spring AOP aspect tracing beans (or single methods) annotated with {@link Traced} through the sink of the named
 * contract. Methods the contract does not declare, and {@code @NonEvent} ones, proceed untraced.
 *
 * <pre>{@code
 * @Service
 * @Traced(contract = OrderOperations.class)
 * class OrderService implements OrderOperations {
 *   public OrderId place(Cart cart) { ... }   // place, then place_Completed or place_Faulted
 * }
 * }</pre>
 */
@Aspect
@RequiredArgsConstructor
@Component
public class TracedAspect {

	private final TracingEngine engine;
	private final TracingInvocation invocation;
	private final TracingProperties properties;

	@Around(value = "execution(* *(..)) && @annotation(traced)", argNames = "joinPoint,traced")
	public Object interceptMethod(ProceedingJoinPoint joinPoint, Traced traced) throws Throwable { // NOSONAR
		return trace(joinPoint, traced);
	}

	@Around(value = "execution(* *(..)) && @within(traced) && !@annotation(com.obsinity.tracing.annotations.Traced)",
			argNames = "joinPoint,traced")
	public Object interceptType(ProceedingJoinPoint joinPoint, Traced traced) throws Throwable { // NOSONAR
		return trace(joinPoint, traced);
	}

	private Object trace(ProceedingJoinPoint joinPoint, Traced traced) throws Throwable { // NOSONAR
		if (!properties.isEnabled()) return joinPoint.proceed();

		final Sink sink = engine.getSink(traced.contract());
		final Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
		final Optional<MethodEmitters> emitters = emittersFor(sink, traced.contract(), method);
		if (emitters.isEmpty()) return joinPoint.proceed();

		return invocation.proceed(emitters.get(), joinPoint.getArgs(), joinPoint::proceed,
				traced.createCorrelationScope());
	}

	/** The contract's declaration of {@code method}: same name and parameter types. */
	private static Optional<MethodEmitters> emittersFor(Sink sink, Class<?> contract, Method method) {
		final Optional<MethodEmitters> direct = sink.emitters(method);
		if (direct.isPresent()) return direct;
		try {
			final Method declared = contract.getMethod(method.getName(), method.getParameterTypes());
			return sink.emitters(declared);
		} catch (NoSuchMethodException e) {
			return Optional.empty();
		}
	}
}
