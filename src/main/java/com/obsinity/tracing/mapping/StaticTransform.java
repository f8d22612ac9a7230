package com.obsinity.tracing.mapping;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;

import org.springframework.util.ClassUtils;
import org.springframework.util.ReflectionUtils;

import com.obsinity.tracing.exceptions.TracingConfigurationException;

/**
 * Applies a public static method with exactly one parameter and a non-void result. The parameter must accept the
 * declared source type.
 */
public final class StaticTransform implements ValueConverter {

	private final Method method;

	public StaticTransform(final Class<?> sourceType, final Class<?> holder, final String methodName) {
		final String key = holder.getName() + "#" + methodName;
		final List<Method> candidates = Arrays.stream(holder.getMethods())
				.filter(m -> m.getName().equals(methodName))
				.filter(m -> Modifier.isStatic(m.getModifiers()))
				.filter(m -> m.getParameterCount() == 1)
				.toList();
		if (candidates.isEmpty()) {
			throw new TracingConfigurationException(key,
					"Transform " + key + " must be a public static method with one parameter");
		}
		final Method match = candidates.stream()
				.filter(m -> ClassUtils.isAssignable(m.getParameterTypes()[0], sourceType))
				.findFirst()
				.orElseThrow(() -> new TracingConfigurationException(key,
						"Transform " + key + " does not accept values of type " + sourceType.getName()));
		if (match.getReturnType() == void.class) {
			throw new TracingConfigurationException(key, "Transform " + key + " must return a value");
		}
		ReflectionUtils.makeAccessible(match);
		this.method = match;
	}

	@Override
	public Object convert(final Object input) {
		if (input == null && method.getParameterTypes()[0].isPrimitive()) return null;
		return ReflectionUtils.invokeMethod(method, null, input);
	}

	@Override
	public Class<?> outputType() {
		return method.getReturnType();
	}

	@Override
	public java.lang.reflect.Type genericOutputType() {
		return method.getGenericReturnType();
	}

	@Override
	public String toString() {
		return "transform(" + method.getDeclaringClass().getSimpleName() + "." + method.getName() + ")";
	}
}
