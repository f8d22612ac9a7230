package com.obsinity.tracing.mapping;

import java.util.function.Function;

import org.springframework.util.ClassUtils;

import com.obsinity.tracing.model.ParameterDescriptor;

/**
 * One entry of a rule: which parameter slot it matches and how the matched value is converted.
 *
 * <p>A value with neither name nor type matches only the trailing context slot. Otherwise it matches declared
 * parameters by name (case-insensitive) and/or type (same type or subtype).
 */
final class RuleValue {

	private final String parameterName;
	private final Class<?> parameterType;
	private final Function<Class<?>, ValueConverter> converterFactory;
	private final boolean ignore;
	private String alias;

	RuleValue(String parameterName, String alias, Class<?> parameterType,
			Function<Class<?>, ValueConverter> converterFactory, boolean ignore) {
		this.parameterName = parameterName;
		this.alias = alias;
		this.parameterType = parameterType;
		this.converterFactory = converterFactory;
		this.ignore = ignore;
	}

	boolean matches(ParameterDescriptor parameter) {
		if (parameterName == null && parameterType == null) return parameter == null;
		if (parameter == null) return false;
		final boolean nameOk = parameterName == null || parameterName.equalsIgnoreCase(parameter.name());
		final boolean typeOk = parameterType == null
				|| ClassUtils.resolvePrimitiveIfNecessary(parameterType)
						.isAssignableFrom(ClassUtils.resolvePrimitiveIfNecessary(parameter.type()));
		return nameOk && typeOk;
	}

	/** Binds the conversion to the matched slot's declared type; may raise a configuration error. */
	ValueConverter converterFor(Class<?> slotType) {
		return converterFactory == null ? null : converterFactory.apply(slotType);
	}

	boolean ignore() {
		return ignore;
	}

	String alias() {
		return alias;
	}

	void alias(String value) {
		this.alias = value;
	}
}
