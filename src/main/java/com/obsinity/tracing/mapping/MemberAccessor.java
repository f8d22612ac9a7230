package com.obsinity.tracing.mapping;

import java.lang.reflect.Field;
import java.lang.reflect.Member;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;

import org.springframework.util.ReflectionUtils;
import org.springframework.util.StringUtils;

import com.obsinity.tracing.exceptions.TracingConfigurationException;

/**
 * Reads a field, getter or record component chain such as {@code "address.city"}. Each segment is resolved against
 * the declared type when the accessor is built; a segment that does not exist is a configuration error. A null
 * anywhere along the chain yields null.
 */
public final class MemberAccessor implements ValueConverter {

	private final String path;
	private final List<Member> chain;
	private final Class<?> outputType;
	private final Type genericOutputType;

	public MemberAccessor(final Class<?> declaredType, final String path) {
		if (!StringUtils.hasText(path)) {
			throw new TracingConfigurationException(declaredType.getName(), "Empty member path on " + declaredType.getName());
		}
		this.path = path;
		this.chain = new ArrayList<>();
		Class<?> current = declaredType;
		Type currentGeneric = declaredType;
		for (String segment : path.split("\\.")) {
			final Member member = resolve(current, segment.trim());
			if (member == null) {
				throw new TracingConfigurationException(current.getName() + "." + segment,
						"No field or accessor '" + segment + "' on " + current.getName() + " (path '" + path + "')");
			}
			chain.add(member);
			if (member instanceof Field f) {
				current = f.getType();
				currentGeneric = f.getGenericType();
			} else {
				current = ((Method) member).getReturnType();
				currentGeneric = ((Method) member).getGenericReturnType();
			}
		}
		this.outputType = current;
		this.genericOutputType = currentGeneric;
	}

	/** Prefers accessors (getX, isX, x()) over fields. */
	private static Member resolve(final Class<?> type, final String name) {
		final String cap = StringUtils.capitalize(name);
		for (String candidate : new String[] {"get" + cap, "is" + cap, name}) {
			final Method m = ReflectionUtils.findMethod(type, candidate);
			if (m != null && m.getReturnType() != void.class && !Modifier.isStatic(m.getModifiers())) {
				ReflectionUtils.makeAccessible(m);
				return m;
			}
		}
		final Field f = ReflectionUtils.findField(type, name);
		if (f != null && !Modifier.isStatic(f.getModifiers())) {
			ReflectionUtils.makeAccessible(f);
			return f;
		}
		return null;
	}

	@Override
	public Object convert(final Object input) {
		Object value = input;
		for (Member member : chain) {
			if (value == null) return null;
			value = (member instanceof Field f)
					? ReflectionUtils.getField(f, value)
					: ReflectionUtils.invokeMethod((Method) member, value);
		}
		return value;
	}

	@Override
	public Class<?> outputType() {
		return outputType;
	}

	@Override
	public Type genericOutputType() {
		return genericOutputType;
	}

	@Override
	public String toString() {
		return "member(" + path + ")";
	}
}
