package com.obsinity.tracing.coercion;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import com.obsinity.tracing.annotations.TraceSerialization;
import com.obsinity.tracing.exceptions.RuntimeSerializationException;
import com.obsinity.tracing.mapping.ParameterMapping;
import com.obsinity.tracing.mapping.SourceAccessor;
import com.obsinity.tracing.model.EventLevel;
import com.obsinity.tracing.model.InvocationKind;
import com.obsinity.tracing.model.MethodDescriptor;
import com.obsinity.tracing.model.ParameterDescriptor;
import com.obsinity.tracing.sink.SinkBackend;

/**
 * Decides, per output field, whether a value reaches the backend as-is, unwrapped, as {@code toString()}, or through
 * the {@link TraceSerializer}.
 */
@Component
public class TypeCoercionResolver {

	private static final Set<Class<?>> NATIVE = Set.of(
			String.class,
			Byte.class,
			Short.class,
			Integer.class,
			Long.class,
			Float.class,
			Double.class,
			Boolean.class,
			UUID.class);

	/** Whether a backend carries values of {@code type} without conversion. */
	public boolean isNative(Class<?> type) {
		if (type == null) return false;
		final Class<?> boxed = ClassUtils.resolvePrimitiveIfNecessary(type);
		return NATIVE.contains(boxed) || boxed.isEnum();
	}

	public CoercionDecision resolve(MethodDescriptor method, ParameterMapping mapping, TraceSerializer serializer) {
		if (mapping.isBundle()) {
			final SerializationContext ctx = new SerializationContext(
					method.invocationContext().withKind(InvocationKind.BUNDLE_PARAMETERS),
					mapping.name(),
					Map.class,
					declaredLevel(method, null, null));
			return CoercionDecision.serialize(ctx, serializer.getEffectiveLevel(ctx));
		}

		final SourceAccessor source = mapping.sources().get(0);
		final Class<?> type = source.valueType();

		if (isNative(type)) return CoercionDecision.nativeValue(type);
		if (type == char.class || type == Character.class) return CoercionDecision.stringify();

		final Class<?> referent = referentOf(type, source.genericValueType());
		if (referent != null) return CoercionDecision.dereference(referent);

		final ParameterDescriptor parameter = source.parameter();
		final SerializationContext ctx = new SerializationContext(
				method.invocationContext(), mapping.name(), type, declaredLevel(method, parameter, type));
		return CoercionDecision.serialize(ctx, serializer.getEffectiveLevel(ctx));
	}

	/**
	 * Whether a serializer gated at {@code level} may run now. Checked before any source is read, so a disabled level
	 * costs no reflection and no serialization.
	 */
	public boolean shouldSerialize(EventLevel level, SinkBackend backend) {
		if (level == null) return false;
		if (level == EventLevel.LOG_ALWAYS) return true;
		return backend.isEnabled(level, SinkBackend.ALL_KEYWORDS);
	}

	/** Applies a decision to a value already read from its sources. */
	public Object coerce(Object value, CoercionDecision decision, TraceSerializer serializer) {
		switch (decision.kind()) {
			case NATIVE:
				return value;
			case DEREFERENCE:
				return dereference(value);
			case STRINGIFY:
				return value == null ? null : value.toString();
			case SERIALIZE:
			default:
				final SerializationContext ctx = decision.serializationContext();
				try {
					return serializer.serialize(value, ctx);
				} catch (RuntimeException e) {
					throw new RuntimeSerializationException(
							ctx.fieldName(), "Failed to serialize field '" + ctx.fieldName() + "'", e);
				}
		}
	}

	/* --------------------- helpers --------------------- */

	private Class<?> referentOf(Class<?> type, Type genericType) {
		if (type == AtomicInteger.class) return Integer.class;
		if (type == AtomicLong.class) return Long.class;
		if (type == AtomicBoolean.class) return Boolean.class;
		if (type == Optional.class || type == AtomicReference.class) {
			if (genericType instanceof ParameterizedType pt
					&& pt.getActualTypeArguments()[0] instanceof Class<?> arg
					&& isNative(arg)) {
				return arg;
			}
		}
		return null;
	}

	private static Object dereference(Object value) {
		if (value == null) return null;
		if (value instanceof Optional<?> o) return o.orElse(null);
		if (value instanceof AtomicReference<?> r) return r.get();
		if (value instanceof AtomicInteger i) return i.get();
		if (value instanceof AtomicLong l) return l.get();
		if (value instanceof AtomicBoolean b) return b.get();
		return value;
	}

	/** Parameter, then the value's type, then method, then contract; null when nothing is declared. */
	private static EventLevel declaredLevel(MethodDescriptor method, ParameterDescriptor parameter, Class<?> type) {
		TraceSerialization found = parameter == null ? null : parameter.annotation(TraceSerialization.class);
		if (found == null && type != null) {
			found = AnnotatedElementUtils.findMergedAnnotation(type, TraceSerialization.class);
		}
		if (found == null) found = AnnotatedElementUtils.findMergedAnnotation(method.method(), TraceSerialization.class);
		if (found == null) found = AnnotatedElementUtils.findMergedAnnotation(method.contract(), TraceSerialization.class);
		return (found == null || found.value() == EventLevel.INHERIT) ? null : found.value();
	}
}
