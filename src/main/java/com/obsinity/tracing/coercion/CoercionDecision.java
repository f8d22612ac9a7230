package com.obsinity.tracing.coercion;

import com.obsinity.tracing.model.EventLevel;

/**
 * How one output field reaches the backend.
 *
 * @param kind pass through, unwrap, stringify or serialize
 * @param targetType type the backend receives
 * @param serializationContext context handed to the serializer; null unless {@code kind == SERIALIZE}
 * @param serializationLevel minimum backend level for the serializer to run; null means never
 */
public record CoercionDecision(
		Kind kind, Class<?> targetType, SerializationContext serializationContext, EventLevel serializationLevel) {

	public enum Kind {
		/** Whitelisted type, passed unchanged. */
		NATIVE,
		/** Holder (Optional, AtomicReference, atomics) of a whitelisted type, unwrapped. */
		DEREFERENCE,
		/** Scalar outside the whitelist, passed as {@code toString()}. */
		STRINGIFY,
		/** Anything else, including bundles, passed through the serializer. */
		SERIALIZE
	}

	public static CoercionDecision nativeValue(Class<?> type) {
		return new CoercionDecision(Kind.NATIVE, type, null, null);
	}

	public static CoercionDecision dereference(Class<?> referent) {
		return new CoercionDecision(Kind.DEREFERENCE, referent, null, null);
	}

	public static CoercionDecision stringify() {
		return new CoercionDecision(Kind.STRINGIFY, String.class, null, null);
	}

	public static CoercionDecision serialize(SerializationContext context, EventLevel level) {
		return new CoercionDecision(Kind.SERIALIZE, String.class, context, level);
	}

	public boolean serialized() {
		return kind == Kind.SERIALIZE;
	}
}
