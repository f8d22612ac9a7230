package com.obsinity.tracing.context;

import java.util.HashMap;
import java.util.Map;

/**
 * Flow-local key/value bag for values that rules pull into records with {@code addContextData(alias, key)}.
 *
 * <p>Frames nest: {@link #begin()} opens a child frame, {@link #set} writes to the innermost one and {@link #get}
 * searches outwards.
 *
 * <pre>{@code
 * try (TraceContext.Frame frame = TraceContext.begin()) {
 *     TraceContext.set("tenant", tenantId);
 *     orders.place(cart);
 * }
 * }</pre>
 */
public final class TraceContext {

	private static final InheritableThreadLocal<Frame> CURRENT = new InheritableThreadLocal<>();

	public static Frame begin() {
		final Frame frame = new Frame(CURRENT.get());
		CURRENT.set(frame);
		return frame;
	}

	/** Writes to the innermost frame, opening a root frame for this flow if there is none. */
	public static void set(final String key, final Object value) {
		Frame frame = CURRENT.get();
		if (frame == null) {
			frame = begin();
		}
		frame.values.put(key, value);
	}

	public static Object get(final String key) {
		for (Frame f = CURRENT.get(); f != null; f = f.parent) {
			if (f.values.containsKey(key)) return f.values.get(key);
		}
		return null;
	}

	/** One level of the bag. */
	public static final class Frame implements AutoCloseable {
		private final Frame parent;
		private final Map<String, Object> values = new HashMap<>();

		private Frame(final Frame parent) {
			this.parent = parent;
		}

		@Override
		public void close() {
			if (CURRENT.get() != this) {
				throw new IllegalStateException("TraceContext frames must be closed innermost first");
			}
			if (parent == null) {
				CURRENT.remove();
			} else {
				CURRENT.set(parent);
			}
		}
	}

	private TraceContext() {}
}
