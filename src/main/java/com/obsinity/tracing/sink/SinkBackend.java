package com.obsinity.tracing.sink;

import com.obsinity.tracing.model.EventLevel;
import com.obsinity.tracing.model.EventRecord;
import com.obsinity.tracing.model.Identity;

/**
 * Transport for synthesized records. Implementations decide which levels and keywords are enabled and where records go;
 * they must be safe for concurrent use.
 */
public interface SinkBackend {

	/** Keyword mask meaning "any keyword"; used when only the level matters. */
	long ALL_KEYWORDS = -1L;

	/** Backend that is never enabled. */
	SinkBackend DISABLED = new SinkBackend() {
		@Override
		public boolean isEnabled(EventLevel level, long keywords) {
			return false;
		}

		@Override
		public void write(EventRecord record) {}
	};

	/** Called once per contract when its sink is built. */
	default void register(Identity source) {}

	boolean isEnabled(EventLevel level, long keywords);

	void write(EventRecord record);
}
