package com.obsinity.tracing.sink;

import com.obsinity.tracing.model.MethodDescriptor;

/** Writes one kind of event. Arguments are positional, in the order of the descriptor's parameters. */
public interface Emitter {

	MethodDescriptor descriptor();

	/** Whether the backend currently accepts this event's level and keywords. */
	boolean isEnabled();

	void emit(Object... args);
}
