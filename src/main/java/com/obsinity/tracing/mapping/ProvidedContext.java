package com.obsinity.tracing.mapping;

import com.obsinity.tracing.context.TraceContextProvider;
import com.obsinity.tracing.model.InvocationContext;

/** The registered {@link TraceContextProvider}'s string for one event; feeds the trailing {@code Context} field. */
public final class ProvidedContext implements ValueConverter {

	private final TraceContextProvider provider;
	private final InvocationContext invocation;

	public ProvidedContext(final TraceContextProvider provider, final InvocationContext invocation) {
		this.provider = provider;
		this.invocation = invocation;
	}

	@Override
	public Object convert(final Object ignored) {
		return provider.provideContext(invocation);
	}

	@Override
	public Class<?> outputType() {
		return String.class;
	}
}
