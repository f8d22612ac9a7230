package com.obsinity.tracing.provider;

import com.obsinity.tracing.coercion.TraceSerializer;
import com.obsinity.tracing.context.TraceContextProvider;
import com.obsinity.tracing.mapping.ParameterMappingRules;

/** Pluggable collaborators a contract's sink is built with. */
public enum ProviderKind {
	CONTEXT_PROVIDER(TraceContextProvider.class),
	SERIALIZER(TraceSerializer.class),
	PARAMETER_MAPPING_RULES(ParameterMappingRules.class);

	private final Class<?> type;

	ProviderKind(Class<?> type) {
		this.type = type;
	}

	/** Type a provider of this kind must implement. */
	public Class<?> type() {
		return type;
	}
}
