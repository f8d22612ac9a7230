package com.obsinity.tracing.provider;

import com.obsinity.tracing.coercion.TraceSerializer;
import com.obsinity.tracing.context.TraceContextProvider;
import com.obsinity.tracing.mapping.ParameterMappingRules;

/**
 * Providers in effect for one contract.
 *
 * @param contextProvider null when no context provider applies
 */
public record ResolvedProviders(
		TraceSerializer serializer, TraceContextProvider contextProvider, ParameterMappingRules rules) {}
