package com.obsinity.tracing.provider;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeanInstantiationException;
import org.springframework.beans.BeanUtils;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;

import com.obsinity.tracing.annotations.TraceProviders;
import com.obsinity.tracing.coercion.JsonTraceSerializer;
import com.obsinity.tracing.coercion.TraceSerializer;
import com.obsinity.tracing.context.TraceContextProvider;
import com.obsinity.tracing.exceptions.TracingConfigurationException;
import com.obsinity.tracing.mapping.ParameterMappingRules;

/**
 * Providers by {@code (contract, kind)}; a null contract holds the process-wide default.
 *
 * <p>Resolution per kind: registered for the contract, then {@link TraceProviders} on the contract, then the
 * registered default, then the built-in default ({@link JsonTraceSerializer}, no context provider, no rules).
 *
 * <p>A contract is sealed when synthesis of its sink starts; registering for it afterwards is a configuration error,
 * as is registering a default once any contract is sealed, or registering the same key twice.
 */
@Component
public class ProviderRegistry {

	private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

	private record Key(Class<?> contract, ProviderKind kind) {}

	private final Map<Key, Object> providers = new ConcurrentHashMap<>();
	private final Set<Class<?>> sealed = ConcurrentHashMap.newKeySet();

	private final TraceSerializer builtInSerializer = new JsonTraceSerializer();
	private final ParameterMappingRules builtInRules = new ParameterMappingRules();

	public synchronized void register(Class<?> contract, ProviderKind kind, Object instance) {
		Objects.requireNonNull(kind, "kind");
		final String key = (contract == null ? "<default>" : contract.getName()) + "/" + kind;
		if (instance == null) {
			throw new TracingConfigurationException(key, "Provider instance must not be null");
		}
		if (!kind.type().isInstance(instance)) {
			throw new TracingConfigurationException(key,
					instance.getClass().getName() + " is not a " + kind.type().getSimpleName());
		}
		if (contract != null && sealed.contains(contract)) {
			throw new TracingConfigurationException(key,
					"Sink for " + contract.getName() + " already exists; register providers before first use");
		}
		if (contract == null && !sealed.isEmpty()) {
			throw new TracingConfigurationException(key,
					"Sinks already exist for " + sealed.size() + " contract(s); register defaults before first use");
		}
		if (providers.putIfAbsent(new Key(contract, kind), instance) != null) {
			throw new TracingConfigurationException(key, "A " + kind + " is already registered");
		}
		log.debug("Registered {} {}", key, instance.getClass().getName());
	}

	/** Marks the contract's providers as final. */
	public synchronized void seal(Class<?> contract) {
		sealed.add(contract);
	}

	public ResolvedProviders resolve(Class<?> contract) {
		final TraceProviders declared = AnnotatedElementUtils.findMergedAnnotation(contract, TraceProviders.class);

		TraceSerializer serializer = lookup(contract, ProviderKind.SERIALIZER, TraceSerializer.class,
				declared == null ? null : declared.serializer());
		if (serializer == null) serializer = builtInSerializer;

		final TraceContextProvider context = lookup(contract, ProviderKind.CONTEXT_PROVIDER, TraceContextProvider.class,
				declared == null ? null : declared.contextProvider());

		ParameterMappingRules rules = lookup(contract, ProviderKind.PARAMETER_MAPPING_RULES,
				ParameterMappingRules.class, declared == null ? null : declared.parameterRules());
		if (rules == null) rules = builtInRules;

		return new ResolvedProviders(serializer, context, rules);
	}

	private <T> T lookup(Class<?> contract, ProviderKind kind, Class<T> type, Class<? extends T> annotated) {
		final Object registered = providers.get(new Key(contract, kind));
		if (registered != null) return type.cast(registered);

		// the annotation attribute defaults to the abstract type itself, meaning "not declared"
		if (annotated != null && annotated != type) {
			try {
				return BeanUtils.instantiateClass(annotated);
			} catch (BeanInstantiationException e) {
				throw new TracingConfigurationException(contract.getName() + "/" + kind,
						"Cannot instantiate " + annotated.getName() + " declared in @TraceProviders", e);
			}
		}

		final Object fallback = providers.get(new Key(null, kind));
		return fallback == null ? null : type.cast(fallback);
	}
}
