package com.obsinity.tracing.sink;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

import com.obsinity.tracing.allocation.Allocation;
import com.obsinity.tracing.allocation.IdentifierAllocator;
import com.obsinity.tracing.coercion.TypeCoercionResolver;
import com.obsinity.tracing.contract.ContractAnalyzer;
import com.obsinity.tracing.contract.ContractDescription;
import com.obsinity.tracing.correlation.CorrelationScopeManager;
import com.obsinity.tracing.mapping.ParameterMapping;
import com.obsinity.tracing.mapping.ParameterMappingEngine;
import com.obsinity.tracing.model.InvocationKind;
import com.obsinity.tracing.model.MethodDescriptor;
import com.obsinity.tracing.provider.ResolvedProviders;

/**
 * Builds the {@link Sink} of a contract: analysis, id and keyword allocation, field mapping and coercion, then one
 * emitter per event. All configuration errors surface here, before any event is emitted.
 */
@Component
@RequiredArgsConstructor
public class SinkSynthesizer {

	private static final Logger log = LoggerFactory.getLogger(SinkSynthesizer.class);

	private final ContractAnalyzer analyzer;
	private final IdentifierAllocator allocator;
	private final ParameterMappingEngine mappingEngine;
	private final TypeCoercionResolver coercion;
	private final CorrelationScopeManager correlation;

	public Sink synthesize(Class<?> contract, SinkBackend backend, ResolvedProviders providers) {
		final ContractDescription description = analyzer.analyze(contract);
		final Allocation allocation = allocator.allocate(description);
		final boolean throwOnWriteError = description.settings().throwOnWriteError();

		final List<MethodDescriptor> all = new ArrayList<>(allocation.declared());
		all.addAll(allocation.complements());

		final Map<String, Emitter> byEventName = new LinkedHashMap<>();
		for (MethodDescriptor d : all) {
			final List<FieldPlan> plans = new ArrayList<>();
			for (ParameterMapping m : mappingEngine.map(d, providers.rules(), providers.contextProvider())) {
				plans.add(new FieldPlan(m, coercion.resolve(d, m, providers.serializer())));
			}
			final Emitter emitter = new EventEmitter(description.identity(), d, plans, backend,
					providers.serializer(), coercion, correlation, throwOnWriteError);
			byEventName.put(d.eventName().toLowerCase(Locale.ROOT), emitter);
		}

		final Map<Method, MethodEmitters> byMethod = new HashMap<>();
		for (MethodDescriptor d : allocation.declared()) {
			final Emitter call = byEventName.get(d.eventName().toLowerCase(Locale.ROOT));
			Emitter completion = null;
			Emitter fault = null;
			if (d.kind() == InvocationKind.METHOD_CALL && description.settings().implementComplementMethods()) {
				completion = byEventName.get((d.eventName() + ContractAnalyzer.COMPLETED_SUFFIX).toLowerCase(Locale.ROOT));
				fault = byEventName.get((d.eventName() + ContractAnalyzer.FAULTED_SUFFIX).toLowerCase(Locale.ROOT));
			}
			byMethod.put(d.method(), new MethodEmitters(call, completion, fault, correlation));
		}

		backend.register(description.identity());
		log.info("Built sink {} ({}) for {}: {} events", description.identity().name(), description.identity().id(),
				contract.getName(), all.size());
		if (log.isDebugEnabled()) {
			byEventName.values().forEach(e -> log.debug("  {}", e));
		}

		return new Sink(
				contract,
				description.identity(),
				all,
				byMethod,
				byEventName,
				description.nonEvents(),
				allocation.keywords(),
				allocation.tasks(),
				allocation.opcodes());
	}
}
