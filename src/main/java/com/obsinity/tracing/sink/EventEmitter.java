package com.obsinity.tracing.sink;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.obsinity.tracing.coercion.TraceSerializer;
import com.obsinity.tracing.coercion.TypeCoercionResolver;
import com.obsinity.tracing.correlation.CorrelationScopeManager;
import com.obsinity.tracing.exceptions.RuntimeSerializationException;
import com.obsinity.tracing.exceptions.SinkWriteException;
import com.obsinity.tracing.exceptions.TracingException;
import com.obsinity.tracing.model.EventRecord;
import com.obsinity.tracing.model.Identity;
import com.obsinity.tracing.model.MethodDescriptor;

/**
 * Emitter built from a fixed field plan. When the backend is disabled for the event nothing else is touched: no
 * accessor, serializer or context provider runs.
 */
final class EventEmitter implements Emitter {

	private static final Logger log = LoggerFactory.getLogger(EventEmitter.class);

	private final Identity source;
	private final MethodDescriptor descriptor;
	private final List<FieldPlan> plans;
	private final List<String> fieldNames;
	private final SinkBackend backend;
	private final TraceSerializer serializer;
	private final TypeCoercionResolver coercion;
	private final CorrelationScopeManager correlation;
	private final boolean throwOnWriteError;

	EventEmitter(
			Identity source,
			MethodDescriptor descriptor,
			List<FieldPlan> plans,
			SinkBackend backend,
			TraceSerializer serializer,
			TypeCoercionResolver coercion,
			CorrelationScopeManager correlation,
			boolean throwOnWriteError) {
		this.source = source;
		this.descriptor = descriptor;
		this.plans = List.copyOf(plans);
		this.fieldNames = plans.stream().map(FieldPlan::name).toList();
		this.backend = backend;
		this.serializer = serializer;
		this.coercion = coercion;
		this.correlation = correlation;
		this.throwOnWriteError = throwOnWriteError;
	}

	@Override
	public MethodDescriptor descriptor() {
		return descriptor;
	}

	@Override
	public boolean isEnabled() {
		return backend.isEnabled(descriptor.level(), descriptor.keywords());
	}

	@Override
	public void emit(Object... args) {
		if (!isEnabled()) return;

		final Object[] payload = new Object[plans.size()];
		for (int i = 0; i < payload.length; i++) {
			payload[i] = value(plans.get(i), args);
		}

		final EventRecord record = new EventRecord(
				source,
				descriptor.eventId(),
				descriptor.eventName(),
				descriptor.kind(),
				descriptor.level(),
				descriptor.keywords(),
				descriptor.task(),
				descriptor.opcode(),
				descriptor.version(),
				descriptor.message(),
				fieldNames,
				Collections.unmodifiableList(Arrays.asList(payload)),
				correlation.currentIdOrNull(),
				correlation.relatedIdOrNull());

		try {
			backend.write(record);
		} catch (RuntimeException e) {
			final SinkWriteException failure = new SinkWriteException(
					descriptor.eventId(), "Backend failed to write " + source.name() + "." + descriptor.eventName(), e);
			if (throwOnWriteError) throw failure;
			log.warn("Dropped trace record {}.{} (id {}): {}",
					source.name(), descriptor.eventName(), descriptor.eventId(), e.toString());
		}
	}

	private Object value(FieldPlan plan, Object[] args) {
		if (plan.decision().serialized()
				&& !coercion.shouldSerialize(plan.decision().serializationLevel(), backend)) {
			return null;
		}
		final Object raw;
		try {
			raw = plan.read(args);
		} catch (TracingException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new RuntimeSerializationException(
					plan.name(), "Failed to read field '" + plan.name() + "' of " + descriptor.eventName(), e);
		}
		return coercion.coerce(raw, plan.decision(), serializer);
	}

	@Override
	public String toString() {
		return source.name() + "." + descriptor.eventName() + "#" + descriptor.eventId() + fieldNames;
	}
}
