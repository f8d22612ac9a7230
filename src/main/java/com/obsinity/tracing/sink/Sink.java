package com.obsinity.tracing.sink;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.obsinity.tracing.model.Identity;
import com.obsinity.tracing.model.MethodDescriptor;

/**
 * The synthesized event-emitting implementation of one contract. Immutable and shared by every thread; the engine
 * builds at most one per contract.
 */
public final class Sink {

	private final Class<?> contract;
	private final Identity identity;
	private final List<MethodDescriptor> descriptors;
	private final Map<Method, MethodEmitters> byMethod;
	private final Map<String, Emitter> byEventName;
	private final List<Method> nonEvents;
	private final Map<String, Long> keywords;
	private final Map<String, Integer> tasks;
	private final Map<String, Integer> opcodes;

	Sink(
			Class<?> contract,
			Identity identity,
			List<MethodDescriptor> descriptors,
			Map<Method, MethodEmitters> byMethod,
			Map<String, Emitter> byEventName,
			List<Method> nonEvents,
			Map<String, Long> keywords,
			Map<String, Integer> tasks,
			Map<String, Integer> opcodes) {
		this.contract = contract;
		this.identity = identity;
		this.descriptors = List.copyOf(descriptors);
		this.byMethod = Map.copyOf(byMethod);
		this.byEventName = Map.copyOf(byEventName);
		this.nonEvents = List.copyOf(nonEvents);
		this.keywords = keywords;
		this.tasks = tasks;
		this.opcodes = opcodes;
	}

	public Class<?> contract() {
		return contract;
	}

	public Identity identity() {
		return identity;
	}

	/** Every event, declared ones first (declaration order), then generated complements. */
	public List<MethodDescriptor> descriptors() {
		return descriptors;
	}

	/** Emitters of a declared contract method; empty for {@code @NonEvent} and foreign methods. */
	public Optional<MethodEmitters> emitters(Method method) {
		return Optional.ofNullable(byMethod.get(method));
	}

	/** Emitter by synthesized event name, case-insensitive. */
	public Optional<Emitter> emitter(String eventName) {
		return Optional.ofNullable(byEventName.get(eventName.toLowerCase(Locale.ROOT)));
	}

	public boolean isNonEvent(Method method) {
		return nonEvents.contains(method);
	}

	public Map<String, Long> keywords() {
		return keywords;
	}

	public Map<String, Integer> tasks() {
		return tasks;
	}

	public Map<String, Integer> opcodes() {
		return opcodes;
	}

	@Override
	public String toString() {
		return "Sink[" + identity.name() + " " + identity.id() + ", " + descriptors.size() + " events]";
	}
}
