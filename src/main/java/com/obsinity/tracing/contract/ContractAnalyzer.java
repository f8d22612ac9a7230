package com.obsinity.tracing.contract;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionStage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import com.obsinity.tracing.annotations.NonEvent;
import com.obsinity.tracing.annotations.TraceContract;
import com.obsinity.tracing.annotations.TraceEvent;
import com.obsinity.tracing.exceptions.TracingConfigurationException;
import com.obsinity.tracing.model.EventLevel;
import com.obsinity.tracing.model.Identity;
import com.obsinity.tracing.model.InvocationKind;
import com.obsinity.tracing.model.MethodDescriptor;
import com.obsinity.tracing.model.ParameterDescriptor;
import com.obsinity.tracing.utils.TracingIdGenerator;

/**
 * Reads a contract interface into event descriptors.
 *
 * <p>Precedence for event metadata: {@code @TraceEvent} on the method, then {@code @TraceContract} on the contract,
 * then defaults ({@link EventLevel#INFORMATIONAL}, no keywords).
 */
@Component
public class ContractAnalyzer {

	private static final Logger log = LoggerFactory.getLogger(ContractAnalyzer.class);

	public static final String COMPLETED_SUFFIX = "_Completed";
	public static final String FAULTED_SUFFIX = "_Faulted";
	public static final String RETURN_VALUE = "ReturnValue";
	public static final String EXCEPTION = "exception";

	public ContractDescription analyze(final Class<?> contract) {
		if (contract == null
				|| !contract.isInterface()
				|| contract.isAnnotation()
				|| contract.isPrimitive()) {
			throw new TracingConfigurationException(
					String.valueOf(contract), "Unsupported contract shape: a contract must be an interface");
		}

		final ContractSettings settings =
				ContractSettings.of(contract, AnnotatedElementUtils.findMergedAnnotation(contract, TraceContract.class));
		final Identity identity = new Identity(
				settings.name(),
				settings.id() != null ? settings.id() : TracingIdGenerator.fromName(settings.name()));

		final List<Method> methods = collectMethods(contract);
		final List<Method> events = new ArrayList<>();
		final List<Method> nonEvents = new ArrayList<>();
		for (Method m : methods) {
			if (AnnotatedElementUtils.hasAnnotation(m, NonEvent.class)) nonEvents.add(m);
			else events.add(m);
		}

		final Map<String, Integer> nameCounts = new LinkedHashMap<>();
		events.forEach(m -> nameCounts.merge(lower(m.getName()), 1, Integer::sum));
		final Map<String, Integer> nameIndex = new LinkedHashMap<>();

		final List<MethodDescriptor> declared = new ArrayList<>(events.size());
		for (Method m : events) {
			final String key = lower(m.getName());
			final int index = nameIndex.merge(key, 1, Integer::sum) - 1;
			final String eventName = nameCounts.get(key) > 1 ? m.getName() + "_" + index : m.getName();
			declared.add(describe(contract, settings, m, eventName));
		}

		final List<MethodDescriptor> complements = new ArrayList<>();
		if (settings.implementComplementMethods()) {
			for (MethodDescriptor call : declared) {
				if (call.kind() != InvocationKind.METHOD_CALL) continue;
				complement(call, declared, InvocationKind.METHOD_COMPLETION).ifPresent(complements::add);
				complement(call, declared, InvocationKind.METHOD_FAULTED).ifPresent(complements::add);
			}
		}

		log.debug("Analyzed contract {} ({}): {} events, {} complements, {} non-events",
				identity.name(), contract.getName(), declared.size(), complements.size(), nonEvents.size());
		return new ContractDescription(contract, identity, settings, declared, complements, nonEvents);
	}

	/* --------------------- methods --------------------- */

	/** Super-interfaces first (depth-first, in {@code extends} order), then the contract's own methods. */
	static List<Method> collectMethods(final Class<?> contract) {
		final Set<Class<?>> visited = new LinkedHashSet<>();
		final Map<String, Method> bySignature = new LinkedHashMap<>();
		collect(contract, visited, bySignature);
		return new ArrayList<>(bySignature.values());
	}

	private static void collect(Class<?> type, Set<Class<?>> visited, Map<String, Method> out) {
		if (!visited.add(type)) return;
		for (Class<?> parent : type.getInterfaces()) {
			collect(parent, visited, out);
		}
		for (Method m : DeclarationOrder.declaredMethods(type)) {
			final int mod = m.getModifiers();
			if (Modifier.isStatic(mod) || Modifier.isPrivate(mod) || m.isSynthetic() || m.isBridge()) continue;
			out.putIfAbsent(m.getName() + Arrays.toString(m.getParameterTypes()), m);
		}
	}

	private MethodDescriptor describe(Class<?> contract, ContractSettings settings, Method m, String eventName) {
		final TraceEvent event = AnnotatedElementUtils.findMergedAnnotation(m, TraceEvent.class);

		final EventLevel level;
		if (event != null && event.level() != EventLevel.INHERIT) level = event.level();
		else if (settings.level() != null) level = settings.level();
		else level = EventLevel.INFORMATIONAL;

		final long keywords = (event != null && event.keywords() != 0) ? event.keywords() : settings.keywords();
		final int version = (event != null && event.version() != 0) ? event.version() : settings.version();
		final String message = (event != null && !event.message().isEmpty()) ? event.message() : null;

		if (event != null && event.id() < 0) {
			throw new TracingConfigurationException(
					contract.getName() + "#" + m.getName(), "Event id must be positive: " + event.id());
		}

		final List<ParameterDescriptor> params = new ArrayList<>();
		final Parameter[] reflective = m.getParameters();
		for (int i = 0; i < reflective.length; i++) {
			final Parameter p = reflective[i];
			params.add(new ParameterDescriptor(p.getName(), p.getType(), p.getParameterizedType(), i, p));
		}

		final boolean deferred = CompletionStage.class.isAssignableFrom(m.getReturnType());
		final Class<?> valueType = deferred ? settledType(m.getGenericReturnType()) : m.getReturnType();

		return new MethodDescriptor(
				contract,
				m,
				m.getName(),
				eventName,
				kindOf(m.getName()),
				params,
				m.getReturnType(),
				valueType,
				deferred,
				event != null ? event.id() : 0,
				level,
				keywords,
				event != null ? event.task() : 0,
				event != null ? event.opcode() : 0,
				version,
				message,
				false);
	}

	/**
	 * Completion or fault event for {@code call}, unless the contract declares a compatible method of that name.
	 *
	 * @throws TracingConfigurationException when a method of that name exists with an incompatible signature
	 */
	private Optional<MethodDescriptor> complement(
			MethodDescriptor call, List<MethodDescriptor> declared, InvocationKind kind) {
		final boolean completion = kind == InvocationKind.METHOD_COMPLETION;
		final String name = call.eventName() + (completion ? COMPLETED_SUFFIX : FAULTED_SUFFIX);

		final List<ParameterDescriptor> params;
		if (completion) {
			params = call.returnsVoid()
					? List.of()
					: List.of(new ParameterDescriptor(RETURN_VALUE, call.valueType(), call.valueType(), 0, null));
		} else {
			params = List.of(new ParameterDescriptor(EXCEPTION, Throwable.class, Throwable.class, 0, null));
		}

		for (MethodDescriptor existing : declared) {
			if (!existing.eventName().equalsIgnoreCase(name)) continue;
			if (compatible(existing, params, completion)) return Optional.empty();
			throw new TracingConfigurationException(
					call.contract().getName() + "#" + existing.name(),
					"Method " + existing.name() + " clashes with the generated "
							+ (completion ? "completion" : "fault") + " event of " + call.name());
		}

		return Optional.of(new MethodDescriptor(
				call.contract(),
				call.method(),
				call.name(),
				name,
				kind,
				params,
				call.returnType(),
				call.valueType(),
				call.deferred(),
				0,
				call.level(),
				call.keywords(),
				call.task(),
				call.opcode(),
				call.version(),
				call.message(),
				true));
	}

	private static boolean compatible(MethodDescriptor existing, List<ParameterDescriptor> expected, boolean completion) {
		final List<ParameterDescriptor> actual = existing.parameters();
		if (actual.size() != expected.size()) return false;
		if (actual.isEmpty()) return true;
		final Class<?> declaredType = ClassUtils.resolvePrimitiveIfNecessary(actual.get(0).type());
		final Class<?> wanted = ClassUtils.resolvePrimitiveIfNecessary(expected.get(0).type());
		if (completion) return declaredType.isAssignableFrom(wanted);
		return Throwable.class.isAssignableFrom(declaredType) || declaredType.isAssignableFrom(Throwable.class);
	}

	private static InvocationKind kindOf(String methodName) {
		final String lower = lower(methodName);
		if (lower.endsWith(lower(COMPLETED_SUFFIX))) return InvocationKind.METHOD_COMPLETION;
		if (lower.endsWith(lower(FAULTED_SUFFIX))) return InvocationKind.METHOD_FAULTED;
		return InvocationKind.METHOD_CALL;
	}

	/** {@code T} of {@code CompletionStage<T>}; {@code Object} when it cannot be resolved. */
	private static Class<?> settledType(Type genericReturn) {
		if (genericReturn instanceof ParameterizedType pt) {
			final Type arg = pt.getActualTypeArguments()[0];
			if (arg instanceof Class<?> c) return c;
			if (arg instanceof ParameterizedType nested && nested.getRawType() instanceof Class<?> raw) return raw;
		}
		return Object.class;
	}

	private static String lower(String s) {
		return s.toLowerCase(Locale.ROOT);
	}
}
