package com.obsinity.tracing.proxy;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import com.obsinity.tracing.model.MethodDescriptor;
import com.obsinity.tracing.model.ParameterDescriptor;
import com.obsinity.tracing.sink.MethodEmitters;
import com.obsinity.tracing.sink.Sink;

/**
 * Finds the log-contract emitters for a method of the execute contract.
 *
 * <p>Order: the method itself when the log contract declares it; a log method of the same name and parameter types;
 * one named {@code name_<n>} with those types; finally, a single log method of that name and arity.
 */
final class LogMethodResolver {

	private LogMethodResolver() {}

	static Optional<MethodEmitters> resolve(final Sink logSink, final Method method) {
		final Optional<MethodEmitters> direct = logSink.emitters(method);
		if (direct.isPresent()) return direct;

		final List<MethodDescriptor> declared = logSink.descriptors().stream().filter(d -> !d.generated()).toList();
		final Class<?>[] types = method.getParameterTypes();

		Optional<MethodDescriptor> match = declared.stream()
				.filter(d -> d.name().equals(method.getName()) && sameTypes(d, types))
				.findFirst();

		if (match.isEmpty()) {
			final Pattern indexed = Pattern.compile(Pattern.quote(method.getName()) + "_\\d+");
			match = declared.stream()
					.filter(d -> indexed.matcher(d.name()).matches() && sameTypes(d, types))
					.findFirst();
		}

		if (match.isEmpty()) {
			final List<MethodDescriptor> byArity = declared.stream()
					.filter(d -> d.name().equalsIgnoreCase(method.getName()) && d.parameters().size() == types.length)
					.toList();
			if (byArity.size() == 1) match = Optional.of(byArity.get(0));
		}

		return match.flatMap(d -> logSink.emitters(d.method()));
	}

	private static boolean sameTypes(final MethodDescriptor d, final Class<?>[] types) {
		final Class<?>[] declared = d.parameters().stream().map(ParameterDescriptor::type).toArray(Class<?>[]::new);
		return Arrays.equals(declared, types);
	}
}
