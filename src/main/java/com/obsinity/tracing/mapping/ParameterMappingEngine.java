package com.obsinity.tracing.mapping;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import com.obsinity.tracing.annotations.TraceAs;
import com.obsinity.tracing.annotations.TraceIgnore;
import com.obsinity.tracing.annotations.TraceMember;
import com.obsinity.tracing.annotations.TraceTransform;
import com.obsinity.tracing.context.TraceContextProvider;
import com.obsinity.tracing.model.InvocationContext;
import com.obsinity.tracing.model.MethodDescriptor;
import com.obsinity.tracing.model.ParameterDescriptor;

/**
 * Decides the output fields of an event from its parameters.
 *
 * <p>Each parameter, plus a trailing context slot, is offered to the registered rules by tier (method, contract,
 * anything). The first tier with a matching value decides the slot; otherwise declarative annotations apply
 * ({@link TraceIgnore}, {@link TraceAs}, {@link TraceMember}, {@link TraceTransform}); otherwise the parameter maps to
 * a field of its own name. Fields sharing a name (case-insensitive) merge into a bundle whose keys stay distinct.
 *
 * <p>Generated completion and fault events always map their single parameter as-is.
 */
@Component
public class ParameterMappingEngine {

	private static final Logger log = LoggerFactory.getLogger(ParameterMappingEngine.class);

	/** Name of the field carrying the context provider's output. */
	public static final String CONTEXT_FIELD = "Context";

	public List<ParameterMapping> map(
			final MethodDescriptor method,
			final ParameterMappingRules rules,
			final TraceContextProvider contextProvider) {
		final List<ParameterMapping> computed = method.generated()
				? identity(method)
				: rules.provideMappings(method, () -> evaluate(method, rules));

		final Fields fields = new Fields();
		for (ParameterMapping m : computed) {
			if (m.hasSource()) fields.addAll(m.name(), m.sources());
		}

		final List<ParameterMapping> result = fields.toMappings();

		// always its own last field, even when a parameter is also called "context"
		final InvocationContext invocation = method.invocationContext();
		if (contextProvider != null && contextProvider.shouldProvideContext(invocation)) {
			result.add(new ParameterMapping(CONTEXT_FIELD, List.of(new SourceAccessor(
					CONTEXT_FIELD,
					SourceAccessor.CONTEXT_SLOT,
					null,
					new ProvidedContext(contextProvider, invocation)))));
		}

		if (log.isDebugEnabled()) {
			log.debug("{} -> {}", method.eventName(), describe(result));
		}
		return result;
	}

	/* --------------------- rules --------------------- */

	List<ParameterMapping> evaluate(final MethodDescriptor method, final ParameterMappingRules rules) {
		final Fields fields = new Fields();
		final TraceAs methodDefault = AnnotatedElementUtils.findMergedAnnotation(method.method(), TraceAs.class);

		final List<ParameterDescriptor> slots = new ArrayList<>(method.parameters());
		slots.add(null);

		for (ParameterDescriptor slot : slots) {
			if (applyRules(method, rules, slot, fields)) continue;
			if (slot == null) continue;
			applyDeclarative(slot, methodDefault, fields);
		}
		return fields.toMappings();
	}

	/** @return true when a rule tier claimed the slot */
	private boolean applyRules(
			final MethodDescriptor method,
			final ParameterMappingRules rules,
			final ParameterDescriptor slot,
			final Fields fields) {
		for (RuleScope.Tier tier : RuleScope.Tier.values()) {
			boolean matched = false;
			for (ParameterRule rule : rules.rules()) {
				if (rule.scope().tier() != tier || !rule.scope().matches(method)) continue;
				for (RuleValue value : rule.values()) {
					if (!value.matches(slot)) continue;
					matched = true;
					if (value.ignore()) continue;
					final Class<?> slotType = slot == null ? Object.class : slot.type();
					fields.add(rule.outputName(), new SourceAccessor(
							rule.keyFor(value),
							slot == null ? SourceAccessor.CONTEXT_SLOT : slot.position(),
							slot,
							value.converterFor(slotType)));
				}
			}
			if (matched) return true;
		}
		return false;
	}

	/* --------------------- annotations --------------------- */

	private void applyDeclarative(final ParameterDescriptor p, final TraceAs methodDefault, final Fields fields) {
		if (p.hasAnnotation(TraceIgnore.class)) return;

		boolean declared = false;

		for (TraceMember member : p.repeatable(TraceMember.class)) {
			final String name = StringUtils.hasText(member.as()) ? member.as() : member.value();
			fields.add(name, new SourceAccessor(p.name(), p.position(), p, new MemberAccessor(p.type(), member.value())));
			declared = true;
		}

		final TraceTransform transform = p.annotation(TraceTransform.class);
		if (transform != null) {
			final String name = StringUtils.hasText(transform.as()) ? transform.as() : p.name();
			fields.add(name, new SourceAccessor(
					p.name(), p.position(), p, new StaticTransform(p.type(), transform.type(), transform.method())));
			declared = true;
		}

		TraceAs traceAs = p.annotation(TraceAs.class);
		if (traceAs == null && !declared) traceAs = methodDefault;

		if (traceAs != null) {
			final String name = StringUtils.hasText(traceAs.name()) ? traceAs.name() : p.name();
			final ValueConverter format = StringUtils.hasText(traceAs.format()) ? new FormatConverter(traceAs.format()) : null;
			fields.add(name, new SourceAccessor(p.name(), p.position(), p, format));
		} else if (!declared) {
			fields.add(p.name(), new SourceAccessor(p.name(), p.position(), p, null));
		}
	}

	private static List<ParameterMapping> identity(final MethodDescriptor method) {
		final List<ParameterMapping> out = new ArrayList<>();
		for (ParameterDescriptor p : method.parameters()) {
			out.add(new ParameterMapping(p.name(), List.of(new SourceAccessor(p.name(), p.position(), p, null))));
		}
		return out;
	}

	private static String describe(final List<ParameterMapping> mappings) {
		final StringBuilder sb = new StringBuilder("[");
		for (ParameterMapping m : mappings) {
			if (sb.length() > 1) sb.append(", ");
			sb.append(m.name());
			if (m.isBundle()) {
				sb.append('{');
				m.sources().forEach(s -> sb.append(s.alias()).append(' '));
				sb.setLength(sb.length() - 1);
				sb.append('}');
			}
		}
		return sb.append(']').toString();
	}

	/** Output fields in first-seen order, merged by case-insensitive name. */
	private static final class Fields {
		private final Map<String, String> names = new LinkedHashMap<>();
		private final Map<String, List<SourceAccessor>> sources = new LinkedHashMap<>();

		void add(final String name, final SourceAccessor source) {
			final String key = name.toLowerCase(Locale.ROOT);
			names.putIfAbsent(key, name);
			sources.computeIfAbsent(key, k -> new ArrayList<>()).add(source);
		}

		void addAll(final String name, final List<SourceAccessor> list) {
			list.forEach(s -> add(name, s));
		}

		List<ParameterMapping> toMappings() {
			final List<ParameterMapping> out = new ArrayList<>(names.size());
			names.forEach((key, name) -> out.add(new ParameterMapping(name, distinctAliases(sources.get(key)))));
			return out;
		}

		/** Bundle keys must be unique; colliding ones are qualified by parameter name, then numbered. */
		private static List<SourceAccessor> distinctAliases(final List<SourceAccessor> list) {
			if (list.size() < 2) return list;
			final Map<String, Integer> counts = new HashMap<>();
			list.forEach(s -> counts.merge(s.alias().toLowerCase(Locale.ROOT), 1, Integer::sum));
			if (counts.size() == list.size()) return list;

			final Set<String> used = new HashSet<>();
			final List<SourceAccessor> out = new ArrayList<>(list.size());
			for (SourceAccessor s : list) {
				String alias = s.alias();
				if (counts.get(alias.toLowerCase(Locale.ROOT)) > 1 && s.parameter() != null) {
					alias = s.parameter().name() + "." + alias;
				}
				String candidate = alias;
				for (int n = 1; !used.add(candidate.toLowerCase(Locale.ROOT)); n++) {
					candidate = alias + "_" + n;
				}
				out.add(candidate.equals(s.alias())
						? s
						: new SourceAccessor(candidate, s.position(), s.parameter(), s.converter()));
			}
			return out;
		}
	}
}
