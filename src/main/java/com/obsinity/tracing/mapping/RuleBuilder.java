package com.obsinity.tracing.mapping;

import java.util.function.Function;
import java.util.function.Supplier;

import com.obsinity.tracing.context.TraceContext;

/**
 * Fluent builder for one scope of {@link ParameterMappingRules}. {@code trace*}, {@code ignore} and
 * {@code addContext*} start a new group; {@code and*}, {@link #as} and {@link #togetherAs} refine the current one.
 */
public class RuleBuilder {

	private final ParameterMappingRules owner;
	private final RuleScope scope;
	private ParameterRule current;

	RuleBuilder(ParameterMappingRules owner, RuleScope scope) {
		this.owner = owner;
		this.scope = scope;
	}

	/* --------------------- tracing values --------------------- */

	/** Traces the named parameters as one group, bundled under {@code "data"} unless aliased. */
	public RuleBuilder trace(String... parameterNames) {
		newGroup();
		return and(parameterNames);
	}

	/** Traces members of one parameter, grouped under the parameter's name. */
	public RuleBuilder traceMembers(String parameterName, String... members) {
		newGroup();
		current.alias(parameterName);
		for (String member : members) {
			addValue(parameterName, lastSegment(member), null, slotType -> new MemberAccessor(slotType, member));
		}
		return this;
	}

	/** Traces a parameter through a static transform method. */
	public RuleBuilder transform(String parameterName, Class<?> holder, String methodName) {
		newGroup();
		current.alias(parameterName);
		addValue(parameterName, parameterName, null, slotType -> new StaticTransform(slotType, holder, methodName));
		return this;
	}

	/** Traces a parameter formatted with a constant pattern. */
	public RuleBuilder format(String parameterName, String pattern) {
		final FormatConverter converter = new FormatConverter(pattern);
		newGroup();
		current.alias(parameterName);
		addValue(parameterName, parameterName, null, slotType -> converter);
		return this;
	}

	public RuleBuilder and(String... parameterNames) {
		requireGroup();
		for (String p : parameterNames) {
			addValue(p, p, null, null);
		}
		return this;
	}

	public RuleBuilder andMember(String parameterName, String member) {
		requireGroup();
		addValue(parameterName, parameterName, null, slotType -> new MemberAccessor(slotType, member));
		return this;
	}

	/* --------------------- naming --------------------- */

	/**
	 * One alias renames the last value (and the group, when it holds a single value); several aliases rename the
	 * group's values one-to-one.
	 */
	public RuleBuilder as(String... aliases) {
		requireGroup();
		applyAliases(current, aliases);
		return this;
	}

	/** Names the group's output field; all of its values bundle into it. */
	public RuleBuilder togetherAs(String alias) {
		requireGroup();
		current.alias(alias);
		return this;
	}

	/* --------------------- ignoring --------------------- */

	public RuleBuilder ignore(String... parameterNames) {
		newGroup();
		for (String p : parameterNames) {
			current.add(new RuleValue(p, p, null, null, true));
		}
		return this;
	}

	public RuleBuilder ignore(Class<?>... types) {
		newGroup();
		for (Class<?> t : types) {
			current.add(new RuleValue(null, null, t, null, true));
		}
		return this;
	}

	/* --------------------- typed values --------------------- */

	/** Rules for every parameter of type {@code type} (or a subtype). */
	public <T> TypedRuleBuilder<T> with(Class<T> type) {
		return new TypedRuleBuilder<>(this, type, null);
	}

	/** Rules for the parameter named {@code parameterName} when it is of type {@code type}. */
	public <T> TypedRuleBuilder<T> with(Class<T> type, String parameterName) {
		return new TypedRuleBuilder<>(this, type, parameterName);
	}

	/* --------------------- context --------------------- */

	/** Adds a value computed at emission time to the trailing context slot. */
	public RuleBuilder addContext(String alias, Supplier<?> supplier) {
		return addContext(alias, Object.class, supplier);
	}

	public <V> RuleBuilder addContext(String alias, Class<V> type, Supplier<? extends V> supplier) {
		final ContextSupplier converter = new ContextSupplier(supplier, type);
		newGroup();
		current.alias(alias);
		addValue(null, alias, null, slotType -> converter);
		return this;
	}

	/** Adds {@link TraceContext#get(String)} of {@code alias}, as text, to the context slot. */
	public RuleBuilder addContextData(String alias) {
		return addContextData(alias, alias);
	}

	public RuleBuilder addContextData(String alias, String key) {
		return addContext(alias, String.class, () -> {
			final Object value = TraceContext.get(key);
			return value == null ? null : value.toString();
		});
	}

	/* --------------------- switching scope --------------------- */

	public RuleBuilder forAnything() {
		return owner.forAnything();
	}

	public RuleBuilder forContract(Class<?> contract) {
		return owner.forContract(contract);
	}

	public RuleBuilder forMethod(Class<?> contract, String methodName, Class<?>... parameterTypes) {
		return owner.forMethod(contract, methodName, parameterTypes);
	}

	/* --------------------- internals --------------------- */

	ParameterRule newGroup() {
		current = new ParameterRule(scope);
		owner.add(current);
		return current;
	}

	ParameterRule current() {
		requireGroup();
		return current;
	}

	void addValue(String parameterName, String alias, Class<?> type, Function<Class<?>, ValueConverter> converter) {
		current.add(new RuleValue(parameterName, alias, type, converter, false));
	}

	private void requireGroup() {
		if (current == null) {
			throw new IllegalStateException("Start a group with trace(..), with(..) or addContext(..) first");
		}
	}

	static void applyAliases(ParameterRule group, String... aliases) {
		if (aliases.length == 0 || group.size() == 0) {
			throw new IllegalArgumentException("as(..) needs at least one alias and one traced value");
		}
		if (aliases.length == 1) {
			if (group.size() < 2) group.alias(aliases[0]);
			group.last().alias(aliases[0]);
		} else if (aliases.length == group.size()) {
			for (int i = 0; i < aliases.length; i++) {
				group.values().get(i).alias(aliases[i]);
			}
		} else {
			throw new IllegalArgumentException("The number of aliases must match the number of values in the group");
		}
	}

	static String lastSegment(String path) {
		final int dot = path.lastIndexOf('.');
		return dot < 0 ? path : path.substring(dot + 1);
	}
}
