package com.obsinity.tracing.mapping;

/**
 * Rules for parameters of a given type. Member paths and transforms are checked against that type immediately, so a
 * mistake fails at registration rather than at first use.
 */
public class TypedRuleBuilder<T> {

	private final RuleBuilder parent;
	private final Class<T> type;
	private final String parameterName;

	TypedRuleBuilder(RuleBuilder parent, Class<T> type, String parameterName) {
		this.parent = parent;
		this.type = type;
		this.parameterName = parameterName;
	}

	/** Traces the listed members (or, with no members, the whole value) as one new group. */
	public TypedRuleBuilder<T> trace(String... members) {
		final ParameterRule group = parent.newGroup();
		if (parameterName != null) group.alias(parameterName);
		if (members.length == 0) {
			parent.current().add(new RuleValue(parameterName, parameterName, type, null, false));
			return this;
		}
		return and(members);
	}

	public TypedRuleBuilder<T> and(String... members) {
		for (String member : members) {
			final MemberAccessor accessor = new MemberAccessor(type, member);
			parent.current().add(new RuleValue(
					parameterName, RuleBuilder.lastSegment(member), type, slotType -> accessor, false));
		}
		return this;
	}

	/** Traces the value through a static transform, as one new group. */
	public TypedRuleBuilder<T> transform(Class<?> holder, String methodName) {
		final StaticTransform transform = new StaticTransform(type, holder, methodName);
		final ParameterRule group = parent.newGroup();
		if (parameterName != null) group.alias(parameterName);
		group.add(new RuleValue(parameterName, parameterName, type, slotType -> transform, false));
		return this;
	}

	/** Traces the value formatted with a constant pattern, as one new group. */
	public TypedRuleBuilder<T> format(String pattern) {
		final FormatConverter converter = new FormatConverter(pattern);
		final ParameterRule group = parent.newGroup();
		if (parameterName != null) group.alias(parameterName);
		group.add(new RuleValue(parameterName, parameterName, type, slotType -> converter, false));
		return this;
	}

	public TypedRuleBuilder<T> as(String... aliases) {
		RuleBuilder.applyAliases(parent.current(), aliases);
		return this;
	}

	public TypedRuleBuilder<T> togetherAs(String alias) {
		parent.current().alias(alias);
		return this;
	}

	/** Drops matching parameters from the payload. */
	public TypedRuleBuilder<T> ignore() {
		parent.newGroup().add(new RuleValue(parameterName, parameterName, type, null, true));
		return this;
	}

	public <O> TypedRuleBuilder<O> with(Class<O> other) {
		return parent.with(other);
	}

	public <O> TypedRuleBuilder<O> with(Class<O> other, String otherParameterName) {
		return parent.with(other, otherParameterName);
	}

	/** Back to untyped rules of the same scope. */
	public RuleBuilder endWith() {
		return parent;
	}
}
