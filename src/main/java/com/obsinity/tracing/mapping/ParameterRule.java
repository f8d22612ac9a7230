package com.obsinity.tracing.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A group of values sharing one output field, named by the group alias or {@code "data"} when the group has none. A
 * value's own alias keys it inside the bundle.
 */
final class ParameterRule {

	static final String DEFAULT_NAME = "data";

	private final RuleScope scope;
	private final List<RuleValue> values = new ArrayList<>();
	private String alias;

	ParameterRule(RuleScope scope) {
		this.scope = scope;
	}

	RuleScope scope() {
		return scope;
	}

	List<RuleValue> values() {
		return Collections.unmodifiableList(values);
	}

	void add(RuleValue value) {
		values.add(value);
	}

	RuleValue last() {
		return values.isEmpty() ? null : values.get(values.size() - 1);
	}

	int size() {
		return values.size();
	}

	String alias() {
		return alias;
	}

	void alias(String value) {
		this.alias = value;
	}

	/** Output field a matched value lands in. */
	String outputName() {
		return alias != null ? alias : DEFAULT_NAME;
	}

	/** Bundle key for a matched value. */
	String keyFor(RuleValue value) {
		if (value.alias() != null) return value.alias();
		return outputName();
	}
}
