package com.obsinity.tracing.sink;

import java.util.LinkedHashMap;
import java.util.Map;

import com.obsinity.tracing.coercion.CoercionDecision;
import com.obsinity.tracing.mapping.ParameterMapping;
import com.obsinity.tracing.mapping.SourceAccessor;

/** One resolved output field: where its value comes from and how it is coerced. */
record FieldPlan(ParameterMapping mapping, CoercionDecision decision) {

	String name() {
		return mapping.name();
	}

	/** Raw value: the single source's value, or an ordered alias-to-value map for a bundle. */
	Object read(Object[] args) {
		if (!mapping.isBundle()) return mapping.sources().get(0).read(args);
		final Map<String, Object> bundle = new LinkedHashMap<>();
		for (SourceAccessor s : mapping.sources()) {
			bundle.put(s.alias(), s.read(args));
		}
		return bundle;
	}
}
