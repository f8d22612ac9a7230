package com.obsinity.tracing.mapping;

import java.util.List;

/**
 * One output field: its name and the values feeding it. More than one source makes the field a bundle, serialized as
 * a map keyed by each source's alias.
 */
public record ParameterMapping(String name, List<SourceAccessor> sources) {

	public ParameterMapping {
		sources = List.copyOf(sources);
	}

	public boolean isBundle() {
		return sources.size() > 1;
	}

	public boolean hasSource() {
		return !sources.isEmpty();
	}
}
