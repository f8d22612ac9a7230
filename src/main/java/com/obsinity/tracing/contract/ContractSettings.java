package com.obsinity.tracing.contract;

import java.util.UUID;

import com.obsinity.tracing.annotations.TraceContract;
import com.obsinity.tracing.exceptions.TracingConfigurationException;
import com.obsinity.tracing.model.EventLevel;

/** Contract-wide settings from {@link TraceContract}, or the defaults when the annotation is absent. */
public record ContractSettings(
		String name,
		UUID id,
		EventLevel level,
		long keywords,
		int version,
		Class<?> keywordTable,
		Class<?> taskTable,
		Class<?> opcodeTable,
		boolean autoKeywords,
		boolean throwOnWriteError,
		boolean implementComplementMethods) {

	static ContractSettings of(Class<?> contract, TraceContract annotation) {
		if (annotation == null) {
			return new ContractSettings(
					contract.getSimpleName(), null, null, 0L, 0, null, null, null, true, false, true);
		}
		final String name = annotation.name().isBlank() ? contract.getSimpleName() : annotation.name();
		UUID id = null;
		if (!annotation.id().isBlank()) {
			try {
				id = UUID.fromString(annotation.id());
			} catch (IllegalArgumentException e) {
				throw new TracingConfigurationException(
						contract.getName(), "Invalid contract id '" + annotation.id() + "'", e);
			}
		}
		return new ContractSettings(
				name,
				id,
				annotation.level() == EventLevel.INHERIT ? null : annotation.level(),
				annotation.keywords(),
				annotation.version(),
				table(annotation.keywordTable()),
				table(annotation.taskTable()),
				table(annotation.opcodeTable()),
				annotation.autoKeywords(),
				annotation.throwOnWriteError(),
				annotation.implementComplementMethods());
	}

	private static Class<?> table(Class<?> declared) {
		return declared == void.class ? null : declared;
	}
}
