package com.obsinity.tracing.context;

import java.util.Arrays;

import org.springframework.core.annotation.AnnotatedElementUtils;

import com.obsinity.tracing.annotations.ProvideContext;
import com.obsinity.tracing.model.InvocationContext;

/**
 * Supplies the trailing {@code Context} field of a record, e.g. the current user or request id.
 *
 * <p>Only invoked when the event is enabled on the backend, so it may do non-trivial work.
 */
@FunctionalInterface
public interface TraceContextProvider {

	String provideContext(InvocationContext context);

	/**
	 * Whether this provider contributes to events of the given invocation. Honors {@link ProvideContext} on the method,
	 * then on the contract; defaults to true.
	 */
	default boolean shouldProvideContext(InvocationContext context) {
		ProvideContext annotation = AnnotatedElementUtils.findMergedAnnotation(context.method(), ProvideContext.class);
		if (annotation == null) {
			annotation = AnnotatedElementUtils.findMergedAnnotation(context.contract(), ProvideContext.class);
		}
		if (annotation == null) return true;
		return annotation.value() && Arrays.asList(annotation.enabledFor()).contains(context.kind());
	}
}
