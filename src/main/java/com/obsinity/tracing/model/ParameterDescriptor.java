package com.obsinity.tracing.model;

import java.lang.annotation.Annotation;
import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Set;

import org.springframework.core.annotation.AnnotatedElementUtils;

/**
 * One declared (or synthesized) parameter of an event method.
 *
 * @param source the reflective parameter carrying annotations; null for synthesized parameters such as the
 *     completion {@code ReturnValue}
 */
public record ParameterDescriptor(String name, Class<?> type, Type genericType, int position, AnnotatedElement source) {

	public <A extends Annotation> A annotation(Class<A> annotationType) {
		return (source == null) ? null : AnnotatedElementUtils.findMergedAnnotation(source, annotationType);
	}

	public <A extends Annotation> List<A> repeatable(Class<A> annotationType) {
		if (source == null) return List.of();
		Set<A> found = AnnotatedElementUtils.findMergedRepeatableAnnotations(source, annotationType);
		return List.copyOf(found);
	}

	public boolean hasAnnotation(Class<? extends Annotation> annotationType) {
		return source != null && AnnotatedElementUtils.hasAnnotation(source, annotationType);
	}
}
