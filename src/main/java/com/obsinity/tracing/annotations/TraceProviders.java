package com.obsinity.tracing.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import com.obsinity.tracing.coercion.TraceSerializer;
import com.obsinity.tracing.context.TraceContextProvider;
import com.obsinity.tracing.mapping.ParameterMappingRules;

/**
 * Names provider classes for a contract. Each is instantiated through its no-arg constructor when the sink is built.
 * Programmatic registration for the same contract takes precedence. Leaving an attribute at its default means "not
 * declared".
 */
@Documented
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface TraceProviders {

	Class<? extends TraceSerializer> serializer() default TraceSerializer.class;

	Class<? extends TraceContextProvider> contextProvider() default TraceContextProvider.class;

	Class<? extends ParameterMappingRules> parameterRules() default ParameterMappingRules.class;
}
