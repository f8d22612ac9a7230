package com.obsinity.tracing.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Traces a member of the parameter instead of the parameter itself. Repeat it to explode one parameter into several
 * fields. The member is a field, getter or record component name; dotted paths walk nested members.
 */
@Documented
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Repeatable(TraceMembers.class)
public @interface TraceMember {

	String value();

	/** Output field name; defaults to the member path. */
	String as() default "";
}
