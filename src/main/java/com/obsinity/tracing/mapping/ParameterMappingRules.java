package com.obsinity.tracing.mapping;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

import org.springframework.util.ReflectionUtils;

import com.obsinity.tracing.exceptions.TracingConfigurationException;
import com.obsinity.tracing.model.MethodDescriptor;

/**
 * Programmatic parameter mapping rules, registered per contract (or as the default) with
 * {@code TracingEngine.registerProvider(contract, ProviderKind.PARAMETER_MAPPING_RULES, rules)}.
 *
 * <pre>{@code
 * ParameterMappingRules rules = new ParameterMappingRules();
 * rules.forAnything().with(Email.class).trace("from", "to").togetherAs("email");
 * rules.forContract(Mailer.class).ignore("password");
 * rules.forMethod(Mailer.class, "send", Email.class).addContextData("tenant");
 * }</pre>
 *
 * <p>Subclasses may configure rules in their constructor (so they can be named from {@code @TraceProviders}) or
 * override {@link #provideMappings} to replace the computed mappings entirely.
 */
public class ParameterMappingRules {

	private final List<ParameterRule> rules = new ArrayList<>();

	/** Rules for every method of every contract. */
	public RuleBuilder forAnything() {
		return new RuleBuilder(this, RuleScope.anything());
	}

	/** Rules for every method of {@code contract} and contracts extending it. */
	public RuleBuilder forContract(Class<?> contract) {
		return new RuleBuilder(this, RuleScope.contract(contract));
	}

	/** Rules for one method, identified by name and parameter types. */
	public RuleBuilder forMethod(Class<?> contract, String methodName, Class<?>... parameterTypes) {
		final Method method = ReflectionUtils.findMethod(contract, methodName, parameterTypes);
		if (method == null) {
			throw new TracingConfigurationException(contract.getName() + "#" + methodName,
					"No method " + methodName + Arrays.toString(parameterTypes) + " on " + contract.getName());
		}
		return new RuleBuilder(this, RuleScope.method(contract, method));
	}

	/**
	 * Returns the mappings for a method. The default returns {@code standard.get()}, the result of evaluating the
	 * registered rules and declarative annotations.
	 */
	public List<ParameterMapping> provideMappings(MethodDescriptor method, Supplier<List<ParameterMapping>> standard) {
		return standard.get();
	}

	void add(ParameterRule rule) {
		if (!rules.contains(rule)) rules.add(rule);
	}

	List<ParameterRule> rules() {
		return Collections.unmodifiableList(rules);
	}

	public boolean isEmpty() {
		return rules.stream().allMatch(r -> r.size() == 0);
	}
}
