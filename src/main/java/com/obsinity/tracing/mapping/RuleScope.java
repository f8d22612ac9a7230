package com.obsinity.tracing.mapping;

import java.lang.reflect.Method;

import com.obsinity.tracing.model.MethodDescriptor;

/**
 * Which methods a rule applies to. Tiers are evaluated in order: the first tier with a matching value for a parameter
 * wins.
 *
 * @param contract null for any contract
 * @param method null for any method of {@code contract}
 */
public record RuleScope(Tier tier, Class<?> contract, Method method) {

	public enum Tier {
		METHOD,
		CONTRACT,
		ANYTHING
	}

	public static RuleScope anything() {
		return new RuleScope(Tier.ANYTHING, null, null);
	}

	public static RuleScope contract(Class<?> contract) {
		return new RuleScope(Tier.CONTRACT, contract, null);
	}

	public static RuleScope method(Class<?> contract, Method method) {
		return new RuleScope(Tier.METHOD, contract, method);
	}

	public boolean matches(MethodDescriptor descriptor) {
		if (contract != null && !contract.isAssignableFrom(descriptor.contract())) return false;
		if (method == null) return true;
		return !descriptor.generated() && method.equals(descriptor.method());
	}
}
