package com.obsinity.tracing.contract;

import java.lang.reflect.Method;
import java.util.List;

import com.obsinity.tracing.model.Identity;
import com.obsinity.tracing.model.MethodDescriptor;

/**
 * Result of analyzing a contract.
 *
 * @param declared events declared on the contract (and its super-interfaces), in declaration order
 * @param complements generated completion and fault events, ordered method by method, completion first
 * @param nonEvents methods excluded with {@code @NonEvent}
 */
public record ContractDescription(
		Class<?> contract,
		Identity identity,
		ContractSettings settings,
		List<MethodDescriptor> declared,
		List<MethodDescriptor> complements,
		List<Method> nonEvents) {

	public ContractDescription {
		declared = List.copyOf(declared);
		complements = List.copyOf(complements);
		nonEvents = List.copyOf(nonEvents);
	}
}
