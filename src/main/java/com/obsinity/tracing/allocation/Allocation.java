package com.obsinity.tracing.allocation;

import java.util.List;
import java.util.Map;

import com.obsinity.tracing.model.MethodDescriptor;

/**
 * Ids and keyword bits assigned to a contract's events.
 *
 * @param declared declared events with ids and keywords filled in, in declaration order
 * @param complements generated complements, sharing their call's keywords
 * @param keywords keyword name to bit mask: the contract's keyword table, or the automatic bits by folded name
 * @param tasks task table constants
 * @param opcodes opcode table constants
 */
public record Allocation(
		List<MethodDescriptor> declared,
		List<MethodDescriptor> complements,
		Map<String, Long> keywords,
		Map<String, Integer> tasks,
		Map<String, Integer> opcodes) {

	public Allocation {
		declared = List.copyOf(declared);
		complements = List.copyOf(complements);
		keywords = Map.copyOf(keywords);
		tasks = Map.copyOf(tasks);
		opcodes = Map.copyOf(opcodes);
	}
}
