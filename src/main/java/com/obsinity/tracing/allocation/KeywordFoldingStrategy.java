package com.obsinity.tracing.allocation;

import java.util.Set;

/**
 * Maps a method name to the key its automatic keyword bit is allocated for. Methods folding to the same key share a
 * bit, so e.g. {@code beginUpload} and {@code endUpload} can be enabled together.
 */
@FunctionalInterface
public interface KeywordFoldingStrategy {

	/** One bit per method name. */
	KeywordFoldingStrategy NONE = (methodName, contractMethodNames) -> methodName;

	/**
	 * @param methodName the method being keyed
	 * @param contractMethodNames every method name on the contract, lower-cased
	 */
	String fold(String methodName, Set<String> contractMethodNames);
}
