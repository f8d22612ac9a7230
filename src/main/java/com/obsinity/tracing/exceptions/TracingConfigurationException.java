package com.obsinity.tracing.exceptions;

/**
 * Thrown while analyzing a contract, synthesizing its sink or registering providers: unsupported contract shape,
 * conflicting registrations, rules referencing members the parameter type does not have, keyword budget overflow.
 *
 * <p>The {@code key} names the offending contract, method or member.
 */
public final class TracingConfigurationException extends TracingException {
	private final String key;

	public TracingConfigurationException(String key, String message) {
		super(message);
		this.key = key;
	}

	public TracingConfigurationException(String key, String message, Throwable cause) {
		super(message, cause);
		this.key = key;
	}

	public String key() {
		return key;
	}
}
