package com.obsinity.tracing.model;

/** Which part of an operation's lifecycle a record or serialization request belongs to. */
public enum InvocationKind {
	METHOD_CALL,
	METHOD_COMPLETION,
	METHOD_FAULTED,
	BUNDLE_PARAMETERS
}
