package com.obsinity.tracing.mapping;

import java.util.function.Supplier;

/** Value computed at emission time, independent of the method's arguments. Binds only to the context slot. */
public final class ContextSupplier implements ValueConverter {

	private final Supplier<?> supplier;
	private final Class<?> outputType;

	public ContextSupplier(final Supplier<?> supplier, final Class<?> outputType) {
		this.supplier = supplier;
		this.outputType = outputType;
	}

	@Override
	public Object convert(final Object ignored) {
		return supplier.get();
	}

	@Override
	public Class<?> outputType() {
		return outputType;
	}

	@Override
	public String toString() {
		return "context(" + outputType.getSimpleName() + ")";
	}
}
