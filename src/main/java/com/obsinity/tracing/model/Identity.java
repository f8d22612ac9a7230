package com.obsinity.tracing.model;

import java.util.Objects;
import java.util.UUID;

/** Display name and stable 128-bit identifier of a contract's event source. */
public record Identity(String name, UUID id) {
	public Identity {
		Objects.requireNonNull(name, "name");
		Objects.requireNonNull(id, "id");
	}
}
