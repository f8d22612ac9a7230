package com.obsinity.tracing.correlation;

import java.util.UUID;

/**
 * A live correlation scope. Closing it restores the enclosing scope's id as the ambient id. Scopes must be closed in
 * reverse order of creation; use try-with-resources.
 *
 * <pre>{@code
 * try (CorrelationScope scope = engine.beginCorrelationScope()) {
 *     orders.place(cart);      // every record carries scope.id()
 * }
 * }</pre>
 */
public final class CorrelationScope implements AutoCloseable {

	private final CorrelationScopeManager manager;
	private final UUID id;
	private final CorrelationScope parent;
	private final boolean newScope;
	private boolean closed;

	CorrelationScope(CorrelationScopeManager manager, UUID id, CorrelationScope parent, boolean newScope) {
		this.manager = manager;
		this.id = id;
		this.parent = parent;
		this.newScope = newScope;
	}

	/** The id this scope makes ambient. */
	public UUID id() {
		return id;
	}

	/** The ambient id when this scope was opened, or null if there was none. */
	public UUID previousId() {
		return parent == null ? null : parent.id;
	}

	CorrelationScope parent() {
		return parent;
	}

	/** @return false when the scope reused its parent's id. */
	public boolean isNewScope() {
		return newScope;
	}

	public boolean isClosed() {
		return closed;
	}

	void markClosed() {
		closed = true;
	}

	@Override
	public void close() {
		if (closed) return;
		manager.end(this);
	}

	@Override
	public String toString() {
		return "CorrelationScope[" + id + (newScope ? "" : ", reused") + "]";
	}
}
