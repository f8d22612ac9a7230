package com.obsinity.tracing.correlation;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.obsinity.tracing.exceptions.CorrelationConsistencyException;
import com.obsinity.tracing.utils.TracingIdGenerator;

/**
 * Flow-local stack of correlation scopes (top = current).
 *
 * <p>The stack is a chain of immutable {@link CorrelationScope} links held in an {@link InheritableThreadLocal}, so a
 * thread started inside a scope sees it as ambient. Work that hops threads through executors or future callbacks
 * keeps its ambient id by going through the {@code wrap(..)} helpers, which capture the current scope and reinstate
 * it around the task.
 *
 * <p>The state is shared by every manager instance in the process: there is one ambient id per logical flow.
 */
@Component
public class CorrelationScopeManager {

	private static final Logger log = LoggerFactory.getLogger(CorrelationScopeManager.class);

	private static final InheritableThreadLocal<CorrelationScope> CURRENT = new InheritableThreadLocal<>();

	/* --------------------- scope stack --------------------- */

	/** Opens a scope with a fresh id. */
	public CorrelationScope begin() {
		return begin(false, null);
	}

	/**
	 * Opens a scope.
	 *
	 * @param reuseExisting keep the current ambient id if there is one
	 * @param explicitId id to use; wins over {@code reuseExisting}
	 */
	public CorrelationScope begin(final boolean reuseExisting, final UUID explicitId) {
		final CorrelationScope parent = CURRENT.get();
		final UUID id;
		final boolean fresh;
		if (explicitId != null) {
			id = explicitId;
			fresh = parent == null || !explicitId.equals(parent.id());
		} else if (reuseExisting && parent != null) {
			id = parent.id();
			fresh = false;
		} else {
			id = TracingIdGenerator.generate();
			fresh = true;
		}
		final CorrelationScope scope = new CorrelationScope(this, id, parent, fresh);
		CURRENT.set(scope);
		return scope;
	}

	void end(final CorrelationScope scope) {
		final CorrelationScope top = CURRENT.get();
		if (top != scope) {
			log.error("Correlation scope {} closed out of order; innermost live scope is {}", scope, top);
			throw new CorrelationConsistencyException(
					scope.id(), "Correlation scope " + scope.id() + " is not the innermost live scope");
		}
		scope.markClosed();
		if (scope.parent() == null) {
			CURRENT.remove();
		} else {
			CURRENT.set(scope.parent());
		}
	}

	/** Ambient id of the innermost live scope. */
	public Optional<UUID> currentId() {
		return Optional.ofNullable(currentIdOrNull());
	}

	public UUID currentIdOrNull() {
		final CorrelationScope top = CURRENT.get();
		return top == null ? null : top.id();
	}

	/** Id of the scope enclosing the innermost one, or null. */
	public UUID relatedIdOrNull() {
		final CorrelationScope top = CURRENT.get();
		return top == null ? null : top.previousId();
	}

	public boolean hasActiveScope() {
		return CURRENT.get() != null;
	}

	/* --------------------- scoped execution --------------------- */

	/** Runs inside a scope that reuses the ambient id when one exists. */
	public void doInScope(final Runnable action) {
		try (CorrelationScope ignored = begin(true, null)) {
			action.run();
		}
	}

	public <V> V doInScope(final Supplier<V> action) {
		try (CorrelationScope ignored = begin(true, null)) {
			return action.get();
		}
	}

	/** Runs inside a scope with a fresh id. */
	public void doInNewScope(final Runnable action) {
		try (CorrelationScope ignored = begin(false, null)) {
			action.run();
		}
	}

	public <V> V doInNewScope(final Supplier<V> action) {
		try (CorrelationScope ignored = begin(false, null)) {
			return action.get();
		}
	}

	/* --------------------- propagation --------------------- */

	public Runnable wrap(final Runnable task) {
		final CorrelationScope captured = CURRENT.get();
		return () -> {
			final CorrelationScope previous = swapIn(captured);
			try {
				task.run();
			} finally {
				restore(previous);
			}
		};
	}

	public <V> Callable<V> wrapCallable(final Callable<V> task) {
		final CorrelationScope captured = CURRENT.get();
		return () -> {
			final CorrelationScope previous = swapIn(captured);
			try {
				return task.call();
			} finally {
				restore(previous);
			}
		};
	}

	public <V> Supplier<V> wrapSupplier(final Supplier<V> task) {
		final CorrelationScope captured = CURRENT.get();
		return () -> {
			final CorrelationScope previous = swapIn(captured);
			try {
				return task.get();
			} finally {
				restore(previous);
			}
		};
	}

	public <T, U> BiConsumer<T, U> wrapCallback(final BiConsumer<T, U> callback) {
		final CorrelationScope captured = CURRENT.get();
		return (t, u) -> {
			final CorrelationScope previous = swapIn(captured);
			try {
				callback.accept(t, u);
			} finally {
				restore(previous);
			}
		};
	}

	/** Executor whose tasks run with the ambient scope of the thread that submitted them. */
	public Executor wrap(final Executor executor) {
		return task -> executor.execute(wrap(task));
	}

	private static CorrelationScope swapIn(final CorrelationScope captured) {
		final CorrelationScope previous = CURRENT.get();
		if (captured == null) {
			CURRENT.remove();
		} else {
			CURRENT.set(captured);
		}
		return previous;
	}

	private static void restore(final CorrelationScope previous) {
		if (previous == null) {
			CURRENT.remove();
		} else {
			CURRENT.set(previous);
		}
	}
}
