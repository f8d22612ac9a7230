package com.obsinity.tracing.sink;

import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.BiConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.obsinity.tracing.correlation.CorrelationScopeManager;
import com.obsinity.tracing.model.MethodDescriptor;

/**
 * Call, completion and fault emitters of one contract method. Completion and fault are null when the contract turns
 * complements off.
 */
public final class MethodEmitters {

	private static final Logger log = LoggerFactory.getLogger(MethodEmitters.class);

	private final Emitter call;
	private final Emitter completion;
	private final Emitter fault;
	private final CorrelationScopeManager correlation;

	MethodEmitters(Emitter call, Emitter completion, Emitter fault, CorrelationScopeManager correlation) {
		this.call = call;
		this.completion = completion;
		this.fault = fault;
		this.correlation = correlation;
	}

	public Emitter call() {
		return call;
	}

	public Emitter completion() {
		return completion;
	}

	public Emitter fault() {
		return fault;
	}

	public MethodDescriptor descriptor() {
		return call.descriptor();
	}

	public void emitCall(Object[] args) {
		call.emit(args == null ? new Object[0] : args);
	}

	/**
	 * Emits completion for a returned value. A deferred result gets a continuation instead, running with the ambient
	 * correlation id of the caller; the result itself is returned untouched.
	 */
	public Object complete(Object result) {
		if (descriptor().deferred() && result instanceof CompletionStage<?> stage) {
			final BiConsumer<Object, Throwable> onSettled = correlation.wrapCallback((value, error) -> {
				try {
					if (error != null) fault(unwrap(error));
					else emitCompletion(value);
				} catch (RuntimeException e) {
					log.warn("Trace continuation of {} failed: {}", descriptor().eventName(), e.toString());
				}
			});
			stage.whenComplete(onSettled);
			return result;
		}
		emitCompletion(result);
		return result;
	}

	public void fault(Throwable error) {
		if (fault != null) fault.emit(error);
	}

	private void emitCompletion(Object value) {
		if (completion == null) return;
		if (completion.descriptor().parameters().isEmpty()) completion.emit();
		else completion.emit(value);
	}

	private static Throwable unwrap(Throwable error) {
		Throwable t = error;
		while (t instanceof CompletionException && t.getCause() != null) {
			t = t.getCause();
		}
		return t;
	}
}
