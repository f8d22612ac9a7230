package com.obsinity.tracing.proxy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.obsinity.tracing.TracingEngine;
import com.obsinity.tracing.annotations.NonEvent;
import com.obsinity.tracing.correlation.CorrelationScope;
import com.obsinity.tracing.correlation.CorrelationScopeManager;
import com.obsinity.tracing.model.EventRecord;
import com.obsinity.tracing.model.InvocationKind;
import com.obsinity.tracing.support.RecordingSinkBackend;

@DisplayName("ProxyGenerator: call, then completion or fault, around the real object")
class ProxyGeneratorTest {

	private RecordingSinkBackend backend;
	private TracingEngine engine;

	public interface OrderOperations {
		String place(String orderId, int quantity);

		void cancel(String orderId);

		CompletableFuture<Integer> reserve(String sku);

		@NonEvent
		String ping();
	}

	static class OrderService implements OrderOperations {
		CompletableFuture<Integer> pending = new CompletableFuture<>();
		int pings;

		@Override
		public String place(String orderId, int quantity) {
			return "ok-" + orderId;
		}

		@Override
		public void cancel(String orderId) {
			if (orderId.equals("bad")) throw new IllegalStateException("bad order");
		}

		@Override
		public CompletableFuture<Integer> reserve(String sku) {
			return pending;
		}

		@Override
		public String ping() {
			pings++;
			return "pong";
		}

		@Override
		public String toString() {
			return "OrderService";
		}
	}

	public interface Inventory {
		void adjust(String sku, int delta);

		void restock(String sku);

		void audit();
	}

	public interface InventoryLog {
		void adjust_1(String sku, int delta);

		void restock(String sku);
	}

	static class InventoryService implements Inventory {
		int audits;

		@Override
		public void adjust(String sku, int delta) {}

		@Override
		public void restock(String sku) {}

		@Override
		public void audit() {
			audits++;
		}
	}

	@BeforeEach
	void setUp() {
		backend = new RecordingSinkBackend();
		engine = TracingEngine.builder().backend(backend).build();
	}

	@Test
	@DisplayName("success writes the call, then a completion carrying the return value")
	void success() {
		OrderOperations proxy = engine.createProxy(OrderOperations.class, new OrderService());

		assertThat(proxy.place("o-1", 2)).isEqualTo("ok-o-1");

		assertThat(backend.eventNames()).containsExactly("place", "place_Completed");
		EventRecord completed = backend.last();
		assertThat(completed.kind()).isEqualTo(InvocationKind.METHOD_COMPLETION);
		assertThat(completed.field("ReturnValue")).isEqualTo("ok-o-1");
		assertThat(backend.records().get(0).payload()).containsExactly("o-1", 2);
	}

	@Test
	@DisplayName("void methods complete without a value")
	void voidCompletion() {
		OrderOperations proxy = engine.createProxy(OrderOperations.class, new OrderService());

		proxy.cancel("o-2");

		assertThat(backend.eventNames()).containsExactly("cancel", "cancel_Completed");
		assertThat(backend.last().fieldNames()).isEmpty();
	}

	@Test
	@DisplayName("a failing call writes the fault and rethrows the same exception")
	void fault() {
		OrderOperations proxy = engine.createProxy(OrderOperations.class, new OrderService());

		assertThatThrownBy(() -> proxy.cancel("bad"))
				.isExactlyInstanceOf(IllegalStateException.class)
				.hasMessage("bad order");

		assertThat(backend.eventNames()).containsExactly("cancel", "cancel_Faulted");
		assertThat(backend.last().kind()).isEqualTo(InvocationKind.METHOD_FAULTED);
		assertThat((String) backend.last().field("exception")).contains("bad order");
	}

	@Test
	@DisplayName("a failing backend on the fault path does not mask the real exception")
	void faultWhileBackendFails() {
		OrderOperations proxy = engine.createProxy(OrderOperations.class, new OrderService());
		backend.failWith(new IllegalStateException("disk full"));

		assertThatThrownBy(() -> proxy.cancel("bad")).hasMessage("bad order");
	}

	@Test
	@DisplayName("deferred results complete when the future does, under the caller's correlation id")
	void deferredSuccess() {
		OrderService real = new OrderService();
		OrderOperations proxy = engine.createProxy(OrderOperations.class, OrderOperations.class, real, true);

		CompletableFuture<Integer> result = proxy.reserve("sku-1");

		assertThat(result).isSameAs(real.pending);
		assertThat(backend.eventNames()).containsExactly("reserve");
		UUID callId = backend.last().correlationId();
		assertThat(callId).isNotNull();
		assertThat(engine.correlation().hasActiveScope()).isFalse();

		real.pending.complete(7);

		assertThat(backend.eventNames()).containsExactly("reserve", "reserve_Completed");
		assertThat(backend.last().field("ReturnValue")).isEqualTo(7);
		assertThat(backend.last().correlationId()).isEqualTo(callId);
	}

	@Test
	@DisplayName("a deferred failure is written as a fault; the future still fails for the caller")
	void deferredFailure() {
		OrderService real = new OrderService();
		OrderOperations proxy = engine.createProxy(OrderOperations.class, real);

		CompletableFuture<Integer> result = proxy.reserve("sku-2");
		real.pending.completeExceptionally(new IOException("warehouse offline"));

		assertThat(backend.eventNames()).containsExactly("reserve", "reserve_Faulted");
		assertThat((String) backend.last().field("exception")).contains("warehouse offline");
		assertThat(result).isCompletedExceptionally();
	}

	@Test
	@DisplayName("the proxy's scope reuses an ambient id and is closed after the call")
	void correlationScope() {
		OrderOperations proxy = engine.createProxy(OrderOperations.class, new OrderService());

		proxy.place("o-3", 1);
		UUID first = backend.records().get(0).correlationId();
		assertThat(first).isNotNull().isEqualTo(backend.last().correlationId());
		assertThat(engine.correlation().hasActiveScope()).isFalse();

		try (CorrelationScope outer = engine.beginCorrelationScope()) {
			proxy.place("o-4", 1);
			assertThat(backend.last().correlationId()).isEqualTo(outer.id());
		}

		backend.clear();
		OrderOperations unscoped = engine.createProxy(OrderOperations.class, OrderOperations.class,
				new OrderService(), false);
		unscoped.place("o-5", 1);
		assertThat(backend.records()).allSatisfy(r -> assertThat(r.correlationId()).isNull());
	}

	@Test
	@DisplayName("non-event and Object methods go straight to the real object")
	void passThrough() {
		OrderService real = new OrderService();
		OrderOperations proxy = engine.createProxy(OrderOperations.class, real);

		assertThat(proxy.ping()).isEqualTo("pong");
		assertThat(proxy.toString()).isEqualTo("OrderService");
		assertThat(proxy).isEqualTo(proxy);

		assertThat(real.pings).isEqualTo(1);
		assertThat(backend.records()).isEmpty();
	}

	@Test
	@DisplayName("a separate log contract is matched by name, indexed name, then arity")
	void separateLogContract() {
		InventoryService real = new InventoryService();
		Inventory proxy = engine.createProxy(Inventory.class, InventoryLog.class, real);

		proxy.adjust("sku-1", -2);
		proxy.restock("sku-1");
		proxy.audit();

		assertThat(backend.eventNames())
				.containsExactly("adjust_1", "adjust_1_Completed", "restock", "restock_Completed");
		assertThat(backend.records().get(0).payload()).containsExactly("sku-1", -2);
		assertThat(real.audits).isEqualTo(1);
	}

	@Test
	@DisplayName("only interfaces implemented by the real object can be proxied")
	void argumentChecks() {
		ProxyGenerator generator = new ProxyGenerator(new TracingInvocation(new CorrelationScopeManager()));
		var sink = engine.getSink(OrderOperations.class);

		assertThatThrownBy(() -> generator.createProxy(Object.class, sink, new Object(), false))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> generator.createProxy(OrderOperations.class, sink, null, false))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
