package com.obsinity.tracing;

import java.lang.reflect.Proxy;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;

import com.obsinity.tracing.allocation.IdentifierAllocator;
import com.obsinity.tracing.allocation.KeywordFoldingStrategy;
import com.obsinity.tracing.allocation.PrefixSuffixFoldingStrategy;
import com.obsinity.tracing.coercion.TypeCoercionResolver;
import com.obsinity.tracing.configuration.TracingProperties;
import com.obsinity.tracing.contract.ContractAnalyzer;
import com.obsinity.tracing.correlation.CorrelationScope;
import com.obsinity.tracing.correlation.CorrelationScopeManager;
import com.obsinity.tracing.mapping.ParameterMappingEngine;
import com.obsinity.tracing.provider.ProviderKind;
import com.obsinity.tracing.provider.ProviderRegistry;
import com.obsinity.tracing.proxy.LoggerInvocationHandler;
import com.obsinity.tracing.proxy.ProxyGenerator;
import com.obsinity.tracing.proxy.TracingInvocation;
import com.obsinity.tracing.sink.LoggingSinkBackend;
import com.obsinity.tracing.sink.Sink;
import com.obsinity.tracing.sink.SinkBackend;
import com.obsinity.tracing.sink.SinkSynthesizer;

/**
 * Entry point: sinks, loggers and tracing proxies for contracts, provider registration and correlation scopes.
 *
 * <p>In a Spring Boot application the engine is a bean; elsewhere use {@link #builder()}.
 *
 * <pre>{@code
 * TracingEngine engine = TracingEngine.builder().backend(new LoggingSinkBackend(null, EventLevel.VERBOSE, -1)).build();
 * CheckoutEvents events = engine.getLogger(CheckoutEvents.class);
 * events.cartPriced("c-1", 4200);
 * }</pre>
 */
@Component
public class TracingEngine {

	private final SinkSynthesizer synthesizer;
	private final ProviderRegistry providers;
	private final ProxyGenerator proxyGenerator;
	private final CorrelationScopeManager correlation;
	private final SinkBackend backend;
	private final TracingProperties properties;

	private final Map<Class<?>, Sink> sinks = new ConcurrentHashMap<>();
	private final Map<Class<?>, Object> loggers = new ConcurrentHashMap<>();

	public TracingEngine(
			SinkSynthesizer synthesizer,
			ProviderRegistry providers,
			ProxyGenerator proxyGenerator,
			CorrelationScopeManager correlation,
			SinkBackend backend,
			TracingProperties properties) {
		this.synthesizer = synthesizer;
		this.providers = providers;
		this.proxyGenerator = proxyGenerator;
		this.correlation = correlation;
		this.backend = backend;
		this.properties = properties;
	}

	/* --------------------- sinks --------------------- */

	/** The contract's sink, built on first request. Configuration errors surface here. */
	public Sink getSink(Class<?> contract) {
		final Sink existing = sinks.get(contract);
		if (existing != null) return existing;
		return sinks.computeIfAbsent(contract, c -> {
			providers.seal(c);
			return synthesizer.synthesize(c, backend, providers.resolve(c));
		});
	}

	/** The contract implemented by emitting: every event method writes its call event. */
	public <T> T getLogger(Class<T> contract) {
		final Sink sink = getSink(contract);
		return contract.cast(loggers.computeIfAbsent(contract, c -> Proxy.newProxyInstance(
				c.getClassLoader(), new Class<?>[] {c}, new LoggerInvocationHandler(sink))));
	}

	/** Keyword bits by name from the contract's keyword table (or its automatic keywords). */
	public long getKeywordValue(Class<?> contract, String name) {
		final Long value = getSink(contract).keywords().get(name);
		if (value == null) {
			throw new IllegalStateException("No keyword '" + name + "' on " + contract.getName());
		}
		return value;
	}

	/* --------------------- providers --------------------- */

	/**
	 * Registers a provider for a contract, or the default for every contract when {@code contract} is null. Must happen
	 * before the contract's sink is built.
	 */
	public void registerProvider(Class<?> contract, ProviderKind kind, Object instance) {
		providers.register(contract, kind, instance);
	}

	/* --------------------- proxies --------------------- */

	public <T> T createProxy(Class<T> contract, T real) {
		return createProxy(contract, contract, real);
	}

	/** Proxy implementing {@code executeContract} that logs through {@code logContract}'s sink. */
	public <T> T createProxy(Class<T> executeContract, Class<?> logContract, T real) {
		return createProxy(executeContract, logContract, real, properties.getProxy().isCreateCorrelationScope());
	}

	public <T> T createProxy(Class<T> executeContract, Class<?> logContract, T real, boolean createCorrelationScope) {
		return proxyGenerator.createProxy(executeContract, getSink(logContract), real, createCorrelationScope);
	}

	/* --------------------- correlation --------------------- */

	public CorrelationScope beginCorrelationScope() {
		return correlation.begin(false, null);
	}

	public CorrelationScope beginCorrelationScope(boolean reuseExisting) {
		return correlation.begin(reuseExisting, null);
	}

	public CorrelationScope beginCorrelationScope(boolean reuseExisting, UUID explicitId) {
		return correlation.begin(reuseExisting, explicitId);
	}

	public CorrelationScopeManager correlation() {
		return correlation;
	}

	public SinkBackend backend() {
		return backend;
	}

	/* --------------------- standalone wiring --------------------- */

	public static Builder builder() {
		return new Builder();
	}

	/** Wires an engine without Spring. */
	public static final class Builder {
		private SinkBackend backend;
		private KeywordFoldingStrategy foldingStrategy = new PrefixSuffixFoldingStrategy();
		private TracingProperties properties = new TracingProperties();

		private Builder() {}

		/** Defaults to a {@link LoggingSinkBackend} configured from the properties. */
		public Builder backend(SinkBackend value) {
			this.backend = value;
			return this;
		}

		public Builder foldingStrategy(KeywordFoldingStrategy value) {
			this.foldingStrategy = value;
			return this;
		}

		public Builder properties(TracingProperties value) {
			this.properties = value;
			return this;
		}

		public TracingEngine build() {
			final CorrelationScopeManager correlation = new CorrelationScopeManager();
			final SinkSynthesizer synthesizer = new SinkSynthesizer(
					new ContractAnalyzer(),
					new IdentifierAllocator(foldingStrategy, properties),
					new ParameterMappingEngine(),
					new TypeCoercionResolver(),
					correlation);
			final SinkBackend effective = backend != null
					? backend
					: new LoggingSinkBackend(new ObjectMapper(), properties.getLevel(), properties.getKeywords());
			return new TracingEngine(synthesizer, new ProviderRegistry(),
					new ProxyGenerator(new TracingInvocation(correlation)), correlation, effective, properties);
		}
	}
}
