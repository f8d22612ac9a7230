package com.obsinity.tracing.coercion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.obsinity.tracing.annotations.TraceAs;
import com.obsinity.tracing.annotations.TraceSerialization;
import com.obsinity.tracing.contract.ContractAnalyzer;
import com.obsinity.tracing.exceptions.RuntimeSerializationException;
import com.obsinity.tracing.mapping.ParameterMapping;
import com.obsinity.tracing.mapping.ParameterMappingEngine;
import com.obsinity.tracing.mapping.ParameterMappingRules;
import com.obsinity.tracing.model.EventLevel;
import com.obsinity.tracing.model.MethodDescriptor;
import com.obsinity.tracing.support.RecordingSinkBackend;

@DisplayName("TypeCoercionResolver: native, unwrapped, stringified or serialized")
class TypeCoercionResolverTest {

	private final TypeCoercionResolver resolver = new TypeCoercionResolver();
	private final ContractAnalyzer analyzer = new ContractAnalyzer();
	private final ParameterMappingEngine mappingEngine = new ParameterMappingEngine();
	private final TraceSerializer json = new JsonTraceSerializer();

	enum Color {
		RED
	}

	record Address(String city) {}

	@TraceSerialization(EventLevel.WARNING)
	record Money(long cents) {}

	interface Values {
		void all(
				String s,
				int i,
				Color color,
				UUID id,
				char c,
				Optional<String> name,
				AtomicLong counter,
				AtomicReference<Address> holder,
				Address address,
				@TraceSerialization(EventLevel.LOG_ALWAYS) Address always,
				Money money);

		@TraceSerialization(EventLevel.ERROR)
		void annotatedMethod(Address address);

		@TraceAs("data")
		void bundled(String a, int b);
	}

	@TraceSerialization(EventLevel.CRITICAL)
	interface AnnotatedContract {
		void x(Address address);
	}

	private List<CoercionDecision> decisions(Class<?> contract, String eventName, TraceSerializer serializer) {
		MethodDescriptor d = analyzer.analyze(contract).declared().stream()
				.filter(m -> m.eventName().equals(eventName))
				.findFirst()
				.orElseThrow();
		return mappingEngine.map(d, new ParameterMappingRules(), null).stream()
				.map(m -> resolver.resolve(d, m, serializer))
				.toList();
	}

	@ParameterizedTest
	@ValueSource(classes = {String.class, int.class, Integer.class, long.class, double.class, boolean.class,
			UUID.class, Color.class})
	void nativeTypes(Class<?> type) {
		assertThat(resolver.isNative(type)).isTrue();
	}

	@ParameterizedTest
	@ValueSource(classes = {char.class, Character.class, Object.class, Address.class, List.class})
	void nonNativeTypes(Class<?> type) {
		assertThat(resolver.isNative(type)).isFalse();
	}

	@Test
	@DisplayName("each parameter gets the decision its declared type calls for")
	void decisionsByType() {
		List<CoercionDecision> d = decisions(Values.class, "all", json);

		assertThat(d).extracting(CoercionDecision::kind).containsExactly(
				CoercionDecision.Kind.NATIVE,
				CoercionDecision.Kind.NATIVE,
				CoercionDecision.Kind.NATIVE,
				CoercionDecision.Kind.NATIVE,
				CoercionDecision.Kind.STRINGIFY,
				CoercionDecision.Kind.DEREFERENCE,
				CoercionDecision.Kind.DEREFERENCE,
				CoercionDecision.Kind.SERIALIZE,
				CoercionDecision.Kind.SERIALIZE,
				CoercionDecision.Kind.SERIALIZE,
				CoercionDecision.Kind.SERIALIZE);
		assertThat(d.get(5).targetType()).isEqualTo(String.class);
		assertThat(d.get(6).targetType()).isEqualTo(Long.class);
	}

	@Test
	@DisplayName("serialization level: parameter, then type, then method, then contract, then serializer default")
	void levelPrecedence() {
		List<CoercionDecision> all = decisions(Values.class, "all", json);
		assertThat(all.get(7).serializationLevel()).isEqualTo(EventLevel.VERBOSE);
		assertThat(all.get(8).serializationLevel()).isEqualTo(EventLevel.VERBOSE);
		assertThat(all.get(9).serializationLevel()).isEqualTo(EventLevel.LOG_ALWAYS);
		assertThat(all.get(10).serializationLevel()).isEqualTo(EventLevel.WARNING);

		assertThat(decisions(Values.class, "annotatedMethod", json).get(0).serializationLevel())
				.isEqualTo(EventLevel.ERROR);
		assertThat(decisions(AnnotatedContract.class, "x", json).get(0).serializationLevel())
				.isEqualTo(EventLevel.CRITICAL);
		assertThat(decisions(Values.class, "annotatedMethod", new ToStringTraceSerializer()).get(0)
				.serializationLevel()).isEqualTo(EventLevel.ERROR);
		assertThat(decisions(AnnotatedContract.class, "x", new NullTraceSerializer()).get(0).serializationLevel())
				.isEqualTo(EventLevel.CRITICAL);
	}

	@Test
	@DisplayName("the null serializer never runs")
	void nullSerializer() {
		CoercionDecision d = decisions(Values.class, "all", new NullTraceSerializer()).get(8);

		assertThat(d.serializationLevel()).isNull();
		assertThat(resolver.shouldSerialize(d.serializationLevel(), new RecordingSinkBackend())).isFalse();
	}

	@Test
	@DisplayName("bundles are always serialized as a map")
	void bundles() {
		List<CoercionDecision> d = decisions(Values.class, "bundled", json);

		assertThat(d).singleElement().satisfies(c -> {
			assertThat(c.kind()).isEqualTo(CoercionDecision.Kind.SERIALIZE);
			assertThat(c.serializationContext().valueType()).isEqualTo(Map.class);
			assertThat(c.serializationContext().fieldName()).isEqualTo("data");
		});
	}

	@Test
	@DisplayName("shouldSerialize: LOG_ALWAYS always, otherwise only while the backend is enabled at the level")
	void gating() {
		RecordingSinkBackend backend = new RecordingSinkBackend(EventLevel.INFORMATIONAL);

		assertThat(resolver.shouldSerialize(EventLevel.LOG_ALWAYS, backend)).isTrue();
		assertThat(resolver.shouldSerialize(EventLevel.WARNING, backend)).isTrue();
		assertThat(resolver.shouldSerialize(EventLevel.VERBOSE, backend)).isFalse();
		assertThat(resolver.shouldSerialize(null, backend)).isFalse();
	}

	@Test
	@DisplayName("coerce: unwraps holders, stringifies chars, serializes the rest")
	void coerce() {
		assertThat(resolver.coerce(Optional.of("x"), CoercionDecision.dereference(String.class), json)).isEqualTo("x");
		assertThat(resolver.coerce(Optional.empty(), CoercionDecision.dereference(String.class), json)).isNull();
		assertThat(resolver.coerce(new AtomicLong(5), CoercionDecision.dereference(Long.class), json)).isEqualTo(5L);
		assertThat(resolver.coerce('z', CoercionDecision.stringify(), json)).isEqualTo("z");

		CoercionDecision serialize = decisions(Values.class, "all", json).get(8);
		assertThat(resolver.coerce(new Address("Cork"), serialize, json)).isEqualTo("{\"city\":\"Cork\"}");
	}

	@Test
	@DisplayName("a failing serializer surfaces as RuntimeSerializationException with the cause")
	void serializerFailure() {
		TraceSerializer failing = new TraceSerializer(EventLevel.LOG_ALWAYS) {
			@Override
			public String serialize(Object value, SerializationContext context) {
				throw new IllegalStateException("boom");
			}
		};
		CoercionDecision d = decisions(Values.class, "all", failing).get(8);

		assertThatThrownBy(() -> resolver.coerce(new Address("x"), d, failing))
				.isInstanceOf(RuntimeSerializationException.class)
				.hasMessageContaining("address")
				.hasCauseInstanceOf(IllegalStateException.class);
	}
}
