package com.obsinity.tracing.mapping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.obsinity.tracing.annotations.ProvideContext;
import com.obsinity.tracing.annotations.TraceAs;
import com.obsinity.tracing.annotations.TraceIgnore;
import com.obsinity.tracing.annotations.TraceMember;
import com.obsinity.tracing.annotations.TraceTransform;
import com.obsinity.tracing.context.TraceContextProvider;
import com.obsinity.tracing.contract.ContractAnalyzer;
import com.obsinity.tracing.contract.ContractDescription;
import com.obsinity.tracing.exceptions.TracingConfigurationException;
import com.obsinity.tracing.model.InvocationKind;
import com.obsinity.tracing.model.MethodDescriptor;

@DisplayName("ParameterMappingEngine: parameters to output fields")
class ParameterMappingEngineTest {

	private final ContractAnalyzer analyzer = new ContractAnalyzer();
	private final ParameterMappingEngine engine = new ParameterMappingEngine();

	record Address(String city, String zip) {}

	public static final class Masking {
		public static String mask(String email) {
			return email.replaceAll("^[^@]+", "***");
		}

		private Masking() {}
	}

	interface Account {
		void login(String user, int attempts);

		@TraceAs("data")
		void loginBundled(String user, String realm);

		void changePassword(String user, @TraceIgnore String password);

		void ship(@TraceMember("city") @TraceMember(value = "zip", as = "postcode") Address address);

		void charge(@TraceAs(name = "amount", format = "%s EUR") double value);

		void signup(@TraceTransform(type = Masking.class, method = "mask") String email);

		void pair(String p1, String p2);

		@ProvideContext(false)
		void quiet(String user);

		String lookup(String user);

		void move(Address from, Address to);

		void annotate(String context, int n);
	}

	interface Broken {
		void ship(@TraceMember("country") Address address);
	}

	private MethodDescriptor method(Class<?> contract, String eventName) {
		ContractDescription d = analyzer.analyze(contract);
		List<MethodDescriptor> all = new ArrayList<>(d.declared());
		all.addAll(d.complements());
		return all.stream().filter(m -> m.eventName().equals(eventName)).findFirst().orElseThrow();
	}

	private List<ParameterMapping> map(String eventName) {
		return engine.map(method(Account.class, eventName), new ParameterMappingRules(), null);
	}

	private List<ParameterMapping> map(String eventName, ParameterMappingRules rules) {
		return engine.map(method(Account.class, eventName), rules, null);
	}

	private static List<String> names(List<ParameterMapping> mappings) {
		return mappings.stream().map(ParameterMapping::name).toList();
	}

	private static List<String> aliases(ParameterMapping mapping) {
		return mapping.sources().stream().map(SourceAccessor::alias).toList();
	}

	@Nested
	@DisplayName("declarative")
	class Declarative {

		@Test
		@DisplayName("identity: one field per parameter, in order, named after it")
		void identity() {
			List<ParameterMapping> m = map("login");

			assertThat(names(m)).containsExactly("user", "attempts");
			assertThat(m).noneMatch(ParameterMapping::isBundle);
			assertThat(m.get(1).sources().get(0).position()).isEqualTo(1);
			assertThat(m.get(1).sources().get(0).valueType()).isEqualTo(int.class);
		}

		@Test
		@DisplayName("a method-level @TraceAs bundles every parameter into one field")
		void methodTraceAs() {
			List<ParameterMapping> m = map("loginBundled");

			assertThat(names(m)).containsExactly("data");
			assertThat(m.get(0).isBundle()).isTrue();
			assertThat(aliases(m.get(0))).containsExactly("user", "realm");
		}

		@Test
		@DisplayName("@TraceIgnore drops the parameter")
		void ignore() {
			assertThat(names(map("changePassword"))).containsExactly("user");
		}

		@Test
		@DisplayName("@TraceMember explodes a parameter into member fields")
		void members() {
			List<ParameterMapping> m = map("ship");

			assertThat(names(m)).containsExactly("city", "postcode");
			Object[] args = {new Address("Dublin", "D02")};
			assertThat(m.get(0).sources().get(0).read(args)).isEqualTo("Dublin");
			assertThat(m.get(1).sources().get(0).read(args)).isEqualTo("D02");
			assertThat(m.get(1).sources().get(0).valueType()).isEqualTo(String.class);
		}

		@Test
		@DisplayName("@TraceAs renames and formats")
		void renameAndFormat() {
			List<ParameterMapping> m = map("charge");

			assertThat(names(m)).containsExactly("amount");
			assertThat(m.get(0).sources().get(0).read(new Object[] {12.5d})).isEqualTo("12.5 EUR");
		}

		@Test
		@DisplayName("@TraceTransform applies a static method")
		void transform() {
			List<ParameterMapping> m = map("signup");

			assertThat(m.get(0).sources().get(0).read(new Object[] {"jane@example.com"})).isEqualTo("***@example.com");
		}

		@Test
		@DisplayName("a member that does not exist fails when the mapping is built")
		void missingMember() {
			MethodDescriptor ship = method(Broken.class, "ship");

			assertThatThrownBy(() -> engine.map(ship, new ParameterMappingRules(), null))
					.isInstanceOf(TracingConfigurationException.class)
					.hasMessageContaining("country");
		}

		@Test
		@DisplayName("generated completions carry the return value as-is")
		void completion() {
			List<ParameterMapping> m = map("lookup_Completed");

			assertThat(names(m)).containsExactly(ContractAnalyzer.RETURN_VALUE);
		}
	}

	@Nested
	@DisplayName("rules")
	class Rules {

		@Test
		@DisplayName("trace(p1, p2) bundles both under the default name")
		void traceBundles() {
			ParameterMappingRules rules = new ParameterMappingRules();
			rules.forAnything().trace("p1", "p2");

			List<ParameterMapping> m = map("pair", rules);

			assertThat(names(m)).containsExactly("data");
			assertThat(aliases(m.get(0))).containsExactly("p1", "p2");
		}

		@Test
		@DisplayName("as(..) renames values one-to-one, or the group when it has one value")
		void aliasRenames() {
			ParameterMappingRules oneToOne = new ParameterMappingRules();
			oneToOne.forAnything().trace("p1", "p2").as("first", "second");
			assertThat(aliases(map("pair", oneToOne).get(0))).containsExactly("first", "second");

			ParameterMappingRules single = new ParameterMappingRules();
			single.forAnything().trace("p1").as("first").trace("p2").as("second");
			assertThat(names(map("pair", single))).containsExactly("first", "second");

			ParameterMappingRules mismatch = new ParameterMappingRules();
			assertThatThrownBy(() -> mismatch.forAnything().trace("p1", "p2").as("a", "b", "c"))
					.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("togetherAs(..) names the bundle")
		void togetherAs() {
			ParameterMappingRules rules = new ParameterMappingRules();
			rules.forContract(Account.class).trace("p1", "p2").togetherAs("pair");

			List<ParameterMapping> m = map("pair", rules);

			assertThat(names(m)).containsExactly("pair");
			assertThat(aliases(m.get(0))).containsExactly("p1", "p2");
		}

		@Test
		@DisplayName("ignore(..) drops matching parameters by name or type")
		void ignore() {
			ParameterMappingRules byName = new ParameterMappingRules();
			byName.forContract(Account.class).ignore("attempts");
			assertThat(names(map("login", byName))).containsExactly("user");

			ParameterMappingRules byType = new ParameterMappingRules();
			byType.forAnything().ignore(String.class);
			assertThat(names(map("login", byType))).containsExactly("attempts");
		}

		@Test
		@DisplayName("method rules beat contract rules, which beat rules for anything")
		void tierPrecedence() {
			ParameterMappingRules rules = new ParameterMappingRules();
			rules.forAnything().trace("user").as("anyone");
			rules.forContract(Account.class).trace("user").as("accountUser");
			rules.forMethod(Account.class, "login", String.class, int.class).trace("user").as("loginUser");

			assertThat(names(map("login", rules))).containsExactly("loginUser", "attempts");
			assertThat(names(map("quiet", rules))).containsExactly("accountUser");
		}

		@Test
		@DisplayName("forMethod(..) rejects methods the contract does not have")
		void unknownMethod() {
			assertThatThrownBy(() -> new ParameterMappingRules().forMethod(Account.class, "nope"))
					.isInstanceOf(TracingConfigurationException.class);
		}

		@Test
		@DisplayName("typed rules trace members of every parameter of that type")
		void typed() {
			ParameterMappingRules rules = new ParameterMappingRules();
			rules.forAnything().with(Address.class).trace("city").as("town");

			List<ParameterMapping> m = map("ship", rules);

			assertThat(names(m)).containsExactly("town");
			assertThat(m.get(0).sources().get(0).read(new Object[] {new Address("Cork", "T12")})).isEqualTo("Cork");
		}

		@Test
		@DisplayName("values sharing a key inside one bundle are qualified by parameter name")
		void collidingKeys() {
			ParameterMappingRules rules = new ParameterMappingRules();
			rules.forAnything().with(Address.class).trace("city");

			List<ParameterMapping> m = map("move", rules);

			assertThat(names(m)).containsExactly("data");
			assertThat(aliases(m.get(0))).containsExactly("from.city", "to.city");
			Object[] args = {new Address("Dublin", "D02"), new Address("Cork", "T12")};
			assertThat(m.get(0).sources()).extracting(s -> s.read(args)).containsExactly("Dublin", "Cork");
		}

		@Test
		@DisplayName("the same parameter traced twice under one key is numbered")
		void repeatedKeys() {
			ParameterMappingRules rules = new ParameterMappingRules();
			rules.forAnything().trace("p1", "p1");

			assertThat(aliases(map("pair", rules).get(0))).containsExactly("p1.p1", "p1.p1_1");
		}

		@Test
		@DisplayName("typed rules check members against the type when registered")
		void typedValidation() {
			assertThatThrownBy(() -> new ParameterMappingRules().forAnything().with(Address.class).trace("country"))
					.isInstanceOf(TracingConfigurationException.class);
		}

		@Test
		@DisplayName("addContext(..) appends a computed field")
		void addContext() {
			ParameterMappingRules rules = new ParameterMappingRules();
			rules.forAnything().addContext("tenant", String.class, () -> "acme");

			List<ParameterMapping> m = map("login", rules);

			assertThat(names(m)).containsExactly("user", "attempts", "tenant");
			SourceAccessor tenant = m.get(2).sources().get(0);
			assertThat(tenant.isContext()).isTrue();
			assertThat(tenant.read(new Object[] {"u", 1})).isEqualTo("acme");
		}

		@Test
		@DisplayName("provideMappings(..) can replace the computed mappings")
		void override() {
			ParameterMappingRules reversed = new ParameterMappingRules() {
				@Override
				public List<ParameterMapping> provideMappings(
						MethodDescriptor method, Supplier<List<ParameterMapping>> standard) {
					List<ParameterMapping> out = new ArrayList<>(standard.get());
					Collections.reverse(out);
					return out;
				}
			};

			assertThat(names(map("login", reversed))).containsExactly("attempts", "user");
		}
	}

	@Nested
	@DisplayName("context provider")
	class Context {

		private final TraceContextProvider provider = ctx -> "user=alice kind=" + ctx.kind();

		@Test
		@DisplayName("adds a trailing Context field")
		void trailing() {
			List<ParameterMapping> m = engine.map(method(Account.class, "login"), new ParameterMappingRules(), provider);

			assertThat(names(m)).containsExactly("user", "attempts", ParameterMappingEngine.CONTEXT_FIELD);
			assertThat(m.get(2).sources().get(0).read(new Object[0])).isEqualTo("user=alice kind=METHOD_CALL");
		}

		@Test
		@DisplayName("stays a separate last field when a parameter is called context")
		void parameterNamedContext() {
			List<ParameterMapping> m =
					engine.map(method(Account.class, "annotate"), new ParameterMappingRules(), provider);

			assertThat(names(m)).containsExactly("context", "n", ParameterMappingEngine.CONTEXT_FIELD);
			assertThat(m).noneMatch(ParameterMapping::isBundle);
			assertThat(m.get(0).sources().get(0).read(new Object[] {"user-value", 7})).isEqualTo("user-value");
			assertThat(m.get(2).sources().get(0).isContext()).isTrue();
		}

		@Test
		@DisplayName("complements get context for their own kind")
		void complementKind() {
			List<ParameterMapping> m =
					engine.map(method(Account.class, "login_Faulted"), new ParameterMappingRules(), provider);

			assertThat(m.get(m.size() - 1).sources().get(0).read(new Object[0]))
					.isEqualTo("user=alice kind=" + InvocationKind.METHOD_FAULTED);
		}

		@Test
		@DisplayName("@ProvideContext(false) suppresses it")
		void suppressed() {
			List<ParameterMapping> m = engine.map(method(Account.class, "quiet"), new ParameterMappingRules(), provider);

			assertThat(names(m)).containsExactly("user");
		}
	}
}
