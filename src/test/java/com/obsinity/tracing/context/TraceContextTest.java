package com.obsinity.tracing.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TraceContextTest {

	@Test
	void innerFramesShadowOuterOnes() {
		try (TraceContext.Frame outer = TraceContext.begin()) {
			TraceContext.set("tenant", "acme");
			TraceContext.set("region", "eu");

			try (TraceContext.Frame inner = TraceContext.begin()) {
				TraceContext.set("tenant", "globex");
				assertThat(TraceContext.get("tenant")).isEqualTo("globex");
				assertThat(TraceContext.get("region")).isEqualTo("eu");
			}

			assertThat(TraceContext.get("tenant")).isEqualTo("acme");
		}
		assertThat(TraceContext.get("tenant")).isNull();
	}

	@Test
	void framesCloseInnermostFirst() {
		TraceContext.Frame outer = TraceContext.begin();
		TraceContext.Frame inner = TraceContext.begin();

		assertThatThrownBy(outer::close).isInstanceOf(IllegalStateException.class);

		inner.close();
		outer.close();
		assertThat(TraceContext.get("anything")).isNull();
	}
}
