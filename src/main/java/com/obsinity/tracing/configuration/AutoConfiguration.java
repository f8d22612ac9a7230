package com.obsinity.tracing.configuration;

import static org.springframework.core.Ordered.HIGHEST_PRECEDENCE;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfigureOrder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.TypeExcludeFilter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.context.annotation.FilterType;

import com.fasterxml.jackson.databind.ObjectMapper;

import com.obsinity.tracing.allocation.KeywordFoldingStrategy;
import com.obsinity.tracing.allocation.PrefixSuffixFoldingStrategy;
import com.obsinity.tracing.sink.LoggingSinkBackend;
import com.obsinity.tracing.sink.OpenTelemetrySinkBackend;
import com.obsinity.tracing.sink.SinkBackend;

@Configuration
@AutoConfigureOrder(value = HIGHEST_PRECEDENCE)
@EnableAspectJAutoProxy
@EnableConfigurationProperties(TracingProperties.class)
@ComponentScan(
		basePackages = {"com.obsinity.tracing"},
		excludeFilters = @ComponentScan.Filter(type = FilterType.CUSTOM, classes = TypeExcludeFilter.class))
@RequiredArgsConstructor
public class AutoConfiguration {

	private final TracingProperties properties;

	/** Backend selected by {@code obsinity.tracing.backend}; replace it by declaring your own bean. */
	@Bean
	@ConditionalOnMissingBean
	public SinkBackend tracingSinkBackend(ObjectProvider<ObjectMapper> mapper) {
		if (!properties.isEnabled()) return SinkBackend.DISABLED;
		return switch (properties.getBackend()) {
			case OPENTELEMETRY -> new OpenTelemetrySinkBackend(properties.getLevel(), properties.getKeywords());
			case NONE -> SinkBackend.DISABLED;
			default -> new LoggingSinkBackend(
					mapper.getIfAvailable(), properties.getLevel(), properties.getKeywords());
		};
	}

	@Bean
	@ConditionalOnMissingBean
	public KeywordFoldingStrategy keywordFoldingStrategy() {
		return new PrefixSuffixFoldingStrategy();
	}
}
