package com.obsinity.tracing.configuration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.obsinity.tracing.model.EventLevel;

/**
 * Configuration properties for contract tracing.
 *
 * <pre>{@code
 * # application.yml
 * obsinity:
 *   tracing:
 *     enabled: true               # false: proxies and @Traced beans call straight through
 *     force-auto-keywords: false  # auto keywords even where a contract turns them off
 *     backend: logging            # logging | opentelemetry | none
 *     level: INFORMATIONAL        # most verbose level the backend accepts
 *     keywords: -1                # keyword mask, -1 for all
 *     proxy:
 *       create-correlation-scope: true
 * }</pre>
 */
@ConfigurationProperties(prefix = "obsinity.tracing")
public class TracingProperties {

	public enum Backend {
		LOGGING,
		OPENTELEMETRY,
		NONE
	}

	/** Master switch. When off, {@code @Traced} beans proceed without emitting. */
	private boolean enabled = true;

	/** Allocate automatic keywords for every contract without a keyword table. */
	private boolean forceAutoKeywords = false;

	private Backend backend = Backend.LOGGING;

	/** Most verbose level the backend accepts. */
	private EventLevel level = EventLevel.INFORMATIONAL;

	/** Keyword mask; events whose keywords do not intersect it are skipped. {@code -1} enables all. */
	private long keywords = -1L;

	private final Proxy proxy = new Proxy();

	public boolean isEnabled() {
		return enabled;
	}

	public void setEnabled(boolean enabled) {
		this.enabled = enabled;
	}

	public boolean isForceAutoKeywords() {
		return forceAutoKeywords;
	}

	public void setForceAutoKeywords(boolean forceAutoKeywords) {
		this.forceAutoKeywords = forceAutoKeywords;
	}

	public Backend getBackend() {
		return backend;
	}

	public void setBackend(Backend backend) {
		this.backend = backend;
	}

	public Proxy getProxy() {
		return proxy;
	}

	public EventLevel getLevel() {
		return level;
	}

	public void setLevel(EventLevel level) {
		this.level = level;
	}

	public long getKeywords() {
		return keywords;
	}

	public void setKeywords(long keywords) {
		this.keywords = keywords;
	}

	/** Tracing proxy behavior. */
	public static class Proxy {

		/** Open (or reuse) a correlation scope around every proxied call. */
		private boolean createCorrelationScope = true;

		public boolean isCreateCorrelationScope() {
			return createCorrelationScope;
		}

		public void setCreateCorrelationScope(boolean createCorrelationScope) {
			this.createCorrelationScope = createCorrelationScope;
		}
	}
}
