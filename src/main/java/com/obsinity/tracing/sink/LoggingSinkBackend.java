package com.obsinity.tracing.sink;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import com.obsinity.tracing.model.EventLevel;
import com.obsinity.tracing.model.EventRecord;
import com.obsinity.tracing.model.Identity;

/**
 * Backend that logs records through SLF4J.
 * - one compact line per record, at the SLF4J level matching the event level
 * - DEBUG: pretty JSON of the whole record
 */
public class LoggingSinkBackend implements SinkBackend {

	private static final Logger log = LoggerFactory.getLogger(LoggingSinkBackend.class);

	private final ObjectMapper mapper;
	private final EventLevel threshold;
	private final long keywordMask;

	public LoggingSinkBackend(ObjectMapper mapper, EventLevel threshold, long keywordMask) {
		// Use the Spring Boot mapper if provided; otherwise create a safe default.
		if (mapper != null) {
			this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
		} else {
			this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
		}
		this.threshold = threshold;
		this.keywordMask = keywordMask;
	}

	@Override
	public void register(Identity source) {
		log.info("obsinity tracing source registered name={} id={}", source.name(), source.id());
	}

	@Override
	public boolean isEnabled(EventLevel level, long keywords) {
		if (level == null || !level.isEnabledAt(threshold)) return false;
		if (keywords != 0 && keywords != ALL_KEYWORDS && (keywords & keywordMask) == 0) return false;
		return switch (level) {
			case CRITICAL, ERROR -> log.isErrorEnabled();
			case WARNING -> log.isWarnEnabled();
			case VERBOSE -> log.isDebugEnabled();
			default -> log.isInfoEnabled();
		};
	}

	@Override
	public void write(EventRecord r) {
		final String format = "obsinity trace source={} event={} id={} kind={} correlationId={} fields={}";
		final Object[] args = {
			r.source().name(), r.eventName(), r.eventId(), r.kind(), safe(r.correlationId()), fields(r)
		};
		switch (r.level()) {
			case CRITICAL, ERROR -> log.error(format, args);
			case WARNING -> log.warn(format, args);
			case VERBOSE -> log.debug(format, args);
			default -> log.info(format, args);
		}
		if (log.isDebugEnabled()) {
			log.debug("trace payload:\n{}", toJson(r));
		}
	}

	private static Map<String, Object> fields(EventRecord r) {
		final Map<String, Object> out = new LinkedHashMap<>();
		for (int i = 0; i < r.fieldNames().size(); i++) {
			out.put(r.fieldNames().get(i), r.payload().get(i));
		}
		return out;
	}

	private String toJson(EventRecord r) {
		try {
			return mapper.writeValueAsString(r);
		} catch (JsonProcessingException e) {
			// Fallback to toString() if serialization fails
			return String.valueOf(r);
		}
	}

	private static Object safe(Object o) {
		return (o == null) ? "-" : o;
	}
}
