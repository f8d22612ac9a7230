package com.obsinity.tracing.coercion;

import java.util.concurrent.Future;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import com.obsinity.tracing.model.EventLevel;

/**
 * Default serializer: Jackson JSON, only while the backend is enabled at {@link EventLevel#VERBOSE}.
 *
 * <p>A pending {@link Future} is written as {@code {"TaskId":<identity>}} rather than blocking on it. Values Jackson
 * cannot write become {@code {"Exception":"<message>"}}.
 */
public class JsonTraceSerializer extends TraceSerializer {

	private final ObjectMapper mapper;

	public JsonTraceSerializer() {
		this(new ObjectMapper());
	}

	public JsonTraceSerializer(ObjectMapper mapper) {
		super(EventLevel.VERBOSE);
		// Use the caller's mapper configuration, but never fail on beans without properties.
		this.mapper = mapper.copy().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
	}

	@Override
	public String serialize(Object value, SerializationContext context) {
		if (value == null) return null;
		if (value instanceof Future<?> future && !future.isDone()) {
			return "{\"TaskId\":" + System.identityHashCode(future) + "}";
		}
		try {
			return mapper.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			return mapper.createObjectNode().put("Exception", e.getOriginalMessage()).toString();
		}
	}
}
