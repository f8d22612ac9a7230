package com.obsinity.tracing.sink;

import java.util.List;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;

import com.obsinity.tracing.model.EventLevel;
import com.obsinity.tracing.model.EventRecord;
import com.obsinity.tracing.model.InvocationKind;

/**
 * Backend that adds each record as an event on the current OpenTelemetry span. Enabled only while a recording span is
 * current. Fault records also mark the span {@link StatusCode#ERROR}.
 */
public class OpenTelemetrySinkBackend implements SinkBackend {

	public static final String ATTR_SOURCE = "obsinity.source";
	public static final String ATTR_EVENT_ID = "obsinity.event.id";
	public static final String ATTR_LEVEL = "obsinity.level";
	public static final String ATTR_CORRELATION_ID = "obsinity.correlation.id";
	public static final String ATTR_RELATED_ID = "obsinity.correlation.related_id";

	private final EventLevel threshold;
	private final long keywordMask;

	public OpenTelemetrySinkBackend(EventLevel threshold, long keywordMask) {
		this.threshold = threshold;
		this.keywordMask = keywordMask;
	}

	@Override
	public boolean isEnabled(EventLevel level, long keywords) {
		if (level == null || !level.isEnabledAt(threshold)) return false;
		if (keywords != 0 && keywords != ALL_KEYWORDS && (keywords & keywordMask) == 0) return false;
		return Span.current().isRecording();
	}

	@Override
	public void write(EventRecord r) {
		final Span span = Span.current();
		final AttributesBuilder b = Attributes.builder();
		b.put(AttributeKey.stringKey(ATTR_SOURCE), r.source().name());
		b.put(AttributeKey.longKey(ATTR_EVENT_ID), (long) r.eventId());
		b.put(AttributeKey.stringKey(ATTR_LEVEL), r.level().name());
		if (r.correlationId() != null) b.put(AttributeKey.stringKey(ATTR_CORRELATION_ID), r.correlationId().toString());
		if (r.relatedCorrelationId() != null) {
			b.put(AttributeKey.stringKey(ATTR_RELATED_ID), r.relatedCorrelationId().toString());
		}
		for (int i = 0; i < r.fieldNames().size(); i++) {
			putBestEffort(b, r.fieldNames().get(i), r.payload().get(i));
		}
		span.addEvent(r.eventName(), b.build());
		if (r.kind() == InvocationKind.METHOD_FAULTED) {
			span.setStatus(StatusCode.ERROR, r.eventName());
		}
	}

	private static void putBestEffort(AttributesBuilder b, String k, Object v) {
		if (v == null) return;
		if (v instanceof String s) b.put(AttributeKey.stringKey(k), s);
		else if (v instanceof Boolean bo) b.put(AttributeKey.booleanKey(k), bo);
		else if (v instanceof Integer i) b.put(AttributeKey.longKey(k), i.longValue());
		else if (v instanceof Long l) b.put(AttributeKey.longKey(k), l);
		else if (v instanceof Short sh) b.put(AttributeKey.longKey(k), sh.longValue());
		else if (v instanceof Byte by) b.put(AttributeKey.longKey(k), by.longValue());
		else if (v instanceof Float f) b.put(AttributeKey.doubleKey(k), f.doubleValue());
		else if (v instanceof Double d) b.put(AttributeKey.doubleKey(k), d);
		else if (v instanceof List<?> list && list.stream().allMatch(x -> x instanceof String)) {
			@SuppressWarnings("unchecked") List<String> ss = (List<String>) list;
			b.put(AttributeKey.stringArrayKey(k), ss);
		} else {
			b.put(AttributeKey.stringKey(k), v.toString()); // enums, UUIDs
		}
	}
}
