package com.obsinity.tracing.support;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import com.obsinity.tracing.model.EventLevel;
import com.obsinity.tracing.model.EventRecord;
import com.obsinity.tracing.model.Identity;
import com.obsinity.tracing.sink.SinkBackend;

/** In-memory backend for tests: level threshold, keyword mask, optional write failure. */
public class RecordingSinkBackend implements SinkBackend {

	private final List<EventRecord> records = new CopyOnWriteArrayList<>();
	private final List<Identity> registered = new CopyOnWriteArrayList<>();

	private volatile EventLevel threshold;
	private volatile long keywordMask = ALL_KEYWORDS;
	private volatile RuntimeException failure;

	public RecordingSinkBackend() {
		this(EventLevel.VERBOSE);
	}

	public RecordingSinkBackend(EventLevel threshold) {
		this.threshold = threshold;
	}

	@Override
	public void register(Identity source) {
		registered.add(source);
	}

	@Override
	public boolean isEnabled(EventLevel level, long keywords) {
		if (level == null || !level.isEnabledAt(threshold)) return false;
		return keywords == 0 || keywords == ALL_KEYWORDS || (keywords & keywordMask) != 0;
	}

	@Override
	public void write(EventRecord record) {
		if (failure != null) throw failure;
		records.add(record);
	}

	public List<EventRecord> records() {
		return records;
	}

	public List<String> eventNames() {
		return records.stream().map(EventRecord::eventName).collect(Collectors.toList());
	}

	public EventRecord only() {
		if (records.size() != 1) throw new AssertionError("Expected one record but got " + eventNames());
		return records.get(0);
	}

	public EventRecord last() {
		return records.get(records.size() - 1);
	}

	public List<Identity> registered() {
		return registered;
	}

	public RecordingSinkBackend threshold(EventLevel level) {
		this.threshold = level;
		return this;
	}

	public RecordingSinkBackend keywordMask(long mask) {
		this.keywordMask = mask;
		return this;
	}

	public RecordingSinkBackend failWith(RuntimeException e) {
		this.failure = e;
		return this;
	}

	public void clear() {
		records.clear();
	}
}
