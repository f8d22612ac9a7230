package com.obsinity.tracing.sink;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.obsinity.tracing.model.EventLevel;
import com.obsinity.tracing.model.EventRecord;
import com.obsinity.tracing.model.Identity;
import com.obsinity.tracing.model.InvocationKind;

class LoggingSinkBackendTest {

	private final Logger logger = (Logger) LoggerFactory.getLogger(LoggingSinkBackend.class);
	private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

	@BeforeEach
	void attach() {
		appender.start();
		logger.addAppender(appender);
	}

	@AfterEach
	void detach() {
		logger.detachAppender(appender);
	}

	private static EventRecord record(EventLevel level) {
		return new EventRecord(new Identity("Billing", UUID.randomUUID()), 3, "invoiced", InvocationKind.METHOD_CALL,
				level, 0, 0, 0, 0, "", List.of("invoiceId", "amount"), List.of("inv-1", 1200L), null, null);
	}

	@Test
	void levelThresholdAndKeywordMask() {
		LoggingSinkBackend backend = new LoggingSinkBackend(null, EventLevel.INFORMATIONAL, 0b100L);

		assertThat(backend.isEnabled(EventLevel.LOG_ALWAYS, 0)).isTrue();
		assertThat(backend.isEnabled(EventLevel.WARNING, 0)).isTrue();
		assertThat(backend.isEnabled(EventLevel.VERBOSE, 0)).isFalse();
		assertThat(backend.isEnabled(EventLevel.INFORMATIONAL, 0b100L)).isTrue();
		assertThat(backend.isEnabled(EventLevel.INFORMATIONAL, 0b011L)).isFalse();
		assertThat(backend.isEnabled(EventLevel.INFORMATIONAL, SinkBackend.ALL_KEYWORDS)).isTrue();
	}

	@Test
	void verboseNeedsDebugLogging() {
		LoggingSinkBackend backend = new LoggingSinkBackend(null, EventLevel.VERBOSE, SinkBackend.ALL_KEYWORDS);
		Level previous = logger.getLevel();
		try {
			logger.setLevel(Level.INFO);
			assertThat(backend.isEnabled(EventLevel.VERBOSE, 0)).isFalse();
			logger.setLevel(Level.DEBUG);
			assertThat(backend.isEnabled(EventLevel.VERBOSE, 0)).isTrue();
		} finally {
			logger.setLevel(previous);
		}
	}

	@Test
	void writesOneLineAtTheMatchingLevel() {
		LoggingSinkBackend backend = new LoggingSinkBackend(null, EventLevel.VERBOSE, SinkBackend.ALL_KEYWORDS);

		backend.write(record(EventLevel.WARNING));
		backend.write(record(EventLevel.CRITICAL));

		assertThat(appender.list).extracting(ILoggingEvent::getLevel).containsExactly(Level.WARN, Level.ERROR);
		assertThat(appender.list.get(0).getFormattedMessage())
				.contains("source=Billing", "event=invoiced", "id=3", "correlationId=-", "invoiceId=inv-1");
	}
}
