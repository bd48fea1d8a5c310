package org.javai.springai.usecases.testsupport;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;

/**
 * Captures the log events of one logger for the duration of a try-with-resources block.
 *
 * <pre>
 * try (LogCaptorAppender captor = LogCaptorAppender.capture(QueryNormalizer.class, Level.INFO)) {
 *     normalizer.normalize("SELECT * FROM t WHERE a  :a");
 *     assertThat(captor.messagesAt(Level.INFO)).anyMatch(m -&gt; m.contains("Repaired"));
 * }
 * </pre>
 */
public final class LogCaptorAppender extends AbstractAppender implements AutoCloseable {

	private final LoggerContext context;
	private final LoggerConfig loggerConfig;
	private final boolean ownsConfig;
	private final Level previousLevel;
	private final List<LogEvent> events = new CopyOnWriteArrayList<>();

	private LogCaptorAppender(LoggerContext context, LoggerConfig loggerConfig, boolean ownsConfig, Level previousLevel) {
		super("captor-" + System.nanoTime(), null, null, false, Property.EMPTY_ARRAY);
		this.context = context;
		this.loggerConfig = loggerConfig;
		this.ownsConfig = ownsConfig;
		this.previousLevel = previousLevel;
	}

	public static LogCaptorAppender capture(Class<?> loggerClass, Level level) {
		String loggerName = loggerClass.getName();
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Configuration configuration = context.getConfiguration();
		LoggerConfig loggerConfig = configuration.getLoggerConfig(loggerName);
		boolean ownsConfig = !loggerConfig.getName().equals(loggerName);
		if (ownsConfig) {
			loggerConfig = new LoggerConfig(loggerName, level, true);
			configuration.addLogger(loggerName, loggerConfig);
		}
		Level previousLevel = loggerConfig.getLevel();
		loggerConfig.setLevel(level);

		LogCaptorAppender captor = new LogCaptorAppender(context, loggerConfig, ownsConfig, previousLevel);
		captor.start();
		loggerConfig.addAppender(captor, level, null);
		context.updateLoggers();
		return captor;
	}

	@Override
	public void append(LogEvent event) {
		events.add(event.toImmutable());
	}

	public List<LogEvent> events() {
		return Collections.unmodifiableList(events);
	}

	public List<String> messages() {
		return events.stream().map(e -> e.getMessage().getFormattedMessage()).toList();
	}

	public List<String> messagesAt(Level level) {
		return events.stream()
				.filter(e -> e.getLevel() == level)
				.map(e -> e.getMessage().getFormattedMessage())
				.toList();
	}

	@Override
	public void close() {
		stop();
		loggerConfig.removeAppender(getName());
		if (ownsConfig) {
			context.getConfiguration().removeLogger(loggerConfig.getName());
		}
		else {
			loggerConfig.setLevel(previousLevel);
		}
		context.updateLoggers();
	}
}
