package org.javai.partlinker.testsupport;

import java.io.Serializable;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.Layout;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;
import org.apache.logging.log4j.core.layout.PatternLayout;

/**
 * Captures the log output of one class so tests can assert on diagnostics.
 * <p>
 * Usage:
 * <pre>
 * try (LogCaptorAppender log = LogCaptorAppender.capture(LibraryReconciler.class)) {
 *     reconciler.plan(parts);
 *     assertThat(log.messages(Level.INFO)).anyMatch(msg -> msg.contains("No template applies"));
 * }
 * </pre>
 */
public final class LogCaptorAppender extends AbstractAppender implements AutoCloseable {

	private final LoggerContext context;
	private final LoggerConfig loggerConfig;
	private final boolean ownsLoggerConfig;
	private final Level previousLevel;
	private final List<LogEvent> events = new CopyOnWriteArrayList<>();

	private LogCaptorAppender(LoggerContext context, LoggerConfig loggerConfig, boolean ownsLoggerConfig,
			Layout<? extends Serializable> layout) {
		super("LogCaptor-" + System.nanoTime(), null, layout, false, Property.EMPTY_ARRAY);
		this.context = context;
		this.loggerConfig = loggerConfig;
		this.ownsLoggerConfig = ownsLoggerConfig;
		this.previousLevel = loggerConfig.getLevel();
	}

	/**
	 * Captures everything the class logs at DEBUG and above.
	 */
	public static LogCaptorAppender capture(Class<?> loggerClass) {
		String loggerName = loggerClass.getName();
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Configuration configuration = context.getConfiguration();
		LoggerConfig loggerConfig = configuration.getLoggerConfig(loggerName);

		boolean owns = !loggerConfig.getName().equals(loggerName);
		if (owns) {
			loggerConfig = new LoggerConfig(loggerName, Level.DEBUG, false);
			configuration.addLogger(loggerName, loggerConfig);
		}

		LogCaptorAppender appender = new LogCaptorAppender(context, loggerConfig, owns,
				PatternLayout.newBuilder().withPattern(PatternLayout.SIMPLE_CONVERSION_PATTERN).build());
		loggerConfig.setLevel(Level.DEBUG);
		appender.start();
		loggerConfig.addAppender(appender, Level.DEBUG, null);
		context.updateLoggers();
		return appender;
	}

	@Override
	public void append(LogEvent event) {
		events.add(event.toImmutable());
	}

	public List<String> messages() {
		return events.stream()
				.map(e -> e.getMessage().getFormattedMessage())
				.toList();
	}

	/**
	 * Messages logged at exactly the given level.
	 */
	public List<String> messages(Level level) {
		return events.stream()
				.filter(e -> e.getLevel() == level)
				.map(e -> e.getMessage().getFormattedMessage())
				.toList();
	}

	@Override
	public void close() {
		stop();
		loggerConfig.removeAppender(getName());
		if (ownsLoggerConfig) {
			context.getConfiguration().removeLogger(loggerConfig.getName());
		} else {
			loggerConfig.setLevel(previousLevel);
		}
		context.updateLoggers();
		events.clear();
	}
}
