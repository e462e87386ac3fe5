package org.javai.cdlexport.testsupport;

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
 * Captures what one logger emits while it is open, for assertions on log output.
 * <pre>
 * try (LogCapture log = LogCapture.of(ExportBatch.class, Level.INFO)) {
 *     batch.exportAll(projects);
 *     assertThat(log.messages(Level.WARN)).hasSize(1);
 * }
 * </pre>
 * The logger's level is lowered to the requested one and restored on close.
 */
public final class LogCapture extends AbstractAppender implements AutoCloseable {

	private final LoggerContext context;
	private final LoggerConfig config;
	private final boolean addedConfig;
	private final Level restoreLevel;
	private final List<LogEvent> captured = new CopyOnWriteArrayList<>();

	private LogCapture(LoggerContext context, LoggerConfig config, boolean addedConfig, Level restoreLevel) {
		super("capture-" + config.getName() + "-" + System.nanoTime(), null, null, false, Property.EMPTY_ARRAY);
		this.context = context;
		this.config = config;
		this.addedConfig = addedConfig;
		this.restoreLevel = restoreLevel;
	}

	public static LogCapture of(Class<?> source, Level level) {
		String name = source.getName();
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Configuration configuration = context.getConfiguration();
		LoggerConfig config = configuration.getLoggerConfig(name);
		boolean added = false;
		if (!config.getName().equals(name)) {
			config = new LoggerConfig(name, level, true);
			configuration.addLogger(name, config);
			added = true;
		}
		LogCapture capture = new LogCapture(context, config, added, config.getLevel());
		config.setLevel(level);
		capture.start();
		config.addAppender(capture, level, null);
		context.updateLoggers();
		return capture;
	}

	@Override
	public void append(LogEvent event) {
		captured.add(event.toImmutable());
	}

	public List<String> messages() {
		return captured.stream().map(e -> e.getMessage().getFormattedMessage()).toList();
	}

	/**
	 * Messages logged at exactly {@code level}.
	 */
	public List<String> messages(Level level) {
		return captured.stream()
				.filter(e -> e.getLevel().equals(level))
				.map(e -> e.getMessage().getFormattedMessage())
				.toList();
	}

	@Override
	public void close() {
		stop();
		config.removeAppender(getName());
		if (addedConfig) {
			context.getConfiguration().removeLogger(config.getName());
		} else {
			config.setLevel(restoreLevel);
		}
		context.updateLoggers();
	}
}
