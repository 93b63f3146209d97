package de.mpicbg.ulman.ensemble.util.loggers;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import org.scijava.log.Logger;

public class TimeStampedConsoleLogger extends SimpleConsoleLogger
{
	public TimeStampedConsoleLogger() { super(); }
	public TimeStampedConsoleLogger(final String name) { super(name); }

	@Override
	public Logger subLogger(String name, int level) {
		return new TimeStampedConsoleLogger(name);
	}

	static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

	@Override
	String createMessage(final String reportedLevel, final Object message) {
		return prefix + "[" + LocalDateTime.now().format(STAMP) + " " + reportedLevel + "] " + message;
	}
}
