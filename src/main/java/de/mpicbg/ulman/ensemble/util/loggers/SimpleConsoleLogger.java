package de.mpicbg.ulman.ensemble.util.loggers;

import org.scijava.log.AbstractLogService;
import org.scijava.log.LogLevel;
import org.scijava.log.LogMessage;
import org.scijava.log.Logger;

/**
 * Prints every message, prefixed and tagged with its level, on the console.
 * Descendants adjust the format in createMessage(), the destination in
 * output(), or silence some levels by overriding their methods.
 */
public class SimpleConsoleLogger extends AbstractLogService
{
	public SimpleConsoleLogger() {
		this("");
	}

	public SimpleConsoleLogger(final String prefix) {
		super();
		this.prefix = prefix;
	}

	final String prefix;

	String createMessage(final String reportedLevel, final Object message) {
		return prefix + "[" + reportedLevel + "] " + message;
	}

	void output(final String finalizedMessage) {
		System.out.println(finalizedMessage);
	}

	@Override
	public Logger subLogger(String name, int level) {
		return new SimpleConsoleLogger(name);
	}

	@Override
	public void debug(Object msg) { output(createMessage("DBG", msg)); }

	@Override
	public void error(Object msg) { output(createMessage("ERROR", msg)); }

	@Override
	public void info(Object msg) { output(createMessage("INFO", msg)); }

	@Override
	public void trace(Object msg) { output(createMessage("TRACE", msg)); }

	@Override
	public void warn(Object msg) { output(createMessage("WARN", msg)); }

	//NB: everything logged with a Throwable or an explicit level ends up here
	@Override
	protected void messageLogged(final LogMessage message) {
		final Object msg = message.throwable() == null ? message.text()
				: message.text() + " (" + message.throwable() + ")";
		switch (message.level()) {
			case LogLevel.ERROR: error(msg); break;
			case LogLevel.WARN:  warn(msg);  break;
			case LogLevel.INFO:  info(msg);  break;
			case LogLevel.DEBUG: debug(msg); break;
			default:             trace(msg);
		}
	}
}
