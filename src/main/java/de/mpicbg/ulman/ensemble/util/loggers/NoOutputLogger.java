package de.mpicbg.ulman.ensemble.util.loggers;

import org.scijava.log.Logger;

/** Formats the messages but never shows them, handy in tests. */
public class NoOutputLogger extends SimpleConsoleLogger
{
	public NoOutputLogger() { super(); }
	public NoOutputLogger(final String name) { super(name); }

	@Override
	public Logger subLogger(String name, int level) {
		return new NoOutputLogger(name);
	}

	@Override
	void output(final String finalizedMessage) { /* empty */ }
}
