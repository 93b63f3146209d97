package de.mpicbg.ulman.ensemble.util.loggers;

import java.io.File;
import java.io.IOException;
import java.util.logging.Logger;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;

/**
 * Time-stamped logger that writes into a file instead of the console.
 * Sub-loggers share the file of their parent, and differ only in the prefix.
 */
public class SimpleDiskSavingLogger extends TimeStampedConsoleLogger implements AutoCloseable
{
	final Logger javaLogger;
	private final FileHandler fileHandler;

	public SimpleDiskSavingLogger(final String logFilePath) throws IOException {
		this(logFilePath, "");
	}

	public SimpleDiskSavingLogger(final String logFilePath, final String prefix) throws IOException {
		super(prefix);
		javaLogger = Logger.getLogger("ComposerLog_" + new File(logFilePath).getAbsolutePath());
		javaLogger.setUseParentHandlers(false);

		fileHandler = new FileHandler(logFilePath);
		fileHandler.setFormatter(EASYFORMATTER);
		javaLogger.addHandler(fileHandler);
	}

	private SimpleDiskSavingLogger(final SimpleDiskSavingLogger parent, final String prefix) {
		super(prefix);
		javaLogger = parent.javaLogger;
		fileHandler = null; //NB: only the creator of the file closes it
	}

	@Override
	public org.scijava.log.Logger subLogger(String name, int level) {
		return new SimpleDiskSavingLogger(this, name);
	}

	@Override
	public void close() {
		if (fileHandler == null) return;
		javaLogger.removeHandler(fileHandler);
		fileHandler.close();
	}


	static public
	Formatter EASYFORMATTER = new Formatter() {
		@Override
		public String format(java.util.logging.LogRecord logRecord) {
			return logRecord.getMessage() + "\n";
		}
	};

	@Override
	void output(final String finalizedMessage) {
		javaLogger.info(finalizedMessage);
	}
}
