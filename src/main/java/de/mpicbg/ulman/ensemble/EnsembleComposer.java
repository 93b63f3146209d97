/*
 * BSD 2-Clause License
 *
 * Copyright (c) 2022, Vladimír Ulman
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *
 * 1. Redistributions of source code must retain the above copyright notice, this
 *    list of conditions and the following disclaimer.
 *
 * 2. Redistributions in binary form must reproduce the above copyright notice,
 *    this list of conditions and the following disclaimer in the documentation
 *    and/or other materials provided with the distribution.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS"
 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE
 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
 * DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT HOLDER OR CONTRIBUTORS BE LIABLE
 * FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL
 * DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR
 * SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER
 * CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY,
 * OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */
package de.mpicbg.ulman.ensemble;

import de.mpicbg.ulman.ensemble.download.AcquisitionConfig;
import de.mpicbg.ulman.ensemble.download.ForecastDownloader;
import de.mpicbg.ulman.ensemble.ng.DominantColorComposer;
import de.mpicbg.ulman.ensemble.ng.InvalidGroupException;
import de.mpicbg.ulman.ensemble.ng.backbones.CompositeFeeder;
import de.mpicbg.ulman.ensemble.ng.blend.RenderPolicy;
import de.mpicbg.ulman.ensemble.util.LeafFolders;
import de.mpicbg.ulman.ensemble.util.loggers.RestrictedConsoleLogger;
import de.mpicbg.ulman.ensemble.util.loggers.SimpleConsoleLogger;
import de.mpicbg.ulman.ensemble.util.loggers.SimpleDiskSavingLogger;
import org.scijava.ItemVisibility;
import org.scijava.command.Command;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;
import org.scijava.plugin.Plugin;
import org.scijava.widget.FileWidget;
import picocli.CommandLine;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

@CommandLine.Command(name = "EnsembleComposer")
@Plugin(type = Command.class, menuPath = "Plugins>Forecast Ensemble Composite")
public class EnsembleComposer implements Command
{
	@Parameter
	LogService log;

	// ================= Fiji =================
	@Parameter(visibility = ItemVisibility.MESSAGE, persist = false, required = false)
	private final String headerA =
		"Every folder without sub-folders, found under the input folder, is one group of PNG images.";

	@Parameter(visibility = ItemVisibility.MESSAGE, persist = false, required = false)
	private final String headerB =
		"Every group is composed into one image, stored as output/parentFolderName/folderName.png";

	@Parameter(visibility = ItemVisibility.MESSAGE, persist = false, required = false)
	private final String headerC =
		"Input folder named "+RunSpecification.DOWNLOAD_FOLDER+" is filled with the recent CFSv2 forecasts first.";

	@CommandLine.Option(names = {"-i","--input"}, description = "Folder with groups of images, "
			+RunSpecification.DOWNLOAD_FOLDER+" (the default) downloads the forecasts first.")
	@Parameter(label = "Input folder:", style = FileWidget.DIRECTORY_STYLE)
	private File inputPath = new File(RunSpecification.DOWNLOAD_FOLDER);

	@CommandLine.Option(names = {"-o","--output"}, description = "Folder for the composite images.")
	@Parameter(label = "Output folder:", style = FileWidget.DIRECTORY_STYLE)
	private File outputPath = new File(".");

	@CommandLine.Option(names = {"-r","--renderMode"}, converter = RenderPolicyConverter.class,
			description = "How to blend the per-pixel votes: white (default), smooth, confidence, dominance.")
	@Parameter(label = "Render mode:")
	RenderPolicy renderMode = RenderPolicy.DEFAULT;

	@CommandLine.Option(names = {"-n","--threads"}, description = "Level of parallelism as the no. of threads.")
	@Parameter(label = "Level of parallelism (no. of threads):", min="1")
	int noOfThreads = 1;

	@CommandLine.Option(names = {"-k","--keepGoing"}, description = "Skip invalid groups instead of stopping.")
	@Parameter(label = "Skip invalid groups:")
	boolean keepGoing = false;

	@CommandLine.Option(names = {"-v","--verbose"}, description = "Report also debug messages.")
	boolean verbose = false;

	@CommandLine.Option(names = {"-l","--logFile"}, description = "Log into this file instead of the console.")
	File logFile = null;


	static public class RenderPolicyConverter implements CommandLine.ITypeConverter<RenderPolicy>
	{
		@Override
		public RenderPolicy convert(final String value)
		{
			try {
				return RenderPolicy.fromLabel(value);
			} catch (IllegalArgumentException e) {
				throw new CommandLine.TypeConversionException(e.getMessage());
			}
		}
	}


	@Override
	public void run()
	{
		worker();
	}

	/** returns true if a composite has been created for every group */
	boolean worker()
	{
		// ------------ parsing inputs ------------
		final RunSpecification run;
		try {
			run = RunSpecification.builder()
					.setInput(inputPath == null ? null : inputPath.getPath())
					.setOutput(outputPath == null ? null : outputPath.getPath())
					.setRenderPolicy(renderMode)
					.setNoOfThreads(noOfThreads)
					.setKeepGoing(keepGoing)
					.build();
		}
		catch (IllegalArgumentException e) {
			log.error("Input parameters are wrong: "+e.getMessage());
			return false;
		}
		run.reportRun(log);

		if (run.downloadFirst)
			new ForecastDownloader(AcquisitionConfig.defaults(), log.subLogger("download ")).getImages(run.inputRoot);

		final List<Path> groups;
		try {
			groups = LeafFolders.findGroups(run.inputRoot, log);
		}
		catch (IOException e) {
			log.error("Can't walk the input folder: "+e.getMessage());
			return false;
		}

		// ------------ preparing for action ------------
		final CompositeFeeder feeder = new CompositeFeeder(log)
				.setAlgorithm(new DominantColorComposer(log, run.renderPolicy));

		long ttime = System.currentTimeMillis();
		int failedGroups = 0;
		for (Path group : groups)
		{
			log.info("==========================");
			log.info("Processing group: "+group);
			try {
				feeder.processGroup(group, run.noOfThreads);
				final Path outFile = run.outputFileFor(group);
				feeder.saveGroup(outFile);
				log.info("Result image written to "+outFile);
			}
			catch (InvalidGroupException e) {
				log.error("Invalid group "+group+": "+e.getMessage());
				++failedGroups;
				if (!run.keepGoing) return false;
			}
			catch (IOException e) {
				log.error("Failed writing the composite of "+group+": "+e.getMessage());
				return false;
			}
			finally {
				feeder.releaseGroupResult();
			}
		}

		ttime -= System.currentTimeMillis();
		log.info("TOTAL ELAPSED TIME: "+(-ttime/1000)+" seconds");
		log.info("Done, "+(groups.size()-failedGroups)+" of "+groups.size()+" groups composed");
		return failedGroups == 0;
	}


	// ================================ CLI ==========================
	@CommandLine.Option(names = {"-h", "--help"}, usageHelp = true, description = "Display this help message.")
	boolean usageHelpRequested;

	public void printHelp() {
		System.out.println(this.headerA);
		System.out.println(this.headerB);
		System.out.println(this.headerC);
		System.out.println(); //intentional line separator
		CommandLine.usage(this, System.out);
	}

	public static void main(String[] args) {
		EnsembleComposer app;

		//parse the command line and fill the object's attributes
		try { app = CommandLine.populateCommand(new EnsembleComposer(), args); }
		catch (CommandLine.ParameterException pe) {
			System.out.println(pe.getMessage());
			System.out.println(); //intentional line separator
			new EnsembleComposer().printHelp();
			System.exit(2);
			return;
		}

		//parsing went well: an explicit cry for help?
		//NB: no params is fine, it means to download and compose the recent forecasts
		if (app.usageHelpRequested) {
			app.printHelp();
			return;
		}

		boolean success;
		if (app.logFile != null) {
			try (SimpleDiskSavingLogger fileLog = new SimpleDiskSavingLogger(app.logFile.getPath())) {
				app.log = fileLog;
				success = app.worker();
			}
			catch (IOException e) {
				System.out.println("Cannot open the log file: "+e.getMessage());
				success = false;
			}
		} else {
			app.log = app.verbose ? new SimpleConsoleLogger() : new RestrictedConsoleLogger();
			success = app.worker();
		}

		if (!success) System.exit(1);
	}
}
