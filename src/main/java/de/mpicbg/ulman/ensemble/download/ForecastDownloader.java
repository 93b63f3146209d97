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
package de.mpicbg.ulman.ensemble.download;

import de.mpicbg.ulman.ensemble.util.ArgbImages;
import org.scijava.log.Logger;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Keeps a local copy of the recent monthly forecast maps of the CFSv2 archive,
 * laid out as root/category/forecastMonth/image.png so that every
 * forecastMonth folder is one group of images to be composed.
 *
 * Both the current forecasts (one image per ensemble run and lead month) and
 * the forecasts issued in the previous months that still target a current
 * or future month are fetched. Images present locally are not fetched again,
 * and folders of months that are already over are removed.
 *
 * Fetching is best effort: failures are reported and the image is skipped.
 */
public class ForecastDownloader
{
	public static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyyMM");
	public static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("dd");

	private final AcquisitionConfig config;
	private final ImageFetcher fetcher;
	private final Clock clock;
	private final Logger log;

	public ForecastDownloader(final AcquisitionConfig config, final Logger log)
	{
		this(config, new HttpImageFetcher(), Clock.systemUTC(), log);
	}

	public ForecastDownloader(final AcquisitionConfig config,
	                          final ImageFetcher fetcher,
	                          final Clock clock,
	                          final Logger log)
	{
		if (log == null)
			throw new RuntimeException("Please, give me existing Logger.");

		this.config = config;
		this.fetcher = fetcher;
		this.clock = clock;
		this.log = log;
	}

	// ================= URLs =================
	public
	String buildCurrentUrl(final String variableCode, final String run, final int lead)
	{
		return config.baseUrl + "imagesInd" + run + "/" + variableCode + "MonInd" + lead + ".gif";
	}

	public
	String buildHistoryUrl(final String variableCode, final String run, final int lead, final String historyMonth)
	{
		return config.historyUrl + historyMonth + "/imagesInd" + run + "/" + variableCode + "MonInd" + lead + ".gif";
	}

	// ================= the main workhorse code =================
	/** updates the local copy under the 'root' and returns the 'root' */
	public
	Path getImages(final Path root)
	{
		final LocalDate today = LocalDate.now(clock);
		final YearMonth now = YearMonth.from(today);
		final String generationMonth = now.format(MONTH);
		final String generationDay = today.format(DAY);
		log.info("Updating forecasts in "+root+" for "+generationMonth);

		int fetched = 0;
		for (String category : config.categories.keySet())
		{
			final String varCode = config.categories.get(category);
			for (int lead = 1; lead <= config.leadMonths; ++lead)
			{
				final String forecastMonth = now.plusMonths(lead).format(MONTH);
				for (String run : config.ensembleRuns)
				{
					final Path target = root.resolve(category).resolve(forecastMonth)
							.resolve(generationMonth + generationDay + "_" + run + ArgbImages.PNG_SUFFIX);
					if (fetchIfMissing(buildCurrentUrl(varCode,run,lead), target)) ++fetched;
				}
			}
		}

		for (int history = 0; history < config.historyMonths; ++history)
		{
			final YearMonth historyDate = now.minusMonths(history);
			final String historyMonth = historyDate.format(MONTH);
			for (int lead = 1; lead <= config.leadMonths; ++lead)
			{
				final YearMonth forecastDate = historyDate.plusMonths(lead-1);
				//earlier predictions with relevant forecasts only
				if (forecastDate.isBefore(now)) continue;

				final String forecastMonth = forecastDate.format(MONTH);
				for (String run : config.ensembleRuns)
					for (String category : config.categories.keySet())
					{
						final Path target = root.resolve(category).resolve(forecastMonth)
								.resolve(historyMonth + "_" + run + ArgbImages.PNG_SUFFIX);
						final String url = buildHistoryUrl(config.categories.get(category),run,lead,historyMonth);
						if (fetchIfMissing(url, target)) ++fetched;
					}
			}
		}
		log.info("Fetched "+fetched+" new images");

		cleanupOldForecasts(root);
		return root;
	}

	/** returns true if the image was fetched and stored */
	boolean fetchIfMissing(final String url, final Path target)
	{
		if (Files.exists(target)) return false;

		log.info("Downloading: "+url);
		final Path partial = partialFileFor(target);
		try {
			final BufferedImage bi = ImageIO.read(new ByteArrayInputStream(fetcher.fetch(url)));
			if (bi == null)
				throw new IOException("downloaded content is not an image");
			//the target appears only once complete, a half-written file would pass for a cached one
			ArgbImages.writePng(bi, partial);
			Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
			return true;
		}
		catch (IOException e) {
			log.error("Failed downloading "+url+": "+e.getMessage());
			discardPartial(partial);
			return false;
		}
	}

	static final String PARTIAL_SUFFIX = ".part";

	static Path partialFileFor(final Path target)
	{
		return target.resolveSibling(target.getFileName().toString() + PARTIAL_SUFFIX);
	}

	private void discardPartial(final Path partial)
	{
		try {
			Files.deleteIfExists(partial);
		}
		catch (IOException e) {
			log.warn("Could not remove unfinished download "+partial+": "+e.getMessage());
		}
	}

	/** removes forecastMonth folders of months that are already over */
	public
	void cleanupOldForecasts(final Path root)
	{
		final String currentMonth = YearMonth.now(clock).format(MONTH);

		for (String category : config.categories.keySet())
		{
			final Path categoryFolder = root.resolve(category);
			if (!Files.isDirectory(categoryFolder)) continue;

			final List<Path> months;
			try (Stream<Path> s = Files.list(categoryFolder)) {
				months = s.filter(Files::isDirectory).collect(Collectors.toList());
			}
			catch (IOException e) {
				log.error("Cannot list "+categoryFolder+": "+e.getMessage());
				continue;
			}

			for (Path month : months)
			{
				if (month.getFileName().toString().compareTo(currentMonth) >= 0) continue;

				log.info("Deleting old forecast folder: "+month);
				try {
					deleteRecursively(month);
				}
				catch (IOException e) {
					log.error("Error deleting "+month+": "+e.getMessage());
				}
			}
		}
	}

	static
	void deleteRecursively(final Path folder)
	throws IOException
	{
		final List<Path> content;
		try (Stream<Path> s = Files.walk(folder)) {
			content = s.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
		}
		for (Path p : content) Files.delete(p);
	}
}
