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

import de.mpicbg.ulman.ensemble.ng.blend.RenderPolicy;
import de.mpicbg.ulman.ensemble.util.ArgbImages;
import org.scijava.log.Logger;

import java.nio.file.Path;
import java.nio.file.Paths;

public class RunSpecification
{
	/** the input folder that makes the images to be downloaded first */
	public static final String DOWNLOAD_FOLDER = ".noaa";

	public final Path inputRoot;
	public final Path outputRoot;
	public final RenderPolicy renderPolicy;
	public final int noOfThreads;
	public final boolean keepGoing;
	public final boolean downloadFirst;

	public RunSpecification(final Path inputRoot,
	                        final Path outputRoot,
	                        final RenderPolicy renderPolicy,
	                        final int noOfThreads,
	                        final boolean keepGoing,
	                        final boolean downloadFirst)
	{
		this.inputRoot = inputRoot;
		this.outputRoot = outputRoot;
		this.renderPolicy = renderPolicy;
		this.noOfThreads = noOfThreads;
		this.keepGoing = keepGoing;
		this.downloadFirst = downloadFirst;
	}

	// ============= exporting =============
	/** the composite of the group in root/category/month is stored
	    as outputRoot/category/month.png */
	public Path outputFileFor(final Path groupFolder)
	{
		final Path group = groupFolder.toAbsolutePath().normalize();
		final String fileName = group.getFileName() + ArgbImages.PNG_SUFFIX;

		final Path category = group.getParent() != null ? group.getParent().getFileName() : null;
		return category != null ? outputRoot.resolve(category.toString()).resolve(fileName)
		                        : outputRoot.resolve(fileName);
	}

	// ============= printing =============
	public void reportRun(final Logger log)
	{
		log.info("new run:");
		log.info("input:   "+inputRoot+(downloadFirst ? " (downloading first)" : ""));
		log.info("output:  "+outputRoot);
		log.info("render:  "+renderPolicy);
		log.info("threads: "+noOfThreads);
		if (keepGoing) log.info("invalid groups are skipped");
	}

	// ============= building =============
	static public Builder builder() { return new Builder(); }

	static public class Builder
	{
		private String inputRoot = DOWNLOAD_FOLDER;
		private String outputRoot = null;
		private RenderPolicy renderPolicy = RenderPolicy.DEFAULT;
		private int noOfThreads = 1;
		private boolean keepGoing = false;

		public Builder setInput(final String inputRoot) {
			this.inputRoot = inputRoot;
			return this;
		}
		public Builder setOutput(final String outputRoot) {
			this.outputRoot = outputRoot;
			return this;
		}
		public Builder setRenderPolicy(final RenderPolicy renderPolicy) {
			this.renderPolicy = renderPolicy;
			return this;
		}
		public Builder setNoOfThreads(final int noOfThreads) {
			this.noOfThreads = noOfThreads;
			return this;
		}
		public Builder setKeepGoing(final boolean keepGoing) {
			this.keepGoing = keepGoing;
			return this;
		}

		public RunSpecification build() {
			if (outputRoot == null || outputRoot.isEmpty())
				throw new IllegalArgumentException("Output folder must be provided.");
			if (renderPolicy == null)
				throw new IllegalArgumentException("Render mode must be provided.");
			if (noOfThreads < 1)
				throw new IllegalArgumentException("Level of parallelism must be at least 1.");

			//no input, or the default one, means to download the images first
			final boolean download = inputRoot == null || inputRoot.isEmpty() || inputRoot.equals(DOWNLOAD_FOLDER);
			final Path input = Paths.get(download ? DOWNLOAD_FOLDER : inputRoot);

			return new RunSpecification(input, Paths.get(outputRoot), renderPolicy,
					noOfThreads, keepGoing, download);
		}
	}
}
