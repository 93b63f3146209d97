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
package de.mpicbg.ulman.ensemble.ng.backbones;

import de.mpicbg.ulman.ensemble.ng.CompositeAlgorithm;
import de.mpicbg.ulman.ensemble.util.ArgbImages;

import net.imglib2.img.Img;
import net.imglib2.type.numeric.ARGBType;
import org.scijava.log.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * This class essentially takes care of the IO burden around one group. One
 * provides it with a composite algorithm and a folder with the group of
 * images. The class then reads the images, calls the composite algorithm,
 * and saves the output image.
 */
public
class CompositeFeeder
extends GroupIO
{
	public
	CompositeFeeder(final Logger _log)
	{
		super(_log);
	}


	public
	CompositeFeeder setAlgorithm(final CompositeAlgorithm alg)
	{
		if (alg == null)
			throw new RuntimeException("Please, give me an existing composite algorithm.");

		algorithm = alg;
		return this;
	}

	private CompositeAlgorithm algorithm;


	public
	void useAlgorithm()
	{
		try { useAlgorithm(null); }
		catch (InterruptedException e) {
			//cannot happen 'cause no MT, but keep the flag for the caller
			Thread.currentThread().interrupt();
			throw new RuntimeException("Interrupted while composing serially", e);
		}
	}

	public
	void useAlgorithm(final ExecutorService threadWorkers)
	throws InterruptedException
	{
		if (algorithm == null)
			throw new RuntimeException("Cannot work without an algorithm.");
		if (inImgs == null)
			throw new RuntimeException("Cannot work without a loaded group.");

		log.info("calling composite algorithm over "+inImgs.size()+" images");
		outCompositeImg = algorithm.compose(inImgs, threadWorkers);
	}


	public
	void processGroup(final Path groupFolder)
	{
		if (algorithm == null)
			throw new RuntimeException("Cannot work without an algorithm.");

		super.loadGroup(groupFolder);
		useAlgorithm();
	}

	public
	void processGroup(final Path groupFolder, final int noOfThreads)
	{
		if (noOfThreads < 2)
		{
			processGroup(groupFolder);
			return;
		}

		log.info("Processing group with multithreading ("+noOfThreads+" threads)");
		final ExecutorService w = Executors.newFixedThreadPool(noOfThreads);
		try {
			processGroup(groupFolder, w);
		} catch (InterruptedException e) {
			throw new RuntimeException("Error in multithreading",e);
		} finally {
			w.shutdownNow();
		}
	}

	void processGroup(final Path groupFolder, final ExecutorService workerThreads)
			throws InterruptedException
	{
		if (algorithm == null)
			throw new RuntimeException("Cannot work without an algorithm.");

		super.loadGroup(listGroup(groupFolder), workerThreads);
		useAlgorithm(workerThreads);
	}


	private Img<ARGBType> outCompositeImg;

	public Img<ARGBType> getOutCompositeImg()
	{ return outCompositeImg; }

	public
	void saveGroup(final Path outFile)
	throws IOException
	{
		if (outCompositeImg == null)
			throw new RuntimeException("Nothing to save, no group has been processed.");

		log.info("Saving file: "+outFile);
		ArgbImages.writePng(outCompositeImg, outFile);
	}

	public
	void releaseGroupResult()
	{
		releaseGroup();
		outCompositeImg = null;
		log.debug("released out img");
	}
}
