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

import de.mpicbg.ulman.ensemble.ng.InvalidGroupException;
import de.mpicbg.ulman.ensemble.util.ArgbImages;
import de.mpicbg.ulman.ensemble.util.LeafFolders;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.ARGBType;
import org.scijava.log.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.ArrayList;
import java.util.Vector;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.Executors;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ExecutionException;

/**
 * This class essentially takes care of the input IO burden. One provides it
 * with a folder that holds a group of images (or with the list of the image
 * files directly), and the class reads the images and makes sure they
 * are all of the same size. The loaded images are placed in the inImgs
 * attribute, in the order of the given files.
 *
 * Any problem with the group (no images, an image that cannot be decoded,
 * images of different sizes) is reported with {@link InvalidGroupException}.
 */
public
class GroupIO
{
	///prevent from creating the class without any connection
	@SuppressWarnings("unused")
	private GroupIO()
	{ log = null; } //this is to get rid of some warnings

	protected final Logger log;
	public Logger shareLogger() { return log; }

	public
	GroupIO(final Logger _log)
	{
		if (_log == null)
			throw new RuntimeException("Please, give me existing Logger.");

		log = _log;
	}


	// ----------- output attributes with the group -----------
	/** output attribute: container to store the input images */
	public Vector<RandomAccessibleInterval<ARGBType>> inImgs;

	/** output attribute: the files the inImgs were read from */
	public List<Path> inFiles;


	// ----------- input group to output attributes -----------
	/** reads all PNG images from the 'groupFolder' serially */
	public
	void loadGroup(final Path groupFolder)
	{
		try { loadGroup( listGroup(groupFolder), null ); }
		catch (InterruptedException e) {
			//cannot happen 'cause no MT, but keep the flag for the caller
			Thread.currentThread().interrupt();
			throw new RuntimeException("Interrupted while loading serially", e);
		}
	}

	/** reads all PNG images from the 'groupFolder' in parallel */
	public
	void loadGroup(final Path groupFolder, final int noOfThreads)
	{
		log.info("Loading images with multithreading ("+noOfThreads+" threads)");
		final ExecutorService w = Executors.newFixedThreadPool(noOfThreads);
		try {
			loadGroup( listGroup(groupFolder), w );
		} catch (InterruptedException e) {
			throw new RuntimeException("Error in multithreading",e);
		} finally {
			w.shutdownNow();
		}
	}

	/** lists the images of the group, the group must not be empty */
	public
	List<Path> listGroup(final Path groupFolder)
	{
		final List<Path> files;
		try {
			files = LeafFolders.listImages(groupFolder);
		} catch (IOException e) {
			throw new InvalidGroupException("Cannot list images in "+groupFolder+": "+e.getMessage(), e);
		}
		if (files.isEmpty())
			throw new InvalidGroupException("No PNG images found in "+groupFolder);
		return files;
	}


	// ----------- parallelization of loadGroup() -----------
	//shared among the image readers
	long[] firstImgDimensions = null;

	class LoadOneInput implements Callable<LoadOneInput>
	{
		LoadOneInput(final List<Path> inputBatch, final int whichOneFromTheBatch)
		{
			files = inputBatch;
			input_idx = whichOneFromTheBatch;
		}

		final List<Path> files;
		final int input_idx;

		String isErrorMsg; //non-null is flagging an error ;-)
		Img<ARGBType> img;

		@Override
		public LoadOneInput call()
		{
			final Path file = files.get(input_idx);
			try
			{
				log.debug("Reading started: " + file);
				img = ArgbImages.read(file);
				log.trace("Reading done: " + file);

				if (img.numDimensions() != 2)
					throw new InvalidGroupException(file+" image is not 2D.");
			}
			catch (InvalidGroupException | IOException e) {
				isErrorMsg = "Failed reading "+file+": "+e.getMessage();
			}
			catch (RuntimeException e) {
				//NB: broken files sometimes make the decoders fail in unexpected ways
				isErrorMsg = "Failed decoding "+file+": "+e;
			}

			return this;
		}
	}

	/** checks that the image is of the same size as the first one,
	    the first checked image defines the reference size */
	void checkDimensions(final LoadOneInput loaded)
	{
		final Img<ARGBType> img = loaded.img;
		if (firstImgDimensions == null)
		{
			firstImgDimensions = img.dimensionsAsLongArray();
			return;
		}

		for (int d=0; d < img.numDimensions(); ++d)
			if (img.dimension(d) != firstImgDimensions[d])
				throw new InvalidGroupException(loaded.files.get(loaded.input_idx)
						+" image ("+img.dimension(0)+"x"+img.dimension(1)+") has different size than the first image ("
						+firstImgDimensions[0]+"x"+firstImgDimensions[1]+").");
	}


	/** reads the 'files', in parallel if 'workerThreads' is given */
	public
	void loadGroup(final List<Path> files, final ExecutorService workerThreads)
			throws InterruptedException
	{
		if (files == null || files.isEmpty())
			throw new InvalidGroupException("Cannot load an empty group of images.");

		final int inputImagesCount = files.size();
		inImgs = new Vector<>(inputImagesCount);
		inFiles = new ArrayList<>(files);
		firstImgDimensions = null;

		final List<LoadOneInput> loaded = new ArrayList<>(inputImagesCount);
		if (workerThreads == null)
		{
			//singlethreading special case
			for (int i = 0; i < inputImagesCount; ++i)
			{
				final LoadOneInput l = new LoadOneInput(files,i).call();
				if (l.isErrorMsg != null)
					throw new InvalidGroupException(l.isErrorMsg);
				loaded.add(l);
			}
		}
		else
		{
			//multithreading
			final List<LoadOneInput> tasks = new ArrayList<>(inputImagesCount);
			for (int i = 0; i < inputImagesCount; ++i)
				tasks.add( new LoadOneInput(files,i) );

			try {
				for (Future<LoadOneInput> f : workerThreads.invokeAll(tasks))
				{
					final LoadOneInput l = f.get();
					if (l.isErrorMsg != null)
						throw new InvalidGroupException(l.isErrorMsg);
					loaded.add(l);
				}
			}
			catch (ExecutionException e) {
				log.error("Execution error during multithreading: "+e.getMessage());
				throw new InterruptedException("Interrupting loadGroup() because of execution error.");
			}
		}

		//NB: sizes are checked in the order of the files, so the reports are stable
		for (LoadOneInput l : loaded)
		{
			checkDimensions(l);
			inImgs.add(l.img);
		}
		log.info("Loaded "+inImgs.size()+" images of "
				+firstImgDimensions[0]+"x"+firstImgDimensions[1]+" pixels");
	}

	public
	void releaseGroup()
	{
		inImgs = null;
		inFiles = null;
		firstImgDimensions = null;
	}
}
