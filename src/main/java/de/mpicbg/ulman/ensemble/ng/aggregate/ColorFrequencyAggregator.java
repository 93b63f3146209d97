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
package de.mpicbg.ulman.ensemble.ng.aggregate;

import de.mpicbg.ulman.ensemble.ng.InvalidGroupException;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.list.ListImg;
import net.imglib2.type.numeric.ARGBType;
import net.imglib2.view.Views;
import org.scijava.log.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Vector;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Votes, pixel after pixel, over colors of a group of equally sized 2D images
 * and stores the outcome of every vote in a {@link PixelStat} image of the same
 * size. The pixels do not influence each other, the image can be thus processed
 * row after row in parallel.
 */
public
class ColorFrequencyAggregator
{
	///prevent from creating the class without any connection
	@SuppressWarnings("unused")
	private ColorFrequencyAggregator()
	{ log = null; }

	protected final Logger log;

	public
	ColorFrequencyAggregator(final Logger _log)
	{
		if (_log == null)
			throw new RuntimeException("Please, give me existing Logger.");

		log = _log;
	}


	/** processes the group serially */
	public
	Img<PixelStat> aggregate(final Vector<RandomAccessibleInterval<ARGBType>> inImgs)
	{
		try { return aggregate(inImgs, null); }
		catch (InterruptedException e) {
			//cannot happen 'cause no MT, but keep the flag for the caller
			Thread.currentThread().interrupt();
			throw new RuntimeException("Interrupted while aggregating serially", e);
		}
	}

	/** processes the group in parallel, row after row, if 'workerThreads' is given */
	public
	Img<PixelStat> aggregate(final Vector<RandomAccessibleInterval<ARGBType>> inImgs,
	                         final ExecutorService workerThreads)
	throws InterruptedException
	{
		final long[] dims = checkSameSize(inImgs);
		final int width  = (int)dims[0];
		final int height = (int)dims[1];
		log.debug("aggregating "+inImgs.size()+" images of "+width+"x"+height+" pixels");

		//shared read-only views, each starting at [0,0]
		final List<RandomAccessibleInterval<ARGBType>> views = new ArrayList<>(inImgs.size());
		for (RandomAccessibleInterval<ARGBType> img : inImgs) views.add( Views.zeroMin(img) );

		//output "containers" need to be created in advance, rows only set() them
		final List<PixelStat> stats = new ArrayList<>(width*height);
		for (int i = 0; i < width*height; ++i) stats.add(new PixelStat());

		if (workerThreads == null)
		{
			for (int y = 0; y < height; ++y)
				new AggregateRow(views,y,width,stats).call();
		}
		else
		{
			final List<AggregateRow> tasks = new ArrayList<>(height);
			for (int y = 0; y < height; ++y)
				tasks.add( new AggregateRow(views,y,width,stats) );

			try {
				for (Future<AggregateRow> f : workerThreads.invokeAll(tasks)) f.get();
			}
			catch (ExecutionException e) {
				log.error("Execution error during multithreading: "+e.getMessage());
				throw new InterruptedException("Interrupting aggregate() because of execution error.");
			}
		}

		return new ListImg<>(stats, width, height);
	}


	/** checks all images are 2D and of the same size as the first one,
	    returns the common size */
	static public
	long[] checkSameSize(final Vector<RandomAccessibleInterval<ARGBType>> inImgs)
	{
		if (inImgs == null || inImgs.isEmpty())
			throw new InvalidGroupException("Cannot aggregate an empty group of images.");

		final RandomAccessibleInterval<ARGBType> first = inImgs.get(0);
		if (first.numDimensions() != 2)
			throw new InvalidGroupException("Only 2D images are supported, the first image is "
					+first.numDimensions()+"D.");

		final long[] dims = first.dimensionsAsLongArray();
		for (int i = 1; i < inImgs.size(); ++i)
		{
			final RandomAccessibleInterval<ARGBType> img = inImgs.get(i);
			if (img.numDimensions() != 2
				|| img.dimension(0) != dims[0] || img.dimension(1) != dims[1])
				throw new InvalidGroupException("Image no. "+i+" differs in size from the first image ("
						+dims[0]+"x"+dims[1]+").");
		}
		return dims;
	}


	class AggregateRow implements Callable<AggregateRow>
	{
		AggregateRow(final List<RandomAccessibleInterval<ARGBType>> views,
		             final int y, final int width,
		             final List<PixelStat> stats)
		{
			this.views = views;
			this.y = y;
			this.width = width;
			this.stats = stats;
		}

		final List<RandomAccessibleInterval<ARGBType>> views;
		final int y;
		final int width;
		final List<PixelStat> stats;

		@Override
		public AggregateRow call()
		{
			final int total = views.size();
			final List<RandomAccess<ARGBType>> ras = new ArrayList<>(total);
			for (RandomAccessibleInterval<ARGBType> v : views)
			{
				final RandomAccess<ARGBType> ra = v.randomAccess();
				ra.setPosition(y,1);
				ras.add(ra);
			}

			final ColorFrequencyTable table = new ColorFrequencyTable(total);
			final int offset = y*width;
			for (int x = 0; x < width; ++x)
			{
				table.clear();
				for (RandomAccess<ARGBType> ra : ras)
				{
					ra.setPosition(x,0);
					table.add( ra.get().get() );
				}
				table.extractTopTwo(total, stats.get(offset+x));
			}
			return this;
		}
	}
}
