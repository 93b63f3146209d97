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
package de.mpicbg.ulman.ensemble.ng;

import de.mpicbg.ulman.ensemble.ng.aggregate.ColorFrequencyAggregator;
import de.mpicbg.ulman.ensemble.ng.aggregate.PixelStat;
import de.mpicbg.ulman.ensemble.ng.blend.ColorBlender;
import de.mpicbg.ulman.ensemble.ng.blend.RenderPolicy;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.loops.LoopBuilder;
import net.imglib2.parallel.TaskExecutors;
import net.imglib2.type.numeric.ARGBType;
import org.scijava.log.Logger;

import java.util.Vector;
import java.util.concurrent.ExecutorService;

/**
 * Finds the most frequent (the dominant) color at every pixel across the
 * input images, and blends it with the selected {@link RenderPolicy}
 * into the composite image. The blender is called exactly once per pixel.
 */
public
class DominantColorComposer implements CompositeAlgorithm
{
	///prevent from creating the class without any connection
	@SuppressWarnings("unused")
	private DominantColorComposer()
	{ log = null; aggregator = null; }

	protected final Logger log;
	protected final ColorFrequencyAggregator aggregator;

	public
	DominantColorComposer(final Logger _log)
	{
		this(_log, RenderPolicy.DEFAULT);
	}

	public
	DominantColorComposer(final Logger _log, final RenderPolicy policy)
	{
		if (_log == null)
			throw new RuntimeException("Please, give me existing Logger.");

		log = _log;
		aggregator = new ColorFrequencyAggregator(log.subLogger("aggregator "));
		setPolicy(policy);
	}


	private RenderPolicy policy;
	private ColorBlender blender;

	public
	void setPolicy(final RenderPolicy policy)
	{
		if (policy == null)
			throw new RuntimeException("Please, give me existing render policy.");

		this.policy = policy;
		this.blender = policy.createBlender();
	}

	public
	RenderPolicy getPolicy()
	{ return policy; }


	@Override
	public
	Img<ARGBType> compose(final Vector<RandomAccessibleInterval<ARGBType>> inImgs)
	{
		final Img<PixelStat> stats = aggregator.aggregate(inImgs);
		final Img<ARGBType> outImg = ArrayImgs.argbs(stats.dimensionsAsLongArray());

		log.info("blending with render mode: "+policy);
		LoopBuilder.setImages(stats, outImg).forEachPixel(blender::blend);
		return outImg;
	}

	@Override
	public
	Img<ARGBType> compose(final Vector<RandomAccessibleInterval<ARGBType>> inImgs,
	                      final ExecutorService workerThreads)
	throws InterruptedException
	{
		if (workerThreads == null) return compose(inImgs);

		final Img<PixelStat> stats = aggregator.aggregate(inImgs, workerThreads);
		final Img<ARGBType> outImg = ArrayImgs.argbs(stats.dimensionsAsLongArray());

		log.info("blending with render mode: "+policy+" (multithreaded)");
		//NB: blenders hold no state, sharing one among threads is fine
		LoopBuilder.setImages(stats, outImg)
				.multiThreaded( TaskExecutors.forExecutorService(workerThreads) )
				.forEachPixel(blender::blend);
		return outImg;
	}
}
