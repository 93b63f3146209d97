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

import de.mpicbg.ulman.ensemble.ng.blend.RenderPolicy;
import de.mpicbg.ulman.ensemble.util.loggers.NoOutputLogger;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.ARGBType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Vector;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static de.mpicbg.ulman.ensemble.ImageFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class DominantColorComposerTest
{
	static final int RED = rgb(255,0,0);
	static final int GREEN = rgb(0,255,0);
	static final int BLUE = rgb(0,0,255);

	static Vector<RandomAccessibleInterval<ARGBType>> redRedGreen()
	{
		return group(uniform(1,1,RED), uniform(1,1,RED), uniform(1,1,GREEN));
	}

	@Test
	void endToEndWhite()
	{
		final Img<ARGBType> out = new DominantColorComposer(new NoOutputLogger(), RenderPolicy.WHITE)
				.compose(redRedGreen());
		assertEquals(rgb(255,85,85), pixel(out,0,0));
	}

	@Test
	void endToEndSmooth()
	{
		final Img<ARGBType> out = new DominantColorComposer(new NoOutputLogger(), RenderPolicy.SMOOTH)
				.compose(redRedGreen());
		assertEquals(rgb(170,85,0), pixel(out,0,0));
	}

	@ParameterizedTest
	@EnumSource(RenderPolicy.class)
	void singleImageIsReproduced(final RenderPolicy policy)
	{
		final Img<ARGBType> in = of(3,2, RED,GREEN,BLUE, rgb(1,2,3),rgb(200,100,50),rgb(255,255,255));
		final Img<ARGBType> out = new DominantColorComposer(new NoOutputLogger(), policy).compose(group(in));

		assertEquals(3, out.dimension(0));
		assertEquals(2, out.dimension(1));
		for (int y = 0; y < 2; ++y)
			for (int x = 0; x < 3; ++x)
				assertEquals(pixel(in,x,y), pixel(out,x,y));
	}

	@ParameterizedTest
	@EnumSource(RenderPolicy.class)
	void multithreadedEqualsSinglethreaded(final RenderPolicy policy) throws InterruptedException
	{
		final Vector<RandomAccessibleInterval<ARGBType>> imgs = group(
				of(4,2, RED,GREEN,BLUE,RED, GREEN,GREEN,BLUE,RED),
				of(4,2, RED,BLUE,BLUE,GREEN, GREEN,RED,RED,RED),
				of(4,2, BLUE,GREEN,RED,GREEN, GREEN,BLUE,BLUE,RED),
				of(4,2, RED,RED,BLUE,GREEN, BLUE,RED,GREEN,GREEN));
		final DominantColorComposer composer = new DominantColorComposer(new NoOutputLogger(), policy);
		final Img<ARGBType> serial = composer.compose(imgs);

		final ExecutorService workers = Executors.newFixedThreadPool(3);
		try {
			final Img<ARGBType> parallel = composer.compose(imgs, workers);
			for (int y = 0; y < 2; ++y)
				for (int x = 0; x < 4; ++x)
					assertEquals(pixel(serial,x,y), pixel(parallel,x,y));
		} finally {
			workers.shutdownNow();
		}
	}

	@Test
	void policyCanBeSwitched()
	{
		final DominantColorComposer composer = new DominantColorComposer(new NoOutputLogger());
		assertEquals(RenderPolicy.WHITE, composer.getPolicy());

		composer.setPolicy(RenderPolicy.CONFIDENCE);
		//2 of 3 votes give conf = 1/3
		assertEquals(rgb(255,170,170), pixel(composer.compose(redRedGreen()),0,0));
	}

	@Test
	void rejectsMissingLoggerOrPolicy()
	{
		assertThrows(RuntimeException.class, () -> new DominantColorComposer(null));
		assertThrows(RuntimeException.class,
				() -> new DominantColorComposer(new NoOutputLogger()).setPolicy(null));
	}
}
