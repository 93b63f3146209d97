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

import net.imglib2.img.Img;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.ARGBType;
import java.util.Vector;
import java.util.concurrent.ExecutorService;

/**
 * The minimal interface to compose together a group of co-registered,
 * equally sized color images (e.g., forecast maps from several ensemble
 * members) into one color image of the same size.
 *
 * The order of the input images is irrelevant, but the collection holding
 * them is a one that allows to address images with indices (so that implementing
 * classes may report problems with a particular image).
 *
 * Implementing classes may use additional setter methods to provide beforehand
 * the parameters to the composing process.
 */
public
interface CompositeAlgorithm
{
	/** The workhorse method to compose 'inImgs' into a new image. */
	Img<ARGBType> compose(final Vector<RandomAccessibleInterval<ARGBType>> inImgs);

	/** The same as {@link #compose(Vector)} but the work may be shared among
	    the 'workerThreads', the outcome must not differ from the former. */
	default
	Img<ARGBType> compose(final Vector<RandomAccessibleInterval<ARGBType>> inImgs,
	                      final ExecutorService workerThreads)
	throws InterruptedException
	{
		return compose(inImgs);
	}
}
