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

import de.mpicbg.ulman.ensemble.util.ArgbImages;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.ARGBType;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Vector;

/** Small helpers to create images for the tests. */
public class ImageFixtures
{
	static public
	int rgb(final int r, final int g, final int b)
	{ return ARGBType.rgba(r,g,b,255); }

	/** image of the given size filled with one color */
	static public
	Img<ARGBType> uniform(final int width, final int height, final int argb)
	{
		final int[] pixels = new int[width*height];
		Arrays.fill(pixels, argb);
		return ArrayImgs.argbs(pixels, width,height);
	}

	/** image given row after row */
	static public
	Img<ARGBType> of(final int width, final int height, final int... argbs)
	{
		return ArrayImgs.argbs(argbs.clone(), width,height);
	}

	@SafeVarargs
	static public
	Vector<RandomAccessibleInterval<ARGBType>> group(final RandomAccessibleInterval<ARGBType>... imgs)
	{
		return new Vector<>(Arrays.asList(imgs));
	}

	static public
	int pixel(final RandomAccessibleInterval<ARGBType> img, final int x, final int y)
	{
		final RandomAccess<ARGBType> ra = img.randomAccess();
		ra.setPosition(new long[] {x,y});
		return ra.get().get();
	}

	static public
	Path writeUniformPng(final Path file, final int width, final int height, final int argb)
	throws IOException
	{
		ArgbImages.writePng(uniform(width,height,argb), file);
		return file;
	}
}
