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

import net.imglib2.type.numeric.ARGBType;

import java.util.Map;
import java.util.HashMap;

/**
 * Counts how many times every exact RGBA color has been seen at one pixel
 * position. One instance is meant to be re-used by one worker, pixel after
 * pixel, with {@link #clear()} in between.
 */
public class ColorFrequencyTable
{
	private final Map<Integer,Integer> counts;

	public ColorFrequencyTable()
	{
		this(16);
	}

	public ColorFrequencyTable(final int expectedNoOfColors)
	{
		counts = new HashMap<>(2*expectedNoOfColors);
	}

	public
	void clear()
	{ counts.clear(); }

	public
	void add(final int argb)
	{ counts.merge(argb, 1, Integer::sum); }

	public
	int size()
	{ return counts.size(); }

	public
	int countOf(final int argb)
	{ return counts.getOrDefault(argb, 0); }

	/**
	 * Scans the table once and fills the two most frequent distinct colors
	 * into the 'stat'. Colors with equal counts are ordered by their (R,G,B,A)
	 * tuple, the smaller tuple wins, see {@link #isPreferred(int, int)}.
	 *
	 * @param total  the number of voters, stored as is into the 'stat'
	 * @param stat   the outcome
	 */
	public
	void extractTopTwo(final int total, final PixelStat stat)
	{
		if (counts.isEmpty())
			throw new IllegalStateException("Cannot extract colors from an empty frequency table.");

		int topColor = 0, topCount = 0;
		int secondColor = 0, secondCount = 0;

		for (Map.Entry<Integer,Integer> e : counts.entrySet())
		{
			final int color = e.getKey();
			final int count = e.getValue();

			if (count > topCount || (count == topCount && isPreferred(color,topColor)))
			{
				//the current top degrades to the second place
				secondColor = topColor;
				secondCount = topCount;
				topColor = color;
				topCount = count;
			}
			else if (count > secondCount || (count == secondCount && isPreferred(color,secondColor)))
			{
				secondColor = color;
				secondCount = count;
			}
		}

		if (secondCount == 0) secondColor = topColor;
		stat.set(topColor,topCount, secondColor,secondCount, total);
	}

	/** returns true if 'color' goes before 'other' in the lexicographical
	    (R,G,B,A) order; used to break ties between equally frequent colors */
	static public
	boolean isPreferred(final int color, final int other)
	{
		return compareRGBA(color,other) < 0;
	}

	static public
	int compareRGBA(final int a, final int b)
	{
		int c = Integer.compare(ARGBType.red(a), ARGBType.red(b));
		if (c != 0) return c;
		c = Integer.compare(ARGBType.green(a), ARGBType.green(b));
		if (c != 0) return c;
		c = Integer.compare(ARGBType.blue(a), ARGBType.blue(b));
		if (c != 0) return c;
		return Integer.compare(ARGBType.alpha(a), ARGBType.alpha(b));
	}
}
