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

/**
 * Per-pixel outcome of the color voting: the most frequent color, the second
 * most frequent (distinct) color, their counts and the number of voters.
 * Colors are packed the same way {@link ARGBType} packs them.
 *
 * If there is no second distinct color, secondCount is 0 and secondColor
 * equals the topColor.
 */
public class PixelStat
{
	public int topColor;
	public int topCount;
	public int secondColor;
	public int secondCount;
	public int total;

	public PixelStat()
	{
		this(0,0,0,0,0);
	}

	public PixelStat(final int topColor, final int topCount,
	                 final int secondColor, final int secondCount,
	                 final int total)
	{
		set(topColor,topCount,secondColor,secondCount,total);
	}

	public
	void set(final int topColor, final int topCount,
	         final int secondColor, final int secondCount,
	         final int total)
	{
		this.topColor = topColor;
		this.topCount = topCount;
		this.secondColor = secondColor;
		this.secondCount = secondCount;
		this.total = total;
	}

	static
	String colorToString(final int argb)
	{
		return "(" + ARGBType.red(argb) + "," + ARGBType.green(argb) + ","
				+ ARGBType.blue(argb) + "," + ARGBType.alpha(argb) + ")";
	}

	@Override
	public String toString()
	{
		return "top " + colorToString(topColor) + " x" + topCount
				+ ", second " + colorToString(secondColor) + " x" + secondCount
				+ ", of " + total;
	}
}
