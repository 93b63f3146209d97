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
package de.mpicbg.ulman.ensemble.ng.blend;

import de.mpicbg.ulman.ensemble.ng.aggregate.PixelStat;
import net.imglib2.type.numeric.ARGBType;

/**
 * Turns the outcome of the color voting at one pixel into the color
 * of that pixel in the composite image.
 */
public interface ColorBlender
{
	/**
	 * Every channel is interpolated independently and truncated to 8 bits,
	 * the alpha of the 'out' is always 255.
	 *
	 * @param stat  outcome of the voting at the pixel, stat.total must be positive
	 * @param out   where the blended color is stored
	 */
	void blend(final PixelStat stat, final ARGBType out);

	/** linear mix of a single 8bit channel, truncated and clamped into [0,255] */
	static
	int mixChannel(final int a, final double wa, final int b, final double wb)
	{
		final int v = (int)(a*wa + b*wb);
		return v < 0 ? 0 : Math.min(v, 255);
	}
}
