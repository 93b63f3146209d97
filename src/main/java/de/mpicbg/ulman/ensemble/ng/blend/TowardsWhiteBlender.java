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
 * Mixes the most frequent color with white, the less voters agree
 * on the color the whiter the pixel becomes. The second color is ignored.
 */
public class TowardsWhiteBlender implements ColorBlender
{
	public static final int WHITE = 255;

	/** fraction of voters that agree on the most frequent color */
	protected
	double confidence(final PixelStat stat)
	{
		return (double)stat.topCount / (double)stat.total;
	}

	@Override
	public
	void blend(final PixelStat stat, final ARGBType out)
	{
		final double conf = confidence(stat);
		final double rest = 1.0 - conf;
		final int c = stat.topColor;

		out.set( ARGBType.rgba(
				ColorBlender.mixChannel(ARGBType.red(c),   conf, WHITE, rest),
				ColorBlender.mixChannel(ARGBType.green(c), conf, WHITE, rest),
				ColorBlender.mixChannel(ARGBType.blue(c),  conf, WHITE, rest),
				255) );
	}
}
