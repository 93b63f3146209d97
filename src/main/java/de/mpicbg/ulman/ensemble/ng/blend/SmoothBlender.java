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
 * Mixes the two most frequent colors proportionally to their counts,
 * white is not involved here at all.
 */
public class SmoothBlender implements ColorBlender
{
	@Override
	public
	void blend(final PixelStat stat, final ARGBType out)
	{
		final double sum = stat.topCount + stat.secondCount;
		final double w1 = stat.topCount / sum;
		final double w2 = stat.secondCount / sum;
		final int c1 = stat.topColor;
		final int c2 = stat.secondColor;

		out.set( ARGBType.rgba(
				ColorBlender.mixChannel(ARGBType.red(c1),   w1, ARGBType.red(c2),   w2),
				ColorBlender.mixChannel(ARGBType.green(c1), w1, ARGBType.green(c2), w2),
				ColorBlender.mixChannel(ARGBType.blue(c1),  w1, ARGBType.blue(c2),  w2),
				255) );
	}
}
