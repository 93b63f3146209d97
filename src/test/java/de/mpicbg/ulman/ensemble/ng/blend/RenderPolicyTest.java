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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static de.mpicbg.ulman.ensemble.ImageFixtures.rgb;
import static org.junit.jupiter.api.Assertions.*;

class RenderPolicyTest
{
	static final int RED = rgb(255,0,0);
	static final int GREEN = rgb(0,255,0);
	static final int WHITE = rgb(255,255,255);

	static int blend(final RenderPolicy policy, final PixelStat stat)
	{
		final ARGBType out = new ARGBType();
		policy.createBlender().blend(stat, out);
		return out.get();
	}

	@Test
	void whiteFadesByAgreement()
	{
		final PixelStat s = new PixelStat(RED,2, GREEN,1, 3);
		assertEquals(rgb(255,85,85), blend(RenderPolicy.WHITE, s));
		assertEquals(rgb(255,85,85), blend(RenderPolicy.DOMINANCE, s));
	}

	@Test
	void smoothMixesTheTwoTopColors()
	{
		assertEquals(rgb(170,85,0), blend(RenderPolicy.SMOOTH, new PixelStat(RED,2, GREEN,1, 3)));
	}

	@Test
	void confidenceIsWhiteUpToHalfOfVoters()
	{
		assertEquals(WHITE, blend(RenderPolicy.CONFIDENCE, new PixelStat(RED,1, GREEN,1, 2)));
		assertEquals(WHITE, blend(RenderPolicy.CONFIDENCE, new PixelStat(RED,2, GREEN,2, 5)));
		assertEquals(WHITE, blend(RenderPolicy.CONFIDENCE, new PixelStat(rgb(0,0,0),1, GREEN,1, 4)));
		//3 of 4: conf = 0.5
		assertEquals(rgb(255,127,127), blend(RenderPolicy.CONFIDENCE, new PixelStat(RED,3, GREEN,1, 4)));
	}

	@ParameterizedTest
	@EnumSource(RenderPolicy.class)
	void unanimousVoteKeepsTheColor(final RenderPolicy policy)
	{
		final int c = rgb(12,200,77);
		assertEquals(c, blend(policy, new PixelStat(c,7, c,0, 7)));
		assertEquals(c, blend(policy, new PixelStat(c,1, c,0, 1)));
	}

	@ParameterizedTest
	@EnumSource(RenderPolicy.class)
	void outputIsAlwaysOpaque(final RenderPolicy policy)
	{
		final int seeThrough = ARGBType.rgba(10,20,30,0);
		assertEquals(255, ARGBType.alpha(blend(policy, new PixelStat(seeThrough,1, GREEN,1, 2))));
	}

	@ParameterizedTest
	@EnumSource(value = RenderPolicy.class, names = {"WHITE","DOMINANCE","CONFIDENCE"})
	void moreAgreementNeverMovesAwayFromTheColor(final RenderPolicy policy)
	{
		final int c = rgb(20,140,250);
		int lastDistance = Integer.MAX_VALUE;
		for (int top = 1; top <= 10; ++top)
		{
			final int out = blend(policy, new PixelStat(c,top, GREEN,0, 10));
			final int distance = Math.abs(ARGBType.red(out)-ARGBType.red(c))
					+ Math.abs(ARGBType.green(out)-ARGBType.green(c))
					+ Math.abs(ARGBType.blue(out)-ARGBType.blue(c));
			assertTrue(distance <= lastDistance, "at topCount="+top);
			lastDistance = distance;
		}
		assertEquals(0, lastDistance);
	}

	@Test
	void labelsAreParsedIgnoringCase()
	{
		assertEquals(RenderPolicy.WHITE, RenderPolicy.fromLabel("white"));
		assertEquals(RenderPolicy.DOMINANCE, RenderPolicy.fromLabel(" DOMINANCE "));
		assertEquals(RenderPolicy.WHITE, RenderPolicy.DEFAULT);
		assertThrows(IllegalArgumentException.class, () -> RenderPolicy.fromLabel("median"));
		assertThrows(IllegalArgumentException.class, () -> RenderPolicy.fromLabel(null));
	}
}
