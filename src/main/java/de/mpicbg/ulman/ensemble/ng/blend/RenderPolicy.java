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

import java.util.Locale;

/**
 * Named ways of blending the outcome of the per-pixel voting into the
 * composite. One policy is chosen for the whole run.
 */
public enum RenderPolicy
{
	/** most frequent color faded towards white by the fraction of agreeing voters */
	WHITE("white"),
	/** the two most frequent colors mixed by their counts */
	SMOOTH("smooth"),
	/** like WHITE but a half (or less) of agreeing voters gives pure white */
	CONFIDENCE("confidence"),
	/** the same formula as WHITE, kept under its own name */
	DOMINANCE("dominance");

	public static final RenderPolicy DEFAULT = WHITE;

	public final String label;

	RenderPolicy(final String label)
	{
		this.label = label;
	}

	public
	ColorBlender createBlender()
	{
		switch (this)
		{
			case SMOOTH:
				return new SmoothBlender();
			case CONFIDENCE:
				return new HalfwayConfidenceBlender();
			case WHITE:
			case DOMINANCE:
			default:
				return new TowardsWhiteBlender();
		}
	}

	/** finds the policy by its label, case is ignored */
	static public
	RenderPolicy fromLabel(final String label)
	{
		if (label != null)
		{
			final String l = label.trim().toLowerCase(Locale.ROOT);
			for (RenderPolicy p : values())
				if (p.label.equals(l)) return p;
		}
		throw new IllegalArgumentException("Unknown render mode \""+label+"\", expected one of: "+allLabels());
	}

	static public
	String allLabels()
	{
		final StringBuilder sb = new StringBuilder();
		for (RenderPolicy p : values())
		{
			if (sb.length() > 0) sb.append(", ");
			sb.append(p.label);
		}
		return sb.toString();
	}

	@Override
	public String toString()
	{ return label; }
}
