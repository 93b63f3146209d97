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
package de.mpicbg.ulman.ensemble.util;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.ARGBType;
import net.imglib2.view.Views;

import javax.imageio.ImageIO;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.Raster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reading and writing of 8bit RGBA images between files and imglib2 images.
 */
public class ArgbImages
{
	public static final String PNG_FORMAT = "png";
	public static final String PNG_SUFFIX = ".png";

	/** decodes the file into a 2D image, throws IOException if the file
	    is not readable or there is no decoder for it */
	static public
	Img<ARGBType> read(final Path file)
	throws IOException
	{
		final BufferedImage bi = ImageIO.read(file.toFile());
		if (bi == null)
			throw new IOException("No decoder understands the image "+file);
		return fromBufferedImage(bi);
	}

	static public
	Img<ARGBType> fromBufferedImage(final BufferedImage bi)
	{
		final int w = bi.getWidth();
		final int h = bi.getHeight();

		final ColorModel cm = bi.getColorModel();
		if (hasPlainSamples(cm))
			return fromSamples(bi.getRaster(), cm);

		//NB: getRGB() converts into non-premultiplied sRGB 8bit ARGB, the same as ARGBType,
		//    which is exact for indexed and 8bit RGB(A) images
		final int[] pixels = bi.getRGB(0,0, w,h, null, 0,w);
		return ArrayImgs.argbs(pixels, w,h);
	}

	/** gray, gray+alpha and RGB(A) images with integer samples whose values
	    are to be taken as they are, without any color space conversion */
	static boolean hasPlainSamples(final ColorModel cm)
	{
		if (!(cm instanceof ComponentColorModel) || cm.isAlphaPremultiplied()) return false;

		final int transferType = cm.getTransferType();
		if (transferType != DataBuffer.TYPE_BYTE && transferType != DataBuffer.TYPE_USHORT) return false;

		final int csType = cm.getColorSpace().getType();
		if (csType == ColorSpace.TYPE_GRAY) return true;
		//8bit RGB(A) is exact via getRGB(), wider samples are truncated here
		if (csType == ColorSpace.TYPE_RGB)
			for (int c = 0; c < cm.getNumComponents(); ++c)
				if (cm.getComponentSize(c) > 8) return true;
		return false;
	}

	static Img<ARGBType> fromSamples(final Raster raster, final ColorModel cm)
	{
		final int w = raster.getWidth();
		final int h = raster.getHeight();
		final int colorBands = cm.getNumColorComponents();
		final boolean gray = colorBands == 1;
		final int alphaBand = cm.hasAlpha() ? colorBands : -1;

		final int[] bits = new int[cm.getNumComponents()];
		for (int c = 0; c < bits.length; ++c) bits[c] = cm.getComponentSize(c);

		final int[] pixels = new int[w*h];
		for (int y = 0; y < h; ++y)
			for (int x = 0; x < w; ++x)
			{
				final int r = to8bits(raster.getSample(x,y,0), bits[0]);
				final int g = gray ? r : to8bits(raster.getSample(x,y,1), bits[1]);
				final int b = gray ? r : to8bits(raster.getSample(x,y,2), bits[2]);
				final int a = alphaBand < 0 ? 255
						: to8bits(raster.getSample(x,y,alphaBand), bits[alphaBand]);
				pixels[y*w + x] = ARGBType.rgba(r,g,b,a);
			}
		return ArrayImgs.argbs(pixels, w,h);
	}

	/** wider samples keep their most significant 8 bits, narrower samples are stretched over [0,255] */
	static int to8bits(final int sample, final int bits)
	{
		if (bits == 8) return sample;
		if (bits > 8) return sample >> (bits-8);
		return sample * 255 / ((1 << bits) - 1);
	}

	static public
	BufferedImage toBufferedImage(final RandomAccessibleInterval<ARGBType> img)
	{
		final int w = (int)img.dimension(0);
		final int h = (int)img.dimension(1);
		final BufferedImage bi = new BufferedImage(w,h, BufferedImage.TYPE_INT_ARGB);

		final Cursor<ARGBType> c = Views.flatIterable(Views.zeroMin(img)).localizingCursor();
		while (c.hasNext())
		{
			final int argb = c.next().get();
			bi.setRGB(c.getIntPosition(0), c.getIntPosition(1), argb);
		}
		return bi;
	}

	/** encodes the image as PNG, parent folders are created when missing */
	static public
	void writePng(final RandomAccessibleInterval<ARGBType> img, final Path file)
	throws IOException
	{
		writePng(toBufferedImage(img), file);
	}

	static public
	void writePng(final BufferedImage bi, final Path file)
	throws IOException
	{
		final Path parent = file.toAbsolutePath().getParent();
		if (parent != null) Files.createDirectories(parent);

		if (!ImageIO.write(bi, PNG_FORMAT, file.toFile()))
			throw new IOException("No PNG encoder available to write "+file);
	}

	static public
	boolean isPng(final Path file)
	{
		return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(PNG_SUFFIX);
	}
}
