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
package de.mpicbg.ulman.ensemble.ng.backbones;

import de.mpicbg.ulman.ensemble.ng.DominantColorComposer;
import de.mpicbg.ulman.ensemble.ng.InvalidGroupException;
import de.mpicbg.ulman.ensemble.ng.blend.RenderPolicy;
import de.mpicbg.ulman.ensemble.util.ArgbImages;
import de.mpicbg.ulman.ensemble.util.loggers.NoOutputLogger;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.ARGBType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static de.mpicbg.ulman.ensemble.ImageFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CompositeFeederTest
{
	@TempDir
	Path tmp;

	CompositeFeeder feeder(final RenderPolicy policy)
	{
		final NoOutputLogger log = new NoOutputLogger();
		return new CompositeFeeder(log).setAlgorithm(new DominantColorComposer(log, policy));
	}

	@Test
	void loadsAllPngsInFilenameOrder() throws IOException
	{
		writeUniformPng(tmp.resolve("b.png"), 2,2, rgb(0,0,255));
		writeUniformPng(tmp.resolve("a.png"), 2,2, rgb(255,0,0));
		Files.write(tmp.resolve("notes.txt"), "not an image".getBytes());

		final GroupIO io = new GroupIO(new NoOutputLogger());
		io.loadGroup(tmp);
		assertEquals(2, io.inImgs.size());
		assertEquals(tmp.resolve("a.png"), io.inFiles.get(0));
		assertEquals(rgb(255,0,0), pixel(io.inImgs.get(0),1,1));
	}

	@Test
	void processesAndSavesGroup() throws IOException
	{
		final Path group = tmp.resolve("Europe_T2m").resolve("202611");
		writeUniformPng(group.resolve("1.png"), 5,3, rgb(255,0,0));
		writeUniformPng(group.resolve("2.png"), 5,3, rgb(255,0,0));
		writeUniformPng(group.resolve("3.png"), 5,3, rgb(0,255,0));

		final CompositeFeeder f = feeder(RenderPolicy.WHITE);
		f.processGroup(group, 2);
		final Path outFile = tmp.resolve("out").resolve("202611.png");
		f.saveGroup(outFile);
		f.releaseGroupResult();
		assertNull(f.getOutCompositeImg());
		assertNull(f.inImgs);

		final Img<ARGBType> out = ArgbImages.read(outFile);
		assertEquals(5, out.dimension(0));
		assertEquals(3, out.dimension(1));
		assertEquals(rgb(255,85,85), pixel(out,4,2));
	}

	@ParameterizedTest
	@EnumSource(RenderPolicy.class)
	void singleGrayImageIsReproduced(final RenderPolicy policy) throws IOException
	{
		final BufferedImage bi = new BufferedImage(2,1, BufferedImage.TYPE_BYTE_GRAY);
		bi.getRaster().setSample(0,0,0, 100);
		bi.getRaster().setSample(1,0,0, 30);
		final Path group = tmp.resolve("Europe_Prec").resolve("202612");
		Files.createDirectories(group);
		assertTrue(ImageIO.write(bi, "png", group.resolve("1.png").toFile()));

		final CompositeFeeder f = feeder(policy);
		f.processGroup(group);
		final Path outFile = tmp.resolve("out.png");
		f.saveGroup(outFile);

		final Img<ARGBType> out = ArgbImages.read(outFile);
		assertEquals(rgb(100,100,100), pixel(out,0,0));
		assertEquals(rgb(30,30,30), pixel(out,1,0));
	}

	@Test
	void sizeMismatchIsRejectedSerially() throws IOException
	{
		writeUniformPng(tmp.resolve("a.png"), 4,4, rgb(1,1,1));
		writeUniformPng(tmp.resolve("b.png"), 4,5, rgb(1,1,1));

		final CompositeFeeder f = feeder(RenderPolicy.SMOOTH);
		assertThrows(InvalidGroupException.class, () -> f.processGroup(tmp));
		assertNull(f.getOutCompositeImg());
	}

	@Test
	void sizeMismatchIsRejectedInParallel() throws IOException
	{
		writeUniformPng(tmp.resolve("a.png"), 4,4, rgb(1,1,1));
		writeUniformPng(tmp.resolve("b.png"), 4,5, rgb(1,1,1));
		writeUniformPng(tmp.resolve("c.png"), 4,4, rgb(1,1,1));

		assertThrows(InvalidGroupException.class, () -> feeder(RenderPolicy.WHITE).processGroup(tmp, 3));
	}

	@Test
	void undecodableImageIsRejected() throws IOException
	{
		writeUniformPng(tmp.resolve("a.png"), 2,2, rgb(1,1,1));
		Files.write(tmp.resolve("b.png"), new byte[] {0,1,2,3});

		final InvalidGroupException e = assertThrows(InvalidGroupException.class,
				() -> feeder(RenderPolicy.WHITE).processGroup(tmp));
		assertTrue(e.getMessage().contains("b.png"));
	}

	@Test
	void emptyGroupIsRejected()
	{
		assertThrows(InvalidGroupException.class, () -> feeder(RenderPolicy.WHITE).processGroup(tmp));
	}

	@Test
	void unwritableOutputIsReported() throws IOException
	{
		writeUniformPng(tmp.resolve("g").resolve("a.png"), 2,2, rgb(1,1,1));
		//a file blocks the creation of the output folder
		Files.write(tmp.resolve("blocker"), new byte[] {1});

		final CompositeFeeder f = feeder(RenderPolicy.WHITE);
		f.processGroup(tmp.resolve("g"));
		assertThrows(IOException.class, () -> f.saveGroup(tmp.resolve("blocker").resolve("out.png")));
	}

	@Test
	void cannotWorkWithoutAlgorithm()
	{
		assertThrows(RuntimeException.class, () -> new CompositeFeeder(new NoOutputLogger()).setAlgorithm(null));
		assertThrows(RuntimeException.class, () -> new CompositeFeeder(new NoOutputLogger()).processGroup(tmp));
	}
}
