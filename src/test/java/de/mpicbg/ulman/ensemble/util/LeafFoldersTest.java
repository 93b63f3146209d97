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

import de.mpicbg.ulman.ensemble.util.loggers.NoOutputLogger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static de.mpicbg.ulman.ensemble.ImageFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class LeafFoldersTest
{
	@TempDir
	Path tmp;

	@Test
	void findsOnlyLeafFoldersWithImages() throws IOException
	{
		final Path t2m = tmp.resolve("Europe_T2m");
		writeUniformPng(t2m.resolve("202612").resolve("x.png"), 1,1, rgb(0,0,0));
		writeUniformPng(t2m.resolve("202611").resolve("x.PNG"), 1,1, rgb(0,0,0));
		//a parent folder with images is not a group
		writeUniformPng(t2m.resolve("stray.png"), 1,1, rgb(0,0,0));
		//a leaf without images is not a group either
		Files.createDirectories(tmp.resolve("Europe_Prec").resolve("202611"));
		Files.write(tmp.resolve("Europe_Prec").resolve("202611").resolve("readme.txt"), new byte[] {65});

		final List<Path> groups = LeafFolders.findGroups(tmp, new NoOutputLogger());
		assertEquals(Arrays.asList(t2m.resolve("202611"), t2m.resolve("202612")), groups);
	}

	@Test
	void rootItselfCanBeTheGroup() throws IOException
	{
		writeUniformPng(tmp.resolve("a.png"), 1,1, rgb(0,0,0));
		assertEquals(Collections.singletonList(tmp), LeafFolders.findGroups(tmp, new NoOutputLogger()));
	}

	@Test
	void missingRootIsAnError()
	{
		assertThrows(IOException.class,
				() -> LeafFolders.findGroups(tmp.resolve("none"), new NoOutputLogger()));
	}
}
