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

import org.scijava.log.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds groups of images in a folder tree: a group is a folder
 * that has no sub-folders and holds at least one PNG image.
 */
public class LeafFolders
{
	/** returns, sorted, all leaf folders under (and including) the 'root'
	    that contain images, leaf folders without images are only reported */
	static public
	List<Path> findGroups(final Path root, final Logger log)
	throws IOException
	{
		if (!Files.isDirectory(root))
			throw new IOException("Input folder \""+root+"\" does not exist or is not a folder.");

		final List<Path> folders;
		try (Stream<Path> s = Files.walk(root)) {
			folders = s.filter(Files::isDirectory).sorted().collect(Collectors.toList());
		}

		final List<Path> groups = new ArrayList<>(folders.size());
		for (Path folder : folders)
		{
			if (hasSubfolders(folder)) continue;

			if (listImages(folder).isEmpty())
				log.warn("Skipping folder without PNG images: "+folder);
			else
				groups.add(folder);
		}
		log.debug("found "+groups.size()+" groups under "+root);
		return groups;
	}

	static public
	boolean hasSubfolders(final Path folder)
	throws IOException
	{
		try (Stream<Path> s = Files.list(folder)) {
			return s.anyMatch(Files::isDirectory);
		}
	}

	/** returns, sorted by filename, all PNG files directly inside the 'folder' */
	static public
	List<Path> listImages(final Path folder)
	throws IOException
	{
		try (Stream<Path> s = Files.list(folder)) {
			return s.filter(Files::isRegularFile)
					.filter(ArgbImages::isPng)
					.sorted()
					.collect(Collectors.toList());
		}
	}
}
