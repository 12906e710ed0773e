/* Copyright 2026 Ampflower
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package gay.ampflower.ini;// Created 2026-19-10T11:31:12

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.channels.Channels;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Set;

/**
 * @author Ampflower
 * @since 0.1.0
 **/
public final class Utils {
	/**
	 * Options for replacing a document on disk.
	 */
	static final Set<OpenOption> SAFE_WRITE_OPTIONS = Set.of(StandardOpenOption.CREATE, StandardOpenOption.WRITE,
			StandardOpenOption.SYNC, StandardOpenOption.TRUNCATE_EXISTING);

	private Utils() {
	}

	/**
	 * Reads the whole file as UTF-8.
	 */
	public static String readText(Path path) throws IOException {
		try (final var byteChannel = Files.newByteChannel(path, StandardOpenOption.READ);
				final var reader = Channels.newReader(byteChannel, StandardCharsets.UTF_8)) {
			final var builder = new StringBuilder();
			final var buf = new char[8192];
			int read;
			while ((read = reader.read(buf)) >= 0) {
				builder.append(buf, 0, read);
			}
			return builder.toString();
		}
	}

	/**
	 * Creates a UTF-8 writer truncating the file.
	 *
	 * @param path The document to open a writer for.
	 * @return A writer pointing to the path.
	 */
	public static Writer newWriter(Path path) throws IOException {
		final var byteChannel = Files.newByteChannel(path, SAFE_WRITE_OPTIONS);
		final var writer = Channels.newWriter(byteChannel, StandardCharsets.UTF_8);
		return new BufferedWriter(writer);
	}
}
