/* Copyright 2026 Ampflower
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package gay.ampflower.ini;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {
	@TempDir
	Path dir;

	private final StringWriter output = new StringWriter();

	private int run(String... args) {
		return new CommandLine(new Main(new PrintWriter(output, true))).execute(args);
	}

	private Path file(String text) throws IOException {
		var file = dir.resolve("test.ini");
		Files.writeString(file, text);
		return file;
	}

	@Test
	void printsResolvedDocument() throws IOException {
		var file = file("[def]\nhost = h\n[dev : def]\nurl = http://%host%/\n");
		assertEquals(0, run(file.toString()));
		assertEquals("[def]\nhost = h\n\n[dev]\nhost = h\nurl = http://h/\n", output.toString());
	}

	@Test
	void noLookups_keepsMarkers() throws IOException {
		var file = file("k = v\nx = %k%\n");
		assertEquals(0, run("--no-lookups", file.toString()));
		assertEquals("k = v\nx = %k%\n", output.toString());
	}

	@Test
	void noEscapes_keepsBackslashes() throws IOException {
		var file = file("path = \"C:\\new\"\n");
		assertEquals(0, run("--no-escapes", "--no-continuation", file.toString()));
		assertEquals("path = C:\\new\n", output.toString());
	}

	@Test
	void formatOptions() {
		var main = new Main(new PrintWriter(output));
		new CommandLine(main).parseArgs("--no-multiline", "--no-continuation", "x.ini");
		var format = main.format();
		assertFalse(format.has(IniFlag.MULTILINE_QUOTES));
		assertFalse(format.has(IniFlag.LINE_CONTINUATION));
		assertTrue(format.has(IniFlag.PROCESS_ESCAPES));
	}

	@Test
	void syntaxError_exitsWithOne() throws IOException {
		var file = file("[broken\n");
		assertEquals(1, run(file.toString()));
		assertEquals("", output.toString());
	}

	@Test
	void missingFile_fails() {
		assertEquals(1, run(dir.resolve("absent.ini").toString()));
	}
}
