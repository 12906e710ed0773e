/* Copyright 2026 Ampflower
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package gay.ampflower.ini;// Created 2026-19-10T12:44:16

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Reads a document and prints it resolved, or opens a {@link Console} on it.
 *
 * @author Ampflower
 * @since 0.1.0
 **/
@Command(name = "ini", description = "Reads an INI document, resolving inheritance and lookups.", version = "0.1.0", mixinStandardHelpOptions = true)
public class Main implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger(Main.class);

	@Parameters(index = "0", paramLabel = "<file>", description = "The document to read.")
	Path file;

	@Option(names = "--console", description = "Open the management console after reading.")
	boolean console;

	@Option(names = "--no-lookups", description = "Keep %path% lookups as written.")
	boolean noLookups;

	@Option(names = "--no-escapes", description = "Don't process escapes in quoted values.")
	boolean noEscapes;

	@Option(names = "--no-multiline", description = "Don't allow triple-quoted values.")
	boolean noMultiline;

	@Option(names = "--no-continuation", description = "Don't join lines ending in a backslash.")
	boolean noContinuation;

	private final PrintWriter out;

	Main(PrintWriter out) {
		this.out = out;
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main(new PrintWriter(System.out, true))).execute(args);
		System.exit(exitCode);
	}

	IniFormat format() {
		var format = IniFormat.UNIVERSAL;
		if (noEscapes) {
			format = format.without(IniFlag.PROCESS_ESCAPES);
		}
		if (noMultiline) {
			format = format.without(IniFlag.MULTILINE_QUOTES);
		}
		if (noContinuation) {
			format = format.without(IniFlag.LINE_CONTINUATION);
		}
		return format;
	}

	@Override
	public Integer call() throws IOException {
		var format = format();
		final IniSection root;
		try {
			root = Ini.read(file, format, !noLookups);
		} catch (IniException ie) {
			logger.error("Unable to read {}: {}", file, ie.getMessage());
			return 1;
		} catch (IOException ioe) {
			logger.error("Unable to read {}", file, ioe);
			return 1;
		}
		if (console) {
			new Console(root, format).repl();
		} else {
			Ini.write(root, out, format);
		}
		return 0;
	}
}
