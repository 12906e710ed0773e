/* Copyright 2026 Ampflower
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package gay.ampflower.ini;// Created 2026-19-10T12:10:39

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOError;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Interactive console for querying and editing a parsed document.
 *
 * @author Ampflower
 * @since 0.1.0
 **/
public class Console {
	private static final Logger logger = LoggerFactory.getLogger(Console.class);

	private final IniSection root;
	private final IniFormat format;
	private final Input console;
	private final PrintWriter out;
	private final CommandLine dispatcher;

	Console(IniSection root, IniFormat format) {
		this(root, format, System.console() != null ? new TTY() : new Raw(), new PrintWriter(System.out, true));
	}

	Console(IniSection root, IniFormat format, Input console, PrintWriter out) {
		this.root = root;
		this.format = format;
		this.console = console;
		this.out = out;
		this.dispatcher = new CommandLine(new Root());
		dispatcher.addSubcommand("get", new Get());
		dispatcher.addSubcommand("keys", new Keys());
		dispatcher.addSubcommand("sections", new Sections());
		dispatcher.addSubcommand("set", new Put());
		dispatcher.addSubcommand("remove", new Remove());
		dispatcher.addSubcommand("save", new Save());
		dispatcher.addSubcommand("help", new Help());
		dispatcher.setOut(out);
		dispatcher.setErr(out);
		dispatcher.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
			if (ex instanceof IniException || ex instanceof IllegalArgumentException) {
				logger.warn(ex.getMessage());
			} else {
				logger.error("Failure executing command", ex);
			}
			return 1;
		});
	}

	public void repl() {
		console.printf("""
				ini console

				Run `help` for commands.

				""");
		String input;
		while ((input = console.readLine("[%s] $ ", root.name())) != null) {
			if (input.equals("exit"))
				break;
			execute(input);
		}
		if (input == null) {
			console.printf("exit\n");
		}
	}

	/**
	 * Runs a single command line.
	 *
	 * @return The command's exit code.
	 */
	int execute(String input) {
		final List<String> args;
		try {
			args = arguments(input);
		} catch (IllegalArgumentException iae) {
			logger.warn(iae.getMessage());
			return 1;
		}
		if (args.isEmpty()) {
			return 0;
		}
		return dispatcher.execute(args.toArray(String[]::new));
	}

	/**
	 * Splits a command line on whitespace. Double quotes group words, so
	 * {@code get "section 1.key"} addresses a section with a space in its name.
	 *
	 * @throws IllegalArgumentException If a quote isn't closed.
	 */
	static List<String> arguments(String input) {
		var args = new ArrayList<String>();
		var builder = new StringBuilder();
		boolean quoted = false, token = false;
		for (int i = 0, l = input.length(); i < l; i++) {
			char c = input.charAt(i);
			if (c == '"') {
				quoted = !quoted;
				token = true;
			} else if (!quoted && Character.isWhitespace(c)) {
				if (token) {
					args.add(builder.toString());
					builder.setLength(0);
					token = false;
				}
			} else {
				builder.append(c);
				token = true;
			}
		}
		if (quoted) {
			throw new IllegalArgumentException("Unterminated quote in `" + input + '`');
		}
		if (token) {
			args.add(builder.toString());
		}
		return args;
	}

	/**
	 * Resolves a section by dotted path from the root; a leading dot is
	 * optional.
	 */
	private IniSection section(String path) {
		if (path == null) {
			return root;
		}
		return root.getSectionEx(path.startsWith(".") ? path.substring(1) : path);
	}

	@Command(name = "ini", description = "Queries the loaded document.")
	private static final class Root implements Runnable {
		@Override
		public void run() {
		}
	}

	@Command(name = "get", description = "Prints the value at a dotted key path.")
	private final class Get implements Callable<Integer> {
		@Parameters(index = "0", paramLabel = "<path>")
		String path;

		@Override
		public Integer call() {
			out.println(LookupResolver.lookup(root, null, path));
			return 0;
		}
	}

	@Command(name = "keys", description = "Lists the keys of a section.")
	private final class Keys implements Callable<Integer> {
		@Parameters(index = "0", arity = "0..1", paramLabel = "<section>")
		String path;

		@Override
		public Integer call() {
			for (var entry : section(path).keys().entrySet()) {
				out.println(entry.getKey() + " = " + entry.getValue());
			}
			return 0;
		}
	}

	@Command(name = "sections", description = "Lists the child sections of a section.")
	private final class Sections implements Callable<Integer> {
		@Parameters(index = "0", arity = "0..1", paramLabel = "<section>")
		String path;

		@Override
		public Integer call() {
			for (var name : section(path).sections().keySet()) {
				out.println(name);
			}
			return 0;
		}
	}

	@Command(name = "set", description = "Sets the value at a dotted key path.")
	private final class Put implements Callable<Integer> {
		@Parameters(index = "0", paramLabel = "<path>")
		String path;

		@Parameters(index = "1..*", arity = "0..*", paramLabel = "<value>")
		List<String> value;

		@Override
		public Integer call() {
			var target = LookupResolver.target(root, path);
			target.section().setKey(target.key(), value == null ? "" : String.join(" ", value));
			return 0;
		}
	}

	@Command(name = "remove", description = "Removes the key at a dotted key path.")
	private final class Remove implements Callable<Integer> {
		@Parameters(index = "0", paramLabel = "<path>")
		String path;

		@Override
		public Integer call() {
			var target = LookupResolver.target(root, path);
			if (target.section().removeKey(target.key())) {
				logger.info("Removed {}", path);
				return 0;
			}
			logger.info("No such key.");
			return 1;
		}
	}

	@Command(name = "save", description = "Writes the document to a file.")
	private final class Save implements Callable<Integer> {
		@Parameters(index = "0", paramLabel = "<file>")
		Path file;

		@Override
		public Integer call() throws IOException {
			try (var writer = new Ini.IniWriter(Utils.newWriter(file), format)) {
				writer.document(root);
			}
			logger.info("Saved {}", file);
			return 0;
		}
	}

	@Command(name = "help", description = "Lists the commands.")
	private final class Help implements Callable<Integer> {
		@Override
		public Integer call() {
			for (var entry : dispatcher.getSubcommands().entrySet()) {
				var spec = entry.getValue().getCommandSpec();
				out.println(entry.getKey() + " " + String.join(" ", spec.usageMessage().description()));
			}
			out.println("exit");
			return 0;
		}
	}

	interface Input {
		String readLine(String fmt, Object... args);

		void printf(String fmt, Object... args);
	}

	private static class TTY implements Input {
		private final java.io.Console console = Objects.requireNonNull(System.console());

		@Override
		public String readLine(String fmt, Object... args) {
			return console.readLine(fmt, args);
		}

		@Override
		public void printf(String fmt, Object... args) {
			console.printf(fmt, args);
		}
	}

	private static class Raw implements Input {
		private final BufferedReader reader = new BufferedReader(new InputStreamReader(System.in));

		@Override
		public String readLine(String fmt, Object... args) {
			System.out.printf(fmt, args);
			try {
				return reader.readLine();
			} catch (IOException ioe) {
				throw new IOError(ioe);
			}
		}

		@Override
		public void printf(String fmt, Object... args) {
			System.out.printf(fmt, args);
		}
	}
}
