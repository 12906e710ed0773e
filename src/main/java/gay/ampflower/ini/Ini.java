/* Copyright 2026 Ampflower
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package gay.ampflower.ini;// Created 2026-19-10T11:05:48

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Path;

import static gay.ampflower.ini.IniFlag.LINE_CONTINUATION;
import static gay.ampflower.ini.IniFlag.MULTILINE_QUOTES;
import static gay.ampflower.ini.IniFlag.PROCESS_ESCAPES;

/**
 * Entry points for reading and writing INI documents.
 *
 * <pre>{@code
 * var ini = Ini.parse("""
 *     [def]
 *     host = localhost
 *
 *     [dev : def]
 *     url = http://%host%/
 *     """);
 * }</pre>
 *
 * @author Ampflower
 * @since 0.1.0
 **/
public final class Ini {
	private static final Logger logger = LoggerFactory.getLogger(Ini.class);

	private Ini() {
	}

	public static IniSection parse(String data) {
		return parse(data, IniFormat.UNIVERSAL, true);
	}

	public static IniSection parse(String data, IniFormat format) {
		return parse(data, format, true);
	}

	/**
	 * @param lookups Whether {@code %path%} lookups are resolved.
	 * @return A new root section holding the document.
	 */
	public static IniSection parse(String data, IniFormat format, boolean lookups) {
		var root = new IniSection();
		root.parse(data, format, lookups);
		return root;
	}

	public static IniSection read(Path path) throws IOException {
		return read(path, IniFormat.UNIVERSAL, true);
	}

	public static IniSection read(Path path, IniFormat format, boolean lookups) throws IOException {
		logger.debug("Reading {}", path);
		return parse(Utils.readText(path), format, lookups);
	}

	public static void write(IniSection root, Writer writer) throws IOException {
		write(root, writer, IniFormat.UNIVERSAL);
	}

	/**
	 * Writes the document without closing the writer.
	 */
	public static void write(IniSection root, Writer writer, IniFormat format) throws IOException {
		new IniWriter(writer, format).document(root);
		writer.flush();
	}

	public static void save(IniSection root, Path path) throws IOException {
		logger.debug("Saving {}", path);
		try (var writer = new IniWriter(Utils.newWriter(path), IniFormat.UNIVERSAL)) {
			writer.document(root);
		}
	}

	public static String toString(IniSection root) {
		var writer = new StringWriter();
		try {
			write(root, writer, IniFormat.UNIVERSAL);
		} catch (IOException ioe) {
			throw new UncheckedIOException(ioe);
		}
		return writer.toString();
	}

	/**
	 * Writes keys and sections such that an {@link IniReader} of the same
	 * format reads them back unchanged, quoting where required.
	 */
	public static class IniWriter implements AutoCloseable {
		private final Writer writer;
		private final IniFormat format;
		private boolean written;

		public IniWriter(Writer writer) {
			this(writer, IniFormat.UNIVERSAL);
		}

		public IniWriter(Writer writer, IniFormat format) {
			this.writer = writer;
			this.format = format;
		}

		/**
		 * Writes the root's keys, then a block per child section.
		 * <p>
		 * Sections nested further can't be expressed in INI and are skipped.
		 */
		public void document(IniSection root) throws IOException {
			entries(root);
			for (var section : root.sections().values()) {
				section(section.name());
				entries(section);
				for (var nested : section.sections().keySet()) {
					logger.warn("Skipping nested section {}.{}: not representable as INI", section.name(), nested);
				}
			}
		}

		private void entries(IniSection section) throws IOException {
			for (var entry : section.keys().entrySet()) {
				entry(entry.getKey(), entry.getValue());
			}
		}

		public void section(String section) throws IOException {
			if (section.isEmpty() || !section.equals(section.strip())) {
				throw new IllegalArgumentException("Invalid section name `" + section + '`');
			}
			int i = indexOfAny(section, "]:\r\n");
			if (i >= 0) {
				throw new IllegalArgumentException("Invalid character for section `" + section + "` at " + i);
			}
			if (written) {
				writer.append('\n');
			}
			writer.append('[').append(section).append("]\n");
			written = true;
		}

		public void entry(String key, String value) throws IOException {
			writer.append(key(key, value)).append(" = ").append(value(key, value)).append('\n');
			written = true;
		}

		private String key(String key, String value) {
			final char quote = format.quote();
			int i = indexOfAny(key, "\r\n");
			if (i < 0) {
				i = key.indexOf(quote);
			}
			if (i >= 0) {
				throw new IllegalArgumentException(
						"Invalid character for key `" + key + "` at " + i + "; Paired with " + value);
			}
			if (key.isEmpty() || !key.equals(key.strip()) || indexOfAny(key, format.assignmentMarkers()) >= 0
					|| format.isComment(key.charAt(0)) || key.charAt(0) == '[') {
				return quote + key + quote;
			}
			return key;
		}

		private String value(String key, String value) {
			final char quote = format.quote();
			final boolean lineBreak = indexOfAny(value, "\r\n") >= 0;
			if (!lineBreak && value.equals(value.strip()) && (value.isEmpty() || value.charAt(0) != quote)
					&& !(format.has(LINE_CONTINUATION) && value.endsWith(String.valueOf(format.continuation())))) {
				return value;
			}
			if (format.has(PROCESS_ESCAPES) && value.indexOf('\r') < 0) {
				return quote + escape(value, quote) + quote;
			}
			if (!lineBreak && value.indexOf(quote) < 0) {
				return quote + value + quote;
			}
			var triple = String.valueOf(quote).repeat(3);
			if (format.has(MULTILINE_QUOTES) && value.indexOf('\r') < 0 && !value.contains(triple)
					&& value.charAt(value.length() - 1) != quote) {
				return triple + value + triple;
			}
			throw new IllegalArgumentException("Value for key `" + key + "` cannot be written as " + format + ": "
					+ value);
		}

		private static String escape(String value, char quote) {
			var builder = new StringBuilder(value.length() + 8);
			for (int i = 0, l = value.length(); i < l; i++) {
				char c = value.charAt(i);
				if (c == '\n') {
					builder.append("\\n");
				} else if (c == '\t') {
					builder.append("\\t");
				} else if (c == '\\' || c == quote) {
					builder.append('\\').append(c);
				} else {
					builder.append(c);
				}
			}
			return builder.toString();
		}

		private static int indexOfAny(String str, String chars) {
			for (int i = 0, l = str.length(); i < l; i++) {
				if (chars.indexOf(str.charAt(i)) >= 0) {
					return i;
				}
			}
			return -1;
		}

		@Override
		public void close() throws IOException {
			writer.close();
		}
	}
}
