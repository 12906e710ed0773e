/* Copyright 2026 Ampflower
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package gay.ampflower.ini;// Created 2026-19-10T09:40:18

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

import static gay.ampflower.ini.IniFlag.LINE_CONTINUATION;
import static gay.ampflower.ini.IniFlag.MULTILINE_QUOTES;
import static gay.ampflower.ini.IniFlag.PROCESS_ESCAPES;

/**
 * Tokenizes INI text into {@link IniToken.Section} and
 * {@link IniToken.KeyValue} events, one line at a time.
 * <p>
 * Comments are only recognised at the start of a line; a marker within a
 * value is part of the value. Scanning stops at the first malformed line with
 * an {@link IniSyntaxException}.
 *
 * @author Ampflower
 * @since 0.1.0
 **/
public final class IniReader implements Iterator<IniToken> {
	private static final Logger logger = LoggerFactory.getLogger(IniReader.class);

	private final String text;
	private final IniFormat format;
	private final String tripleQuote;
	private int position, lineNumber, tokenLine;
	private IniToken next;
	private IniSyntaxException failure;

	public IniReader(String text) {
		this(text, IniFormat.UNIVERSAL);
	}

	public IniReader(String text, IniFormat format) {
		this.text = Objects.requireNonNull(text, "text");
		this.format = Objects.requireNonNull(format, "format");
		this.tripleQuote = String.valueOf(format.quote()).repeat(3);
	}

	/**
	 * Reads every token of the text up front.
	 */
	public static List<IniToken> tokenize(String text, IniFormat format) {
		var reader = new IniReader(text, format);
		var list = new ArrayList<IniToken>();
		reader.forEachRemaining(list::add);
		return list;
	}

	public IniFormat getFormat() {
		return format;
	}

	/**
	 * @return The 1-based line the last returned token started on, or 0 if
	 *         none was returned yet.
	 */
	public int getLineNumber() {
		return tokenLine;
	}

	@Override
	public boolean hasNext() {
		// No recovery: the first failure sticks.
		if (failure != null) {
			throw failure;
		}
		if (next == null) {
			try {
				next = scan();
			} catch (IniSyntaxException ise) {
				failure = ise;
				throw ise;
			}
		}
		return next != null;
	}

	@Override
	public IniToken next() {
		if (!hasNext()) {
			throw new NoSuchElementException();
		}
		var token = next;
		next = null;
		return token;
	}

	private IniToken scan() {
		String line;
		while ((line = readLine()) != null) {
			int i = skipWhitespace(line, 0);
			// Skip comments & blank lines
			if (i == line.length() || format.isComment(line.charAt(i))) {
				continue;
			}
			tokenLine = lineNumber;
			var token = line.charAt(i) == '[' ? section(line, i) : keyValue(line, i);
			logger.trace("{} @ {}", token, tokenLine);
			return token;
		}
		return null;
	}

	private IniToken.Section section(String line, int start) {
		int end = line.indexOf(']', start);
		if (end < 0) {
			throw syntax("Unterminated section header", line);
		}
		if (skipWhitespace(line, end + 1) != line.length()) {
			throw syntax("Unexpected text after section header", line);
		}
		var body = line.substring(start + 1, end);
		int colon = body.indexOf(':');
		String name, inherits = null;
		if (colon < 0) {
			name = body.strip();
		} else {
			name = body.substring(0, colon).strip();
			int parentEnd = body.indexOf(':', colon + 1);
			// [name : parent : ignored]
			inherits = body.substring(colon + 1, parentEnd < 0 ? body.length() : parentEnd).strip();
			if (inherits.isEmpty()) {
				throw syntax("Missing section to inherit from", line);
			}
		}
		if (name.isEmpty()) {
			throw syntax("Empty section name", line);
		}
		return new IniToken.Section(name, inherits);
	}

	private IniToken.KeyValue keyValue(String line, int start) {
		final char quote = format.quote();
		final int length = line.length();
		String key;
		int i;
		if (line.charAt(start) == quote) {
			int close = line.indexOf(quote, start + 1);
			if (close < 0) {
				throw syntax("Unterminated quoted key", line);
			}
			key = line.substring(start + 1, close);
			i = skipWhitespace(line, close + 1);
			if (i < length && !format.isAssignment(line.charAt(i))) {
				throw syntax("Expected assignment after quoted key", line);
			}
		} else {
			i = start;
			while (i < length && !format.isAssignment(line.charAt(i))) {
				i++;
			}
			key = line.substring(start, i).strip();
			if (key.isEmpty()) {
				throw syntax("Missing key", line);
			}
		}
		// A lone key is an empty entry.
		if (i >= length) {
			return new IniToken.KeyValue(key, "");
		}
		return new IniToken.KeyValue(key, value(line, i + 1));
	}

	private String value(String line, int from) {
		int i = skipWhitespace(line, from);
		if (i < line.length() && line.charAt(i) == format.quote()) {
			if (format.has(MULTILINE_QUOTES) && line.startsWith(tripleQuote, i)) {
				return multiline(line, i + 3);
			}
			return quoted(line, i);
		}
		var value = line.substring(i);
		if (format.has(LINE_CONTINUATION) && endsWithContinuation(value)) {
			return continuation(value);
		}
		return value.strip();
	}

	private String quoted(String line, int open) {
		final char quote = format.quote();
		final boolean escapes = format.has(PROCESS_ESCAPES);
		var builder = new StringBuilder();
		for (int i = open + 1, l = line.length(); i < l; i++) {
			char c = line.charAt(i);
			if (c == quote) {
				if (skipWhitespace(line, i + 1) != l) {
					throw syntax("Unexpected text after closing quote", line);
				}
				return builder.toString();
			}
			if (escapes && c == '\\' && i + 1 < l) {
				char escaped = line.charAt(++i);
				switch (escaped) {
					case 'n' -> builder.append('\n');
					case 't' -> builder.append('\t');
					case '\\' -> builder.append('\\');
					default -> {
						// Unknown escapes are kept as written.
						if (escaped != quote) {
							builder.append('\\');
						}
						builder.append(escaped);
					}
				}
			} else {
				builder.append(c);
			}
		}
		throw syntax("Unterminated quoted value", line);
	}

	private String multiline(String line, int from) {
		final int opened = lineNumber;
		var rest = line.substring(from);
		int close = rest.indexOf(tripleQuote);
		if (close >= 0) {
			checkTrailing(rest, close + 3, line);
			return rest.substring(0, close);
		}
		var builder = new StringBuilder(rest);
		String next;
		while ((next = readLine()) != null) {
			builder.append('\n');
			close = next.indexOf(tripleQuote);
			if (close >= 0) {
				checkTrailing(next, close + 3, next);
				return builder.append(next, 0, close).toString();
			}
			builder.append(next);
		}
		throw new IniSyntaxException("Unterminated multi-line value", opened, line);
	}

	/**
	 * Joins lines while the raw line ends in the marker; trailing whitespace
	 * after the marker ends the value.
	 */
	private String continuation(String value) {
		var builder = new StringBuilder(value);
		String next = value;
		while (endsWithContinuation(next)) {
			builder.setLength(builder.length() - 1);
			while (builder.length() > 0 && Character.isWhitespace(builder.charAt(builder.length() - 1))) {
				builder.setLength(builder.length() - 1);
			}
			next = readLine();
			if (next == null) {
				break;
			}
			builder.append(' ').append(next.stripLeading());
		}
		return builder.toString().strip();
	}

	private boolean endsWithContinuation(String raw) {
		return !raw.isEmpty() && raw.charAt(raw.length() - 1) == format.continuation();
	}

	private void checkTrailing(String segment, int from, String line) {
		if (skipWhitespace(segment, from) != segment.length()) {
			throw syntax("Unexpected text after closing quote", line);
		}
	}

	/**
	 * Reads up to the next {@code \n}, {@code \r\n} or {@code \r}.
	 *
	 * @return The line without its terminator, or null at the end of the text.
	 */
	private String readLine() {
		final int length = text.length();
		if (position >= length) {
			return null;
		}
		int start = position, end = start;
		while (end < length && text.charAt(end) != '\n' && text.charAt(end) != '\r') {
			end++;
		}
		position = end;
		if (position < length) {
			if (text.charAt(position) == '\r' && position + 1 < length && text.charAt(position + 1) == '\n') {
				position += 2;
			} else {
				position++;
			}
		}
		lineNumber++;
		return text.substring(start, end);
	}

	private IniSyntaxException syntax(String message, String line) {
		return new IniSyntaxException(message, lineNumber, line);
	}

	private static int skipWhitespace(String line, int i) {
		final int length = line.length();
		while (i < length && Character.isWhitespace(line.charAt(i))) {
			i++;
		}
		return i;
	}
}
