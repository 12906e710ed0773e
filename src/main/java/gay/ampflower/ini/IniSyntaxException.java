/* Copyright 2026 Ampflower
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package gay.ampflower.ini;// Created 2026-19-10T09:14:02

/**
 * The input text could not be tokenized.
 *
 * @author Ampflower
 * @since 0.1.0
 **/
public final class IniSyntaxException extends IniException {
	private final int line;
	private final String text;

	/**
	 * @param message What went wrong.
	 * @param line    The 1-based line the offending token starts on.
	 * @param text    The raw text of that line.
	 */
	public IniSyntaxException(String message, int line, String text) {
		super(message + " @ " + line + ": " + text);
		this.line = line;
		this.text = text;
	}

	public int getLine() {
		return line;
	}

	public String getText() {
		return text;
	}
}
