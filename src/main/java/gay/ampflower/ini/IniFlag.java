/* Copyright 2026 Ampflower
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package gay.ampflower.ini;// Created 2026-19-10T09:21:11

/**
 * Optional behaviours of the {@link IniReader}.
 *
 * @author Ampflower
 * @since 0.1.0
 **/
public enum IniFlag {
	/**
	 * Decodes {@code \n}, {@code \t}, {@code \\} and {@code \"} within quoted
	 * values.
	 */
	PROCESS_ESCAPES,
	/**
	 * Allows {@code """} delimited values spanning multiple lines.
	 */
	MULTILINE_QUOTES,
	/**
	 * Joins an unquoted value ending in the continuation marker with the next
	 * line.
	 */
	LINE_CONTINUATION,
}
