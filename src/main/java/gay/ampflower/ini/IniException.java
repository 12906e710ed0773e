/* Copyright 2026 Ampflower
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package gay.ampflower.ini;// Created 2026-19-10T09:12:44

/**
 * Base of every failure raised while reading, resolving or querying a
 * document.
 *
 * @author Ampflower
 * @since 0.1.0
 **/
public class IniException extends RuntimeException {
	public IniException(String message) {
		super(message);
	}

	public IniException(String message, Throwable cause) {
		super(message, cause);
	}
}
