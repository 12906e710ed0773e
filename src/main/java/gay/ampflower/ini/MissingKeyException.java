/* Copyright 2026 Ampflower
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package gay.ampflower.ini;// Created 2026-19-10T09:17:20

/**
 * @author Ampflower
 * @since 0.1.0
 **/
public final class MissingKeyException extends IniException {
	private final String section, key;

	public MissingKeyException(String section, String key) {
		super("Key '" + key + "' does not exist in section '" + section + '\'');
		this.section = section;
		this.key = key;
	}

	public String getSection() {
		return section;
	}

	public String getKey() {
		return key;
	}
}
