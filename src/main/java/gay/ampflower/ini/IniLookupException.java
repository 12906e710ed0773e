/* Copyright 2026 Ampflower
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package gay.ampflower.ini;// Created 2026-19-10T09:15:37

/**
 * A dotted path, either in a {@code %lookup%} or as an inheritance target,
 * names a section or key that doesn't exist.
 *
 * @author Ampflower
 * @since 0.1.0
 **/
public final class IniLookupException extends IniException {
	private final String path, section, key;

	/**
	 * @param path    The unresolved path, as written.
	 * @param section The section the path was being resolved for.
	 * @param key     The key holding the lookup, or null for inheritance.
	 * @param cause   The failed query, if any.
	 */
	public IniLookupException(String path, String section, String key, Throwable cause) {
		super("Unable to resolve `" + path + "` for " + (key == null ? "section " + section : section + '.' + key)
				+ (cause == null ? "" : ": " + cause.getMessage()), cause);
		this.path = path;
		this.section = section;
		this.key = key;
	}

	public String getPath() {
		return path;
	}

	public String getSection() {
		return section;
	}

	public String getKey() {
		return key;
	}
}
