/* Copyright 2026 Ampflower
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package gay.ampflower.ini;// Created 2026-19-10T10:37:05

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces {@code %path%} markers in values with the value of the referenced
 * key.
 * <p>
 * A path is relative to the section holding the value, or to the document
 * root when it starts with {@code .}. The last segment names a key, the ones
 * before it sections.
 * <p>
 * Single pass: substituted text isn't scanned again, and a referenced key is
 * read as it is at that moment, which depends on the order sections are
 * visited in. A {@code %} without a closing one is kept as is.
 *
 * @author Ampflower
 * @since 0.1.0
 **/
public final class LookupResolver {
	private static final Logger logger = LoggerFactory.getLogger(LookupResolver.class);
	private static final char MARKER = '%';

	private LookupResolver() {
	}

	/**
	 * Rewrites the values of the section, then of each child, depth first.
	 *
	 * @throws IniLookupException If a path doesn't resolve, or is empty.
	 */
	public static void resolve(IniSection section) {
		for (var entry : section.mutableKeys().entrySet()) {
			var value = entry.getValue();
			if (value.indexOf(MARKER) >= 0) {
				entry.setValue(substitute(section, entry.getKey(), value));
			}
		}
		for (var child : section.sections().values()) {
			resolve(child);
		}
	}

	/**
	 * @param section The section holding the value.
	 * @param key     The key holding the value, for error reporting.
	 * @param value   The raw value.
	 * @return The value with every closed marker replaced.
	 */
	public static String substitute(IniSection section, String key, String value) {
		var builder = new StringBuilder(value.length());
		int open = -1;
		for (int i = 0, l = value.length(); i < l; i++) {
			char c = value.charAt(i);
			if (c != MARKER) {
				if (open < 0) {
					builder.append(c);
				}
			} else if (open < 0) {
				open = i;
			} else {
				builder.append(lookup(section, key, value.substring(open + 1, i)));
				open = -1;
			}
		}
		if (open >= 0) {
			builder.append(value, open, value.length());
		}
		return builder.toString();
	}

	/**
	 * Fetches the value a path refers to.
	 *
	 * @param section The section the path is relative to.
	 * @param key     The key the lookup was found in, or null.
	 * @param path    The path between the markers.
	 */
	public static String lookup(IniSection section, String key, String path) {
		try {
			var target = target(section, path);
			var value = target.section().getKey(target.key());
			logger.trace("{} in {}.{} -> {}", path, section.name(), key, value);
			return value;
		} catch (MissingKeyException | MissingSectionException | IllegalArgumentException e) {
			throw new IniLookupException(path, section.name(), key, e);
		}
	}

	/**
	 * Splits a key path into the section owning the key and the key's name. The
	 * key itself doesn't need to exist.
	 *
	 * @throws MissingSectionException  If a section along the path is missing.
	 * @throws IllegalArgumentException If the path is empty.
	 */
	public static Target target(IniSection section, String path) {
		if (path.isEmpty()) {
			throw new IllegalArgumentException("Empty path");
		}
		if (path.charAt(0) == '.') {
			section = section.root();
			path = path.substring(1);
		}
		int dot = path.lastIndexOf('.');
		if (dot < 0) {
			return new Target(section, path);
		}
		return new Target(section.getSectionEx(path.substring(0, dot)), path.substring(dot + 1));
	}

	/**
	 * A key, by section and name.
	 */
	public record Target(IniSection section, String key) {
	}
}
