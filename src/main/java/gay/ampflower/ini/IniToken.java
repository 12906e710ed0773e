/* Copyright 2026 Ampflower
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package gay.ampflower.ini;// Created 2026-19-10T09:31:06

import java.util.Objects;

/**
 * A structural event emitted by the {@link IniReader}.
 *
 * @author Ampflower
 * @since 0.1.0
 **/
public sealed interface IniToken {

	/**
	 * {@code [name]} or {@code [name : inherits]}.
	 *
	 * @param name     The trimmed section name.
	 * @param inherits Dotted path of the section to copy keys from, or null.
	 */
	record Section(String name, String inherits) implements IniToken {
		public Section {
			Objects.requireNonNull(name, "name");
		}

		public Section(String name) {
			this(name, null);
		}
	}

	/**
	 * {@code key = value}, with the value fully decoded but not yet looked up.
	 */
	record KeyValue(String key, String value) implements IniToken {
		public KeyValue {
			Objects.requireNonNull(key, "key");
			Objects.requireNonNull(value, "value");
		}
	}
}
