/* Copyright 2026 Ampflower
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package gay.ampflower.ini;// Created 2026-19-10T09:17:58

/**
 * @author Ampflower
 * @since 0.1.0
 **/
public final class MissingSectionException extends IniException {
	private final String parent, section;

	public MissingSectionException(String parent, String section) {
		super("Section '" + section + "' does not exist in section '" + parent + '\'');
		this.parent = parent;
		this.section = section;
	}

	public String getParent() {
		return parent;
	}

	public String getSection() {
		return section;
	}
}
