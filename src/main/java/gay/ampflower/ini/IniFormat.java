/* Copyright 2026 Ampflower
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package gay.ampflower.ini;// Created 2026-19-10T09:24:50

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Character classes and flags driving an {@link IniReader}.
 * <p>
 * Immutable; use the {@code with} methods to derive a new format.
 *
 * @param commentMarkers    Characters that, leading a line, comment it out.
 * @param assignmentMarkers Characters separating key from value. The first
 *                          occurring one wins.
 * @param quote             The quote character for keys and values.
 * @param continuation      The trailing character joining a value with the
 *                          next line.
 * @param flags             Enabled reader behaviours.
 * @author Ampflower
 * @since 0.1.0
 **/
public record IniFormat(String commentMarkers, String assignmentMarkers, char quote, char continuation,
		Set<IniFlag> flags) {

	/**
	 * {@code #} and {@code ;} comments, {@code =} assignment, double quotes,
	 * backslash continuation, every flag enabled.
	 */
	public static final IniFormat UNIVERSAL = new IniFormat("#;", "=", '"', '\\', EnumSet.allOf(IniFlag.class));

	public IniFormat {
		Objects.requireNonNull(commentMarkers, "commentMarkers");
		Objects.requireNonNull(assignmentMarkers, "assignmentMarkers");
		if (assignmentMarkers.isEmpty()) {
			throw new IllegalArgumentException("At least one assignment marker is required");
		}
		if (assignmentMarkers.indexOf(quote) >= 0 || commentMarkers.indexOf(quote) >= 0) {
			throw new IllegalArgumentException("Quote `" + quote + "` clashes with another marker");
		}
		flags = Set.copyOf(Objects.requireNonNull(flags, "flags"));
	}

	public boolean has(IniFlag flag) {
		return flags.contains(flag);
	}

	public boolean isComment(char c) {
		return commentMarkers.indexOf(c) >= 0;
	}

	public boolean isAssignment(char c) {
		return assignmentMarkers.indexOf(c) >= 0;
	}

	public IniFormat with(IniFlag flag) {
		var set = EnumSet.of(flag);
		set.addAll(flags);
		return new IniFormat(commentMarkers, assignmentMarkers, quote, continuation, set);
	}

	public IniFormat without(IniFlag flag) {
		var set = EnumSet.noneOf(IniFlag.class);
		set.addAll(flags);
		set.remove(flag);
		return new IniFormat(commentMarkers, assignmentMarkers, quote, continuation, set);
	}

	public IniFormat withCommentMarkers(String commentMarkers) {
		return new IniFormat(commentMarkers, assignmentMarkers, quote, continuation, flags);
	}

	public IniFormat withAssignmentMarkers(String assignmentMarkers) {
		return new IniFormat(commentMarkers, assignmentMarkers, quote, continuation, flags);
	}

	public IniFormat withQuote(char quote) {
		return new IniFormat(commentMarkers, assignmentMarkers, quote, continuation, flags);
	}

	public IniFormat withContinuation(char continuation) {
		return new IniFormat(commentMarkers, assignmentMarkers, quote, continuation, flags);
	}
}
