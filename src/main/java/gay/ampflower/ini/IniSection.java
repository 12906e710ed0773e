/* Copyright 2026 Ampflower
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package gay.ampflower.ini;// Created 2026-19-10T10:02:31

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named node of an INI document, holding keys and child sections.
 * <p>
 * The parent link is a back-reference only; a section is owned by its
 * parent's child map. Not thread-safe, mutation must be externally
 * synchronised.
 *
 * <pre>{@code
 * var ini = Ini.parse("[server]\nport = 8080");
 * String port = ini.getSection("server").getKey("port");
 * }</pre>
 *
 * @author Ampflower
 * @since 0.1.0
 **/
public class IniSection {
	private static final Logger logger = LoggerFactory.getLogger(IniSection.class);

	private final String name;
	private final Map<String, String> keys = new LinkedHashMap<>();
	private final Map<String, IniSection> sections = new LinkedHashMap<>();
	private IniSection parent;

	/**
	 * Creates an empty document root.
	 */
	public IniSection() {
		this("root");
	}

	public IniSection(String name) {
		this.name = Objects.requireNonNull(name, "name");
	}

	public String name() {
		return name;
	}

	public void setKey(String name, String value) {
		keys.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
	}

	public boolean hasKey(String name) {
		return keys.containsKey(name);
	}

	/**
	 * @throws MissingKeyException If the key doesn't exist.
	 */
	public String getKey(String name) {
		var value = keys.get(name);
		if (value == null) {
			throw new MissingKeyException(this.name, name);
		}
		return value;
	}

	public String getKey(String name, String defaultValue) {
		return keys.getOrDefault(name, defaultValue);
	}

	/**
	 * @return true if the key was present.
	 */
	public boolean removeKey(String name) {
		return keys.remove(name) != null;
	}

	/**
	 * @return Read-only view of this section's own keys.
	 */
	public Map<String, String> keys() {
		return Collections.unmodifiableMap(keys);
	}

	Map<String, String> mutableKeys() {
		return keys;
	}

	/**
	 * Attaches a detached section as a child.
	 * <p>
	 * If a child of the same name exists, the given section's keys and children
	 * are merged into it instead, overwriting keys of the same name.
	 *
	 * @param section A section without a parent.
	 * @return The section now in the tree: either the given one or the existing
	 *         child it was merged into.
	 */
	public IniSection addSection(IniSection section) {
		Objects.requireNonNull(section, "section");
		if (section.parent != null) {
			throw new IllegalArgumentException(
					"Section " + section.name + " is already a child of " + section.parent.name);
		}
		checkNotAncestor(section);
		var existing = sections.get(section.name);
		if (existing == null) {
			sections.put(section.name, section);
			section.parent = this;
			return section;
		}
		logger.debug("Merging section {} into existing child of {}", section.name, name);
		existing.keys.putAll(section.keys);
		for (var child : section.sections.values().toArray(IniSection[]::new)) {
			section.sections.remove(child.name);
			child.parent = null;
			existing.addSection(child);
		}
		return existing;
	}

	public boolean hasSection(String name) {
		return sections.containsKey(name);
	}

	/**
	 * @throws MissingSectionException If there's no child of that name.
	 */
	public IniSection getSection(String name) {
		var section = sections.get(name);
		if (section == null) {
			throw new MissingSectionException(this.name, name);
		}
		return section;
	}

	public IniSection getSection(String name, IniSection defaultValue) {
		return sections.getOrDefault(name, defaultValue);
	}

	/**
	 * Walks down a dotted path of section names, {@code a.b.c}.
	 *
	 * @param path The path; empty for this section.
	 * @throws MissingSectionException On the first missing section.
	 */
	public IniSection getSectionEx(String path) {
		var section = this;
		if (path.isEmpty()) {
			return section;
		}
		for (var part : path.split("\\.", -1)) {
			section = section.getSection(part);
		}
		return section;
	}

	/**
	 * Detaches the named child.
	 *
	 * @return The removed section, or null if there was none.
	 */
	public IniSection removeSection(String name) {
		var section = sections.remove(name);
		if (section != null) {
			section.parent = null;
		}
		return section;
	}

	/**
	 * @return Read-only view of the child sections by name.
	 */
	public Map<String, IniSection> sections() {
		return Collections.unmodifiableMap(sections);
	}

	public IniSection root() {
		var section = this;
		while (section.parent != null) {
			section = section.parent;
		}
		return section;
	}

	public IniSection getParent() {
		return parent;
	}

	public boolean hasParent() {
		return parent != null;
	}

	/**
	 * Moves this section under another.
	 * <p>
	 * Both child maps and the back-reference are updated together; if the new
	 * parent already has a child of this name, this section is merged into it
	 * and left detached.
	 *
	 * @return The section now in the tree.
	 * @throws IllegalArgumentException If the new parent is this section or one
	 *                                  of its descendants.
	 */
	public IniSection setParent(IniSection parent) {
		Objects.requireNonNull(parent, "parent");
		parent.checkNotAncestor(this);
		if (this.parent == parent) {
			return this;
		}
		if (this.parent != null) {
			this.parent.sections.remove(name, this);
			this.parent = null;
		}
		return parent.addSection(this);
	}

	/**
	 * Copies every key of the given section into this one.
	 */
	public void inherit(IniSection section) {
		keys.putAll(section.keys);
	}

	/**
	 * Parses a document into this section with the universal format, resolving
	 * lookups afterwards.
	 */
	public void parse(String data) {
		parse(data, IniFormat.UNIVERSAL, true);
	}

	/**
	 * Parses a document into this section.
	 * <p>
	 * Section headers always open a child of this section; keys before the first
	 * header land here. Existing keys and sections are kept, so values defined
	 * beforehand can be referenced by lookups.
	 *
	 * @param lookups Whether to run the {@link LookupResolver} afterwards.
	 * @throws IniSyntaxException If the text is malformed.
	 * @throws IniLookupException If an inheritance or lookup path doesn't
	 *                            resolve.
	 */
	public void parse(String data, IniFormat format, boolean lookups) {
		var reader = new IniReader(data, format);
		var section = this;
		while (reader.hasNext()) {
			var token = reader.next();
			if (token instanceof IniToken.Section header) {
				var child = new IniSection(header.name());
				if (header.inherits() != null) {
					try {
						child.inherit(getSectionEx(header.inherits()));
					} catch (MissingSectionException mse) {
						throw new IniLookupException(header.inherits(), header.name(), null, mse);
					}
					logger.debug("Section {} inherits from {}", header.name(), header.inherits());
				}
				section = addSection(child);
				logger.debug("Reading section {} @ {}", section.name, reader.getLineNumber());
			} else if (token instanceof IniToken.KeyValue entry) {
				section.setKey(entry.key(), entry.value());
			}
		}
		if (lookups) {
			parseLookups();
		}
	}

	/**
	 * Resolves {@code %path%} lookups in this section and every descendant.
	 *
	 * @see LookupResolver#resolve(IniSection)
	 */
	public void parseLookups() {
		LookupResolver.resolve(this);
	}

	private void checkNotAncestor(IniSection section) {
		for (var s = this; s != null; s = s.parent) {
			if (s == section) {
				throw new IllegalArgumentException("Section " + section.name + " cannot be nested within itself");
			}
		}
	}

	@Override
	public String toString() {
		return "IniSection[" + name + ", keys=" + keys.size() + ", sections=" + sections.size() + ']';
	}
}
