/* Copyright 2026 Ampflower
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package gay.ampflower.ini;// Created 2026-19-10T11:48:27

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Maps the keys of a section onto an object through a table of fields.
 *
 * <pre>{@code
 * var mapping = SectionMapping.of(Server::new)
 *     .field("host", Function.identity(), Server::setHost)
 *     .field("port", Integer::valueOf, Server::setPort);
 * Server server = mapping.map(ini, "server");
 * }</pre>
 *
 * @param <T> The mapped type.
 * @author Ampflower
 * @since 0.1.0
 **/
public final class SectionMapping<T> {
	private final Supplier<T> factory;
	private final List<Field<T, ?>> fields = new ArrayList<>();

	private SectionMapping(Supplier<T> factory) {
		this.factory = Objects.requireNonNull(factory, "factory");
	}

	public static <T> SectionMapping<T> of(Supplier<T> factory) {
		return new SectionMapping<>(factory);
	}

	/**
	 * @param key       The key to read.
	 * @param converter Converts the raw value.
	 * @param setter    Stores the converted value into the target.
	 * @return This mapping.
	 */
	public <V> SectionMapping<T> field(String key, Function<String, ? extends V> converter,
			BiConsumer<? super T, ? super V> setter) {
		fields.add(new Field<>(Objects.requireNonNull(key, "key"), converter, setter));
		return this;
	}

	/**
	 * Creates a target, setting each mapped field whose key is present.
	 *
	 * @throws IniException If a converter rejects a value.
	 */
	public T map(IniSection section) {
		final var target = factory.get();
		for (var field : fields) {
			if (section.hasKey(field.key)) {
				field.apply(section, target);
			}
		}
		return target;
	}

	/**
	 * Maps the named child, or returns an untouched target if there's none.
	 */
	public T map(IniSection parent, String name) {
		final var section = parent.getSection(name, null);
		return section == null ? factory.get() : map(section);
	}

	private record Field<T, V> (String key, Function<String, ? extends V> converter,
			BiConsumer<? super T, ? super V> setter) {
		void apply(IniSection section, T target) {
			final var raw = section.getKey(key);
			final V value;
			try {
				value = converter.apply(raw);
			} catch (RuntimeException re) {
				throw new IniException("Cannot convert " + section.name() + '.' + key + " = " + raw, re);
			}
			setter.accept(target, value);
		}
	}
}
