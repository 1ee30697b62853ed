/*
 * Copyright (C) 2020 ActiveJ LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.binpack.serializer;

import java.util.Map;

import static io.binpack.common.Checks.checkArgument;

/**
 * Describes which concrete types may be used for polymorphic members.
 * It is passed through to generated serializers as is.
 */
public final class PolymorphismSchema {
	public static final PolymorphismSchema DEFAULT = new PolymorphismSchema(Map.of());

	private final Map<String, Class<?>> subtypes;

	private PolymorphismSchema(Map<String, Class<?>> subtypes) {
		this.subtypes = subtypes;
	}

	/**
	 * Creates a schema that maps type codes to concrete types
	 */
	public static PolymorphismSchema of(Map<String, Class<?>> subtypes) {
		checkArgument(!subtypes.isEmpty(), "At least one subtype is required");
		return new PolymorphismSchema(Map.copyOf(subtypes));
	}

	public Map<String, Class<?>> getSubtypes() {
		return subtypes;
	}

	public boolean isDefault() {
		return subtypes.isEmpty();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return subtypes.equals(((PolymorphismSchema) o).subtypes);
	}

	@Override
	public int hashCode() {
		return subtypes.hashCode();
	}

	@Override
	public String toString() {
		return isDefault() ? "PolymorphismSchema{DEFAULT}" : "PolymorphismSchema{" + subtypes + '}';
	}
}
