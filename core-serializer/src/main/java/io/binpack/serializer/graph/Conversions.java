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

package io.binpack.serializer.graph;

import io.binpack.codegen.util.Primitives;
import org.jetbrains.annotations.Nullable;

/**
 * Conversions between values of graph nodes, with the semantics of Java casts:
 * boxing, unboxing, primitive widening and narrowing and reference checks.
 */
public final class Conversions {
	private Conversions() {
	}

	/**
	 * Returns whether a value of one type can be converted to another
	 */
	public static boolean isConvertible(Class<?> from, Class<?> to) {
		if (from == to || to == void.class) return true;
		if (from == void.class) return false;
		if (from.isPrimitive() && to.isPrimitive()) {
			return (from == boolean.class) == (to == boolean.class);
		}
		if (from.isPrimitive()) {
			return to.isAssignableFrom(Primitives.wrap(from));
		}
		if (to.isPrimitive()) {
			Class<?> wrapper = Primitives.wrap(to);
			return wrapper.isAssignableFrom(from) || from.isAssignableFrom(wrapper);
		}
		return true;
	}

	/**
	 * Converts a value of a static type {@code from} to a type {@code to}
	 *
	 * @throws ClassCastException   if a reference is not an instance of a target type
	 * @throws NullPointerException if {@code null} is converted to a primitive
	 */
	public static @Nullable Object convert(@Nullable Object value, Class<?> from, Class<?> to) {
		if (to == void.class) return null;
		if (from == to) return value;
		if (!to.isPrimitive()) {
			if (value == null) return null;
			return to.cast(value);
		}
		if (value == null) {
			throw new NullPointerException("Cannot convert null to " + to.getName());
		}
		if (!from.isPrimitive()) {
			value = Primitives.wrap(to).cast(value);
		}
		return convertPrimitive(value, to);
	}

	private static Object convertPrimitive(Object value, Class<?> to) {
		if (to == boolean.class) return (Boolean) value;
		if (to == char.class) {
			return value instanceof Character ? (Character) value : (char) ((Number) value).intValue();
		}
		Number number = value instanceof Character ? (int) (Character) value : (Number) value;
		if (to == int.class) return number.intValue();
		if (to == long.class) return number.longValue();
		if (to == double.class) return number.doubleValue();
		if (to == float.class) return number.floatValue();
		if (to == short.class) return number.shortValue();
		if (to == byte.class) return number.byteValue();
		throw new IllegalArgumentException("Unsupported primitive type " + to);
	}

	/**
	 * Compares two values of the same static type: primitives numerically, references with {@link Comparable#compareTo}
	 */
	@SuppressWarnings({"unchecked", "rawtypes"})
	static int compare(Object left, Object right, Class<?> type) {
		if (type == boolean.class) return Boolean.compare((Boolean) left, (Boolean) right);
		if (type == char.class) return Character.compare((Character) left, (Character) right);
		if (type == long.class) return Long.compare((Long) left, (Long) right);
		if (type == double.class || type == float.class) {
			return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
		}
		if (type.isPrimitive()) return Integer.compare(((Number) left).intValue(), ((Number) right).intValue());
		return ((Comparable) left).compareTo(right);
	}
}
