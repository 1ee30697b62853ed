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

package io.binpack.codegen.util;

import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Set;

public final class Primitives {
	private static final Map<Class<?>, Class<?>> PRIMITIVE_TO_WRAPPER = Map.of(
			boolean.class, Boolean.class,
			byte.class, Byte.class,
			char.class, Character.class,
			short.class, Short.class,
			int.class, Integer.class,
			long.class, Long.class,
			float.class, Float.class,
			double.class, Double.class);

	private static final Map<Class<?>, Class<?>> WRAPPER_TO_PRIMITIVE = Map.of(
			Boolean.class, boolean.class,
			Byte.class, byte.class,
			Character.class, char.class,
			Short.class, short.class,
			Integer.class, int.class,
			Long.class, long.class,
			Float.class, float.class,
			Double.class, double.class);

	private static final Map<Class<?>, Object> DEFAULT_VALUES = Map.of(
			boolean.class, false,
			byte.class, (byte) 0,
			char.class, (char) 0,
			short.class, (short) 0,
			int.class, 0,
			long.class, 0L,
			float.class, 0.0f,
			double.class, 0.0d);

	private Primitives() {
	}

	public static Set<Class<?>> allPrimitiveTypes() {
		return PRIMITIVE_TO_WRAPPER.keySet();
	}

	public static boolean isPrimitiveType(Class<?> type) {
		return PRIMITIVE_TO_WRAPPER.containsKey(type);
	}

	public static boolean isWrapperType(Class<?> type) {
		return WRAPPER_TO_PRIMITIVE.containsKey(type);
	}

	@SuppressWarnings("unchecked")
	public static <T> Class<T> wrap(Class<T> type) {
		Class<T> wrapped = (Class<T>) PRIMITIVE_TO_WRAPPER.get(type);
		return wrapped == null ? type : wrapped;
	}

	@SuppressWarnings("unchecked")
	public static <T> Class<T> unwrap(Class<T> type) {
		Class<T> unwrapped = (Class<T>) WRAPPER_TO_PRIMITIVE.get(type);
		return unwrapped == null ? type : unwrapped;
	}

	/**
	 * Returns the value a field of a given type holds before it is assigned:
	 * zero of the matching primitive type, or {@code null} for reference types
	 */
	public static @Nullable Object defaultValue(Class<?> type) {
		return DEFAULT_VALUES.get(type);
	}
}
