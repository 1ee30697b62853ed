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

package io.binpack.serializer.reflection;

import java.lang.reflect.Field;
import java.lang.reflect.Method;

/**
 * Looks up reflection handles by name.
 * <p>
 * Code generated in dump mode calls these methods instead of capturing handles,
 * so that persisted code does not depend on objects of the process that generated it.
 */
public final class ReflectionLookup {
	private ReflectionLookup() {
	}

	public static Class<?> type(String name) {
		ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
		try {
			return Class.forName(name, false, classLoader != null ? classLoader : ReflectionLookup.class.getClassLoader());
		} catch (ClassNotFoundException e) {
			throw new UnresolvedMemberException("No class " + name, e);
		}
	}

	public static Method method(String declaringType, String name, String[] parameterTypes) {
		Class<?>[] types = new Class<?>[parameterTypes.length];
		for (int i = 0; i < parameterTypes.length; i++) {
			types[i] = primitiveOrType(parameterTypes[i]);
		}
		Class<?> type = type(declaringType);
		try {
			return type.getMethod(name, types);
		} catch (NoSuchMethodException e) {
			throw new UnresolvedMemberException("No method " + declaringType + '#' + name, e);
		}
	}

	public static Field field(String declaringType, String name) {
		Class<?> type = type(declaringType);
		try {
			return type.getField(name);
		} catch (NoSuchFieldException e) {
			throw new UnresolvedMemberException("No field " + declaringType + '#' + name, e);
		}
	}

	private static Class<?> primitiveOrType(String name) {
		return switch (name) {
			case "boolean" -> boolean.class;
			case "char" -> char.class;
			case "byte" -> byte.class;
			case "short" -> short.class;
			case "int" -> int.class;
			case "long" -> long.class;
			case "float" -> float.class;
			case "double" -> double.class;
			default -> type(name);
		};
	}
}
