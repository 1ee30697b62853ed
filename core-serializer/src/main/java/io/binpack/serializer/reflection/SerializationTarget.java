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

import io.binpack.serializer.Packable;
import io.binpack.serializer.Unpackable;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.*;

import static io.binpack.common.Checks.checkArgument;
import static java.util.stream.Collectors.toList;

/**
 * Members of a type together with the way its instances are created.
 * <p>
 * Records are created with their canonical constructor from component values.
 * Other classes are created with a public no-argument constructor and then filled in
 * either through public non-static fields or, if there are none, through getter/setter pairs.
 */
public final class SerializationTarget {
	public enum Kind {
		RECORD, FIELDS, PROPERTIES
	}

	private final Class<?> type;
	private final Kind kind;
	private final List<SerializingMember> members;
	private final Constructor<?> constructor;
	private final boolean tuple;

	private SerializationTarget(Class<?> type, Kind kind, List<SerializingMember> members,
			Constructor<?> constructor, boolean tuple) {
		this.type = type;
		this.kind = kind;
		this.members = members;
		this.constructor = constructor;
		this.tuple = tuple;
	}

	/**
	 * Scans a type for its members
	 *
	 * @throws IllegalArgumentException if a type cannot be serialized member by member
	 */
	public static SerializationTarget prepare(Class<?> type) {
		if (type.isAnonymousClass())
			throw new IllegalArgumentException("Class should not be anonymous");
		if (type.isLocalClass())
			throw new IllegalArgumentException("Class should not be local");
		if (type.getEnclosingClass() != null && !Modifier.isStatic(type.getModifiers()))
			throw new IllegalArgumentException("Class should not be an inner class");
		checkArgument(Modifier.isPublic(type.getModifiers()), "Class %s should be public", type.getName());
		checkArgument(!type.isInterface() && !Modifier.isAbstract(type.getModifiers()), "Class %s should be concrete", type.getName());

		if (type.isRecord()) {
			return prepareRecord(type);
		}

		Constructor<?> constructor = findDefaultConstructor(type);

		List<SerializingMember> fields = new ArrayList<>();
		for (Field field : type.getFields()) {
			int modifiers = field.getModifiers();
			if (Modifier.isStatic(modifiers) || Modifier.isFinal(modifiers) || Modifier.isTransient(modifiers)) continue;
			fields.add(SerializingMember.ofField(fields.size(), field));
		}
		if (!fields.isEmpty()) {
			return new SerializationTarget(type, Kind.FIELDS, fields, constructor, false);
		}
		return new SerializationTarget(type, Kind.PROPERTIES, findProperties(type), constructor, false);
	}

	/**
	 * Scans a type and drops the names of its members, so that its instances are always packed by position
	 */
	public static SerializationTarget forTuple(Class<?> type) {
		SerializationTarget target = prepare(type);
		return new SerializationTarget(type, target.kind,
				target.members.stream().map(SerializingMember::withoutName).collect(toList()),
				target.constructor, true);
	}

	private static SerializationTarget prepareRecord(Class<?> type) {
		RecordComponent[] components = type.getRecordComponents();
		List<SerializingMember> members = new ArrayList<>();
		for (int i = 0; i < components.length; i++) {
			members.add(SerializingMember.ofRecordComponent(i, components[i]));
		}
		Class<?>[] parameterTypes = Arrays.stream(components).map(RecordComponent::getType).toArray(Class<?>[]::new);
		Constructor<?> constructor;
		try {
			constructor = type.getConstructor(parameterTypes);
		} catch (NoSuchMethodException e) {
			throw new IllegalArgumentException("Record " + type.getName() + " has no public canonical constructor", e);
		}
		return new SerializationTarget(type, Kind.RECORD, members, constructor, false);
	}

	private static List<SerializingMember> findProperties(Class<?> type) {
		Map<String, Method> getters = new TreeMap<>();
		for (Method method : type.getMethods()) {
			if (Modifier.isStatic(method.getModifiers()) || method.getParameterCount() != 0 ||
					method.getDeclaringClass() == Object.class) continue;
			String name = propertyName(method);
			if (name != null) {
				getters.put(name, method);
			}
		}
		List<SerializingMember> members = new ArrayList<>();
		for (Map.Entry<String, Method> entry : getters.entrySet()) {
			Method getter = entry.getValue();
			String setterName = "set" + Character.toUpperCase(entry.getKey().charAt(0)) + entry.getKey().substring(1);
			Method setter;
			try {
				setter = type.getMethod(setterName, getter.getReturnType());
			} catch (NoSuchMethodException e) {
				continue;
			}
			members.add(SerializingMember.ofProperty(members.size(), entry.getKey(), getter, setter));
		}
		return members;
	}

	private static @Nullable String propertyName(Method getter) {
		String name = getter.getName();
		if (name.startsWith("get") && name.length() > 3 && getter.getReturnType() != void.class) {
			return Character.toLowerCase(name.charAt(3)) + name.substring(4);
		}
		if (name.startsWith("is") && name.length() > 2 && getter.getReturnType() == boolean.class) {
			return Character.toLowerCase(name.charAt(2)) + name.substring(3);
		}
		return null;
	}

	private static Constructor<?> findDefaultConstructor(Class<?> type) {
		try {
			return type.getConstructor();
		} catch (NoSuchMethodException e) {
			throw new IllegalArgumentException("Class " + type.getName() + " has no public no-argument constructor", e);
		}
	}

	public Class<?> getType() {
		return type;
	}

	public Kind getKind() {
		return kind;
	}

	public List<SerializingMember> getMembers() {
		return members;
	}

	public Constructor<?> getConstructor() {
		return constructor;
	}

	public boolean isRecord() {
		return kind == Kind.RECORD;
	}

	/**
	 * Returns {@code true} if the members have no names and are always packed by position
	 */
	public boolean isTuple() {
		return tuple;
	}

	public boolean isPackable() {
		return Packable.class.isAssignableFrom(type);
	}

	public boolean isUnpackable() {
		return Unpackable.class.isAssignableFrom(type);
	}

	@Override
	public String toString() {
		return "SerializationTarget{" + type.getSimpleName() + ' ' + kind + ' ' + members + '}';
	}
}
