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

import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;

/**
 * A member of a serialized type: a public field, a getter/setter pair or a record component.
 * <p>
 * Members of tuple-like types have no name and are identified by their position only.
 */
public final class SerializingMember {
	private final @Nullable String name;
	private final int index;
	private final Class<?> type;
	private final Type genericType;

	private final @Nullable Field field;
	private final @Nullable Method getter;
	private final @Nullable Method setter;

	private SerializingMember(@Nullable String name, int index, Class<?> type, Type genericType,
			@Nullable Field field, @Nullable Method getter, @Nullable Method setter) {
		this.name = name;
		this.index = index;
		this.type = type;
		this.genericType = genericType;
		this.field = field;
		this.getter = getter;
		this.setter = setter;
	}

	public static SerializingMember ofField(int index, Field field) {
		return new SerializingMember(field.getName(), index, field.getType(), field.getGenericType(), field, null, null);
	}

	public static SerializingMember ofProperty(int index, String name, Method getter, Method setter) {
		return new SerializingMember(name, index, getter.getReturnType(), getter.getGenericReturnType(), null, getter, setter);
	}

	public static SerializingMember ofRecordComponent(int index, RecordComponent component) {
		return new SerializingMember(component.getName(), index, component.getType(), component.getGenericType(),
				null, component.getAccessor(), null);
	}

	SerializingMember withoutName() {
		return new SerializingMember(null, index, type, genericType, field, getter, setter);
	}

	public @Nullable String getName() {
		return name;
	}

	public int getIndex() {
		return index;
	}

	public Class<?> getType() {
		return type;
	}

	public Type getGenericType() {
		return genericType;
	}

	public CollectionTraits getCollectionTraits() {
		return CollectionTraits.of(type, genericType);
	}

	public @Nullable Field getField() {
		return field;
	}

	public @Nullable Method getGetter() {
		return getter;
	}

	public @Nullable Method getSetter() {
		return setter;
	}

	public boolean isNullable() {
		return !type.isPrimitive();
	}

	@Override
	public String toString() {
		return (name != null ? name : "#" + index) + ':' + type.getSimpleName();
	}
}
