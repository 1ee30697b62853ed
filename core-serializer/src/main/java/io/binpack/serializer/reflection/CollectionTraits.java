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

import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;

import static io.binpack.common.Checks.checkState;

/**
 * Describes how to walk over the elements of a type.
 * <p>
 * Arrays are walked by index. Iterables are walked with their iterator.
 * Maps are walked over their {@link Map#entrySet() entry set}, so the element type of a map is {@link Map.Entry}.
 */
public final class CollectionTraits {
	private static final Method ITERATOR = getMethod(Iterable.class, "iterator");
	private static final Method HAS_NEXT = getMethod(Iterator.class, "hasNext");
	private static final Method NEXT = getMethod(Iterator.class, "next");
	private static final Method ENTRY_SET = getMethod(Map.class, "entrySet");
	private static final Method COLLECTION_SIZE = getMethod(Collection.class, "size");
	private static final Method MAP_SIZE = getMethod(Map.class, "size");

	private static final CollectionTraits NOT_A_COLLECTION = new CollectionTraits(CollectionKind.NOT_A_COLLECTION, Object.class,
			Object.class, null, null);

	private final CollectionKind kind;
	private final Class<?> collectionType;
	private final Class<?> elementType;
	private final @Nullable Class<?> keyType;
	private final @Nullable Class<?> valueType;

	private CollectionTraits(CollectionKind kind, Class<?> collectionType, Class<?> elementType,
			@Nullable Class<?> keyType, @Nullable Class<?> valueType) {
		this.kind = kind;
		this.collectionType = collectionType;
		this.elementType = elementType;
		this.keyType = keyType;
		this.valueType = valueType;
	}

	/**
	 * Returns traits of a type, element types are taken from type arguments of its generic type
	 *
	 * @param type        a raw type
	 * @param genericType a generic type, as declared by a field or a method
	 */
	public static CollectionTraits of(Class<?> type, Type genericType) {
		if (type.isArray()) {
			return new CollectionTraits(CollectionKind.ARRAY, type, type.getComponentType(), null, null);
		}
		if (Map.class.isAssignableFrom(type)) {
			return new CollectionTraits(CollectionKind.MAP, type, Map.Entry.class,
					typeArgument(genericType, 0), typeArgument(genericType, 1));
		}
		if (Collection.class.isAssignableFrom(type)) {
			return new CollectionTraits(CollectionKind.ITERABLE, type, typeArgument(genericType, 0), null, null);
		}
		return NOT_A_COLLECTION;
	}

	public static CollectionTraits of(Class<?> type) {
		return of(type, type);
	}

	public CollectionKind getKind() {
		return kind;
	}

	public boolean isCollection() {
		return kind != CollectionKind.NOT_A_COLLECTION;
	}

	public Class<?> getCollectionType() {
		return collectionType;
	}

	public Class<?> getElementType() {
		return elementType;
	}

	public Class<?> getKeyType() {
		checkState(kind == CollectionKind.MAP, "Not a map: %s", collectionType);
		return keyType;
	}

	public Class<?> getValueType() {
		checkState(kind == CollectionKind.MAP, "Not a map: %s", collectionType);
		return valueType;
	}

	/**
	 * Returns a method that returns a collection to iterate over, which is {@code entrySet} for maps
	 * and {@code null} for other kinds
	 */
	public @Nullable Method getEntrySetMethod() {
		return kind == CollectionKind.MAP ? ENTRY_SET : null;
	}

	public Method getIteratorMethod() {
		checkIterable();
		return ITERATOR;
	}

	public Method getHasNextMethod() {
		checkIterable();
		return HAS_NEXT;
	}

	public Method getNextMethod() {
		checkIterable();
		return NEXT;
	}

	public Method getSizeMethod() {
		checkIterable();
		return kind == CollectionKind.MAP ? MAP_SIZE : COLLECTION_SIZE;
	}

	private void checkIterable() {
		checkState(kind == CollectionKind.ITERABLE || kind == CollectionKind.MAP, "%s is not iterable", collectionType);
	}

	private static Class<?> typeArgument(Type genericType, int index) {
		if (!(genericType instanceof ParameterizedType)) return Object.class;
		Type argument = ((ParameterizedType) genericType).getActualTypeArguments()[index];
		if (argument instanceof WildcardType) {
			argument = ((WildcardType) argument).getUpperBounds()[0];
		}
		if (argument instanceof ParameterizedType) {
			return (Class<?>) ((ParameterizedType) argument).getRawType();
		}
		return argument instanceof Class ? (Class<?>) argument : Object.class;
	}

	private static Method getMethod(Class<?> type, String name) {
		try {
			return type.getMethod(name);
		} catch (NoSuchMethodException e) {
			throw new AssertionError(e);
		}
	}

	@Override
	public String toString() {
		return "CollectionTraits{" + kind + ' ' + collectionType.getSimpleName() + '<' + elementType.getSimpleName() + ">}";
	}
}
