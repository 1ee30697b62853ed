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

package io.binpack.serializer.builder;

import io.binpack.codegen.container.EmitterFlavor;
import io.binpack.codegen.util.Primitives;
import io.binpack.serializer.*;
import io.binpack.serializer.reflection.CollectionKind;
import io.binpack.serializer.reflection.CollectionTraits;
import io.binpack.serializer.reflection.MethodDefinition;
import io.binpack.serializer.reflection.SerializationTarget;
import io.binpack.serializer.reflection.SerializingMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.*;

import static io.binpack.common.Checks.checkNotNull;
import static io.binpack.serializer.GeneratedEnumSerializer.PACK_UNDERLYING_VALUE_TO;
import static io.binpack.serializer.GeneratedEnumSerializer.UNPACK_FROM_UNDERLYING_VALUE;
import static io.binpack.serializer.GeneratedObjectSerializer.CREATE_OBJECT_FROM_CONTEXT;
import static io.binpack.serializer.GeneratedObjectSerializer.CREATE_UNPACKING_CONTEXT;
import static java.util.stream.Collectors.toList;

/**
 * Decides which operations a serializer of a type consists of, and emits them with a {@link SerializerBuilder}.
 * <p>
 * Every member gets a pack helper and an unpack helper. The helpers are collected into operation lists
 * that the builder assembles into a serializer. A plan is used once.
 *
 * @param <C> type of generation context
 * @param <N> type of constructs
 */
public final class SerializerBuildPlan<C extends GenerationContext<N>, N extends Construct> {
	private static final Logger logger = LoggerFactory.getLogger(SerializerBuildPlan.class);

	public static final String PACK_MEMBER = "packMember";
	public static final String UNPACK_MEMBER = "unpackMember";

	private static final MethodDefinition WRITE_NIL = MethodDefinition.resolve(Packer.class, "writeNil");
	private static final MethodDefinition WRITE_BOOLEAN = MethodDefinition.resolve(Packer.class, "writeBoolean", boolean.class);
	private static final MethodDefinition WRITE_INT = MethodDefinition.resolve(Packer.class, "writeInt", int.class);
	private static final MethodDefinition WRITE_LONG = MethodDefinition.resolve(Packer.class, "writeLong", long.class);
	private static final MethodDefinition WRITE_FLOAT = MethodDefinition.resolve(Packer.class, "writeFloat", float.class);
	private static final MethodDefinition WRITE_DOUBLE = MethodDefinition.resolve(Packer.class, "writeDouble", double.class);
	private static final MethodDefinition WRITE_STRING = MethodDefinition.resolve(Packer.class, "writeString", String.class);
	private static final MethodDefinition WRITE_ARRAY_HEADER = MethodDefinition.resolve(Packer.class, "writeArrayHeader", int.class);
	private static final MethodDefinition WRITE_MAP_HEADER = MethodDefinition.resolve(Packer.class, "writeMapHeader", int.class);

	private static final MethodDefinition TRY_READ_NIL = MethodDefinition.resolve(Unpacker.class, "tryReadNil");
	private static final MethodDefinition READ_BOOLEAN = MethodDefinition.resolve(Unpacker.class, "readBoolean");
	private static final MethodDefinition READ_INT = MethodDefinition.resolve(Unpacker.class, "readInt");
	private static final MethodDefinition READ_LONG = MethodDefinition.resolve(Unpacker.class, "readLong");
	private static final MethodDefinition READ_FLOAT = MethodDefinition.resolve(Unpacker.class, "readFloat");
	private static final MethodDefinition READ_DOUBLE = MethodDefinition.resolve(Unpacker.class, "readDouble");
	private static final MethodDefinition READ_STRING = MethodDefinition.resolve(Unpacker.class, "readString");
	private static final MethodDefinition READ_ARRAY_HEADER = MethodDefinition.resolve(Unpacker.class, "readArrayHeader");
	private static final MethodDefinition READ_MAP_HEADER = MethodDefinition.resolve(Unpacker.class, "readMapHeader");

	private static final MethodDefinition GET_SERIALIZER = MethodDefinition.resolve(SerializationContext.class, "getSerializer", Class.class);
	private static final MethodDefinition PACK_TO = MethodDefinition.resolve(PackSerializer.class, "packTo", Packer.class, Object.class);
	private static final MethodDefinition UNPACK_FROM = MethodDefinition.resolve(PackSerializer.class, "unpackFrom", Unpacker.class);

	private static final MethodDefinition ARRAY_LENGTH = MethodDefinition.resolve(Array.class, "getLength", Object.class);
	private static final MethodDefinition COLLECTION_ADD = MethodDefinition.resolve(Collection.class, "add", Object.class);
	private static final MethodDefinition ENTRY_KEY = MethodDefinition.resolve(Map.Entry.class, "getKey");
	private static final MethodDefinition ENTRY_VALUE = MethodDefinition.resolve(Map.Entry.class, "getValue");
	private static final MethodDefinition ENUM_ORDINAL = MethodDefinition.resolve(Enum.class, "ordinal");
	private static final MethodDefinition LIST_OF = MethodDefinition.resolve(List.class, "of", Object[].class);

	private final SerializerBuilder<C, N> builder;
	private final C ctx;

	private SerializerBuildPlan(SerializerBuilder<C, N> builder, C ctx) {
		this.builder = builder;
		this.ctx = ctx;
	}

	public static <C extends GenerationContext<N>, N extends Construct> SerializerBuildPlan<C, N> create(
			SerializerBuilder<C, N> builder, Class<?> targetType, EmitterFlavor flavor) {
		return new SerializerBuildPlan<>(builder, builder.createContext(targetType, flavor));
	}

	public C getContext() {
		return ctx;
	}

	// region object serializers
	/**
	 * Emits all helpers and operation lists of an object and assembles its serializer
	 *
	 * @throws SerializerCompilationException if emitted code is inconsistent
	 */
	public <T> SerializerFactory<T> buildObjectSerializer(SerializationTarget target, PolymorphismSchema schema) {
		List<SerializingMember> members = target.getMembers();
		logger.debug("Planning serializer of {}: {} {} members", target.getType().getName(), members.size(), target.getKind());

		List<MethodDefinition> packHelpers = new ArrayList<>();
		List<MethodDefinition> unpackHelpers = new ArrayList<>();
		for (SerializingMember member : members) {
			if (!target.isPackable()) {
				packHelpers.add(definePackMember(target, member));
			}
			if (!target.isUnpackable()) {
				unpackHelpers.add(defineUnpackMember(target, member));
			}
		}
		defineCreateUnpackingContext(target);
		defineCreateObjectFromContext(target);

		List<String> names = members.stream()
				.map(member -> member.getName() != null ? member.getName() : "#" + member.getIndex())
				.collect(toList());

		ctx.setPackOperations(emitDelegateList(packHelpers));
		ctx.setPackOperationTable(emitTable(names, packHelpers));
		ctx.setUnpackOperations(emitDelegateList(unpackHelpers));
		ctx.setUnpackOperationTable(emitTable(names, unpackHelpers));
		ctx.setMemberNames(emitList(names.stream().map(name -> builder.emitStringConstant(ctx, name)).collect(toList())));

		return builder.createSerializerConstructor(ctx, target, schema);
	}

	private MethodDefinition definePackMember(SerializationTarget target, SerializingMember member) {
		return builder.defineHelper(ctx, PACK_MEMBER + member.getIndex(), PackOperation.class, parameters -> {
			N context = builder.referArgument(ctx, SerializationContext.class, "context", 1);
			N packer = builder.referArgument(ctx, Packer.class, "packer", 2);
			N instance = builder.referArgument(ctx, target.getType(), "target", 3);
			N value = member.getField() != null ?
					builder.emitGetField(ctx, instance, member.getField()) :
					builder.emitGetProperty(ctx, instance, checkNotNull(member.getGetter()));
			return emitPackValue(context, packer, value, member.getType(), member.getGenericType());
		});
	}

	private MethodDefinition defineUnpackMember(SerializationTarget target, SerializingMember member) {
		return builder.defineHelper(ctx, UNPACK_MEMBER + member.getIndex(), UnpackOperation.class, parameters -> {
			N context = builder.referArgument(ctx, SerializationContext.class, "context", 1);
			N unpacker = builder.referArgument(ctx, Unpacker.class, "unpacker", 2);
			N value = emitUnpackValue(context, unpacker, member.getType(), member.getGenericType());
			if (target.isRecord()) {
				N arguments = builder.referArgument(ctx, Object[].class, "unpackingContext", 3);
				N boxed = member.getType().isPrimitive() ? builder.emitBoxExpression(ctx, value) : value;
				return builder.emitSetArrayElement(ctx, arguments, builder.emitIntConstant(ctx, member.getIndex()), boxed);
			}
			N instance = builder.referArgument(ctx, target.getType(), "unpackingContext", 3);
			if (member.getField() != null) {
				return builder.emitSetField(ctx, instance, member.getField(), value);
			}
			return builder.emitSetProperty(ctx, instance, checkNotNull(member.getSetter()), value);
		});
	}

	/**
	 * Records are unpacked into an array of component values, other objects into a new instance
	 */
	private void defineCreateUnpackingContext(SerializationTarget target) {
		builder.defineHelper(ctx, CREATE_UNPACKING_CONTEXT, Delegate0.class, parameters -> {
			if (!target.isRecord()) {
				return builder.emitCreateNewObjectExpression(ctx, target.getConstructor(), List.of());
			}
			List<N> defaults = new ArrayList<>();
			for (SerializingMember member : target.getMembers()) {
				N value = builder.emitDefaultValue(ctx, member.getType());
				defaults.add(member.getType().isPrimitive() ? builder.emitBoxExpression(ctx, value) : value);
			}
			return builder.emitCreateNewArrayExpression(ctx, Object.class, defaults);
		});
	}

	private void defineCreateObjectFromContext(SerializationTarget target) {
		builder.defineHelper(ctx, CREATE_OBJECT_FROM_CONTEXT, Delegate1.class, parameters -> {
			if (!target.isRecord()) {
				return builder.referArgument(ctx, target.getType(), "unpackingContext", 1);
			}
			N arguments = builder.referArgument(ctx, Object[].class, "unpackingContext", 1);
			Constructor<?> constructor = target.getConstructor();
			List<N> values = new ArrayList<>();
			for (SerializingMember member : target.getMembers()) {
				N element = builder.emitGetArrayElement(ctx, arguments, builder.emitIntConstant(ctx, member.getIndex()));
				values.add(member.getType().isPrimitive() ?
						builder.emitUnboxExpression(ctx, element, member.getType()) :
						builder.emitCast(ctx, element, member.getType()));
			}
			return builder.emitCreateNewObjectExpression(ctx, constructor, values);
		});
	}

	private N emitDelegateList(List<MethodDefinition> helpers) {
		return emitList(helpers.stream().map(helper -> builder.emitNewPrivateMethodDelegate(ctx, helper)).collect(toList()));
	}

	/**
	 * Returns an immutable list of elements, evaluated in order
	 */
	private N emitList(List<N> elements) {
		N array = builder.emitCreateNewArrayExpression(ctx, Object.class, elements);
		return builder.emitInvokeMethodExpression(ctx, null, LIST_OF, List.of(array));
	}

	/**
	 * Returns a map from member names to helper delegates, in member order
	 */
	private N emitTable(List<String> names, List<MethodDefinition> helpers) {
		N table = builder.declareLocal(ctx, Map.class, ctx.newLocalName("table"));
		List<N> statements = new ArrayList<>();
		statements.add(builder.emitStoreVariable(ctx, table,
				builder.emitCreateNewObjectExpression(ctx, getConstructor(LinkedHashMap.class), List.of())));
		for (int i = 0; i < helpers.size(); i++) {
			statements.add(builder.emitSetIndexedProperty(ctx, table, Map.class, "put", String.class, Object.class,
					builder.emitStringConstant(ctx, names.get(i)),
					builder.emitNewPrivateMethodDelegate(ctx, helpers.get(i))));
		}
		statements.add(table);
		return builder.emitSequentialStatements(ctx, Map.class, statements);
	}
	// endregion

	// region enum serializers
	/**
	 * Emits helpers that pack an enum constant by its ordinal and assembles a serializer of the enum
	 */
	public <E extends Enum<E>> SerializerFactory<E> buildEnumSerializer() {
		Class<?> enumType = ctx.getTargetType();
		logger.debug("Planning serializer of enum {}", enumType.getName());

		builder.defineHelper(ctx, PACK_UNDERLYING_VALUE_TO, Delegate2.class, parameters -> {
			N packer = builder.referArgument(ctx, Packer.class, "packer", 1);
			N value = builder.referArgument(ctx, Enum.class, "value", 2);
			N ordinal = builder.emitInvokeMethodExpression(ctx, value, ENUM_ORDINAL, List.of());
			return builder.emitInvokeVoidMethod(ctx, packer, WRITE_INT, List.of(ordinal));
		});

		Method values = getValuesMethod(enumType);
		builder.defineHelper(ctx, UNPACK_FROM_UNDERLYING_VALUE, Delegate1.class, parameters -> {
			N unpacker = builder.referArgument(ctx, Unpacker.class, "unpacker", 1);
			N valuesDelegate = builder.emitGetStaticDelegateExpression(ctx, values);
			N constants = builder.emitCast(ctx,
					builder.emitInvokeDelegateExpression(ctx, Delegate0.class, valuesDelegate, List.of(builder.emitThisReference(ctx))),
					values.getReturnType());
			N ordinal = builder.emitInvokeMethodExpression(ctx, unpacker, READ_INT, List.of());
			return builder.emitGetArrayElement(ctx, constants, ordinal);
		});

		return builder.createEnumSerializerConstructor(ctx);
	}
	// endregion

	// region values
	private N emitPackValue(N context, N packer, N value, Class<?> type, Type genericType) {
		if (type.isPrimitive()) {
			return emitPackPrimitive(packer, value, type);
		}
		N local = builder.declareLocal(ctx, type, ctx.newLocalName("value"));
		N packNonNull;
		CollectionTraits traits = CollectionTraits.of(type, genericType);
		if (Primitives.isWrapperType(type)) {
			Class<?> primitiveType = Primitives.unwrap(type);
			packNonNull = emitPackPrimitive(packer, builder.emitUnboxExpression(ctx, local, primitiveType), primitiveType);
		} else if (type == String.class) {
			packNonNull = builder.emitInvokeVoidMethod(ctx, packer, WRITE_STRING, List.of(local));
		} else if (traits.getKind() == CollectionKind.ARRAY) {
			N length = builder.emitInvokeMethodExpression(ctx, null, ARRAY_LENGTH, List.of(local));
			packNonNull = builder.emitSequentialStatements(ctx, void.class, List.of(
					builder.emitInvokeVoidMethod(ctx, packer, WRITE_ARRAY_HEADER, List.of(length)),
					builder.emitForEachLoop(ctx, traits, local, element ->
							emitPackValue(context, packer, element, traits.getElementType(), traits.getElementType()))));
		} else if (traits.getKind() == CollectionKind.ITERABLE) {
			N size = builder.emitInvokeMethodExpression(ctx, local, MethodDefinition.of(traits.getSizeMethod()), List.of());
			packNonNull = builder.emitSequentialStatements(ctx, void.class, List.of(
					builder.emitInvokeVoidMethod(ctx, packer, WRITE_ARRAY_HEADER, List.of(size)),
					builder.emitForEachLoop(ctx, traits, local, element ->
							emitPackValue(context, packer, element, traits.getElementType(), traits.getElementType()))));
		} else if (traits.getKind() == CollectionKind.MAP) {
			N size = builder.emitInvokeMethodExpression(ctx, local, MethodDefinition.of(traits.getSizeMethod()), List.of());
			packNonNull = builder.emitSequentialStatements(ctx, void.class, List.of(
					builder.emitInvokeVoidMethod(ctx, packer, WRITE_MAP_HEADER, List.of(size)),
					builder.emitForEachLoop(ctx, traits, local, entry -> builder.emitSequentialStatements(ctx, void.class, List.of(
							emitPackValue(context, packer,
									builder.emitCast(ctx, builder.emitInvokeMethodExpression(ctx, entry, ENTRY_KEY, List.of()), traits.getKeyType()),
									traits.getKeyType(), traits.getKeyType()),
							emitPackValue(context, packer,
									builder.emitCast(ctx, builder.emitInvokeMethodExpression(ctx, entry, ENTRY_VALUE, List.of()), traits.getValueType()),
									traits.getValueType(), traits.getValueType()))))));
		} else {
			N serializer = emitGetSerializer(context, type);
			packNonNull = builder.emitInvokeVoidMethod(ctx, serializer, PACK_TO, List.of(packer, local));
		}
		N isNull = builder.emitEqualsExpression(ctx, local, builder.emitNullConstant(ctx, type));
		return builder.emitSequentialStatements(ctx, void.class, List.of(
				builder.emitStoreVariable(ctx, local, value),
				builder.emitConditionalExpression(ctx, isNull,
						builder.emitInvokeVoidMethod(ctx, packer, WRITE_NIL, List.of()),
						packNonNull)));
	}

	private N emitPackPrimitive(N packer, N value, Class<?> type) {
		if (type == boolean.class) {
			return builder.emitInvokeVoidMethod(ctx, packer, WRITE_BOOLEAN, List.of(value));
		}
		if (type == long.class) {
			return builder.emitInvokeVoidMethod(ctx, packer, WRITE_LONG, List.of(value));
		}
		if (type == float.class) {
			return builder.emitInvokeVoidMethod(ctx, packer, WRITE_FLOAT, List.of(value));
		}
		if (type == double.class) {
			return builder.emitInvokeVoidMethod(ctx, packer, WRITE_DOUBLE, List.of(value));
		}
		return builder.emitInvokeVoidMethod(ctx, packer, WRITE_INT, List.of(builder.emitCast(ctx, value, int.class)));
	}

	private N emitUnpackValue(N context, N unpacker, Class<?> type, Type genericType) {
		if (type.isPrimitive()) {
			return emitUnpackPrimitive(unpacker, type);
		}
		CollectionTraits traits = CollectionTraits.of(type, genericType);
		if (!traits.isCollection() && !Primitives.isWrapperType(type) && type != String.class) {
			N serializer = emitGetSerializer(context, type);
			return builder.emitCast(ctx, builder.emitInvokeMethodExpression(ctx, serializer, UNPACK_FROM, List.of(unpacker)), type);
		}
		N unpackNonNull;
		if (Primitives.isWrapperType(type)) {
			unpackNonNull = builder.emitBoxExpression(ctx, emitUnpackPrimitive(unpacker, Primitives.unwrap(type)));
		} else if (type == String.class) {
			unpackNonNull = builder.emitInvokeMethodExpression(ctx, unpacker, READ_STRING, List.of());
		} else if (traits.getKind() == CollectionKind.ARRAY) {
			unpackNonNull = emitUnpackArray(context, unpacker, traits);
		} else if (traits.getKind() == CollectionKind.ITERABLE) {
			unpackNonNull = emitUnpackCollection(context, unpacker, traits);
		} else {
			unpackNonNull = emitUnpackMap(context, unpacker, traits);
		}
		return builder.emitConditionalExpression(ctx,
				builder.emitInvokeMethodExpression(ctx, unpacker, TRY_READ_NIL, List.of()),
				builder.emitNullConstant(ctx, type),
				builder.emitCast(ctx, unpackNonNull, type));
	}

	private N emitUnpackPrimitive(N unpacker, Class<?> type) {
		if (type == boolean.class) {
			return builder.emitInvokeMethodExpression(ctx, unpacker, READ_BOOLEAN, List.of());
		}
		if (type == long.class) {
			return builder.emitInvokeMethodExpression(ctx, unpacker, READ_LONG, List.of());
		}
		if (type == float.class) {
			return builder.emitInvokeMethodExpression(ctx, unpacker, READ_FLOAT, List.of());
		}
		if (type == double.class) {
			return builder.emitInvokeMethodExpression(ctx, unpacker, READ_DOUBLE, List.of());
		}
		N value = builder.emitInvokeMethodExpression(ctx, unpacker, READ_INT, List.of());
		return type == int.class ? value : builder.emitCast(ctx, value, type);
	}

	private N emitUnpackArray(N context, N unpacker, CollectionTraits traits) {
		Class<?> elementType = traits.getElementType();
		N count = builder.declareLocal(ctx, int.class, ctx.newLocalName("count"));
		N array = builder.declareLocal(ctx, traits.getCollectionType(), ctx.newLocalName("array"));
		return builder.emitSequentialStatements(ctx, traits.getCollectionType(), Arrays.asList(
				builder.emitStoreVariable(ctx, count, builder.emitInvokeMethodExpression(ctx, unpacker, READ_ARRAY_HEADER, List.of())),
				builder.emitStoreVariable(ctx, array, builder.emitCreateNewArrayExpression(ctx, elementType, count)),
				builder.emitForLoop(ctx, count, index ->
						builder.emitSetArrayElement(ctx, array, index, emitUnpackValue(context, unpacker, elementType, elementType))),
				array));
	}

	private N emitUnpackCollection(N context, N unpacker, CollectionTraits traits) {
		Class<?> implementation = collectionImplementation(traits.getCollectionType());
		N count = builder.declareLocal(ctx, int.class, ctx.newLocalName("count"));
		N collection = builder.declareLocal(ctx, Collection.class, ctx.newLocalName("collection"));
		return builder.emitSequentialStatements(ctx, Collection.class, Arrays.asList(
				builder.emitStoreVariable(ctx, count, builder.emitInvokeMethodExpression(ctx, unpacker, READ_ARRAY_HEADER, List.of())),
				builder.emitStoreVariable(ctx, collection,
						builder.emitCreateNewObjectExpression(ctx, getConstructor(implementation), List.of())),
				builder.emitForLoop(ctx, count, index ->
						builder.emitInvokeVoidMethod(ctx, collection, COLLECTION_ADD,
								List.of(emitUnpackValue(context, unpacker, traits.getElementType(), traits.getElementType())))),
				collection));
	}

	private N emitUnpackMap(N context, N unpacker, CollectionTraits traits) {
		Class<?> implementation = mapImplementation(traits.getCollectionType());
		N count = builder.declareLocal(ctx, int.class, ctx.newLocalName("count"));
		N map = builder.declareLocal(ctx, Map.class, ctx.newLocalName("map"));
		return builder.emitSequentialStatements(ctx, Map.class, Arrays.asList(
				builder.emitStoreVariable(ctx, count, builder.emitInvokeMethodExpression(ctx, unpacker, READ_MAP_HEADER, List.of())),
				builder.emitStoreVariable(ctx, map,
						builder.emitCreateNewObjectExpression(ctx, getConstructor(implementation), List.of())),
				builder.emitForLoop(ctx, count, index ->
						builder.emitSetIndexedProperty(ctx, map, Map.class, "put", Object.class, Object.class,
								emitUnpackValue(context, unpacker, traits.getKeyType(), traits.getKeyType()),
								emitUnpackValue(context, unpacker, traits.getValueType(), traits.getValueType()))),
				map));
	}

	private N emitGetSerializer(N context, Class<?> type) {
		return builder.emitInvokeMethodExpression(ctx, context, GET_SERIALIZER, List.of(builder.emitTypeOfExpression(ctx, type)));
	}
	// endregion

	private static Class<?> collectionImplementation(Class<?> type) {
		if (!type.isInterface() && !Modifier.isAbstract(type.getModifiers())) return type;
		if (type.isAssignableFrom(ArrayList.class)) return ArrayList.class;
		if (type.isAssignableFrom(LinkedHashSet.class)) return LinkedHashSet.class;
		if (type.isAssignableFrom(TreeSet.class)) return TreeSet.class;
		if (type.isAssignableFrom(ArrayDeque.class)) return ArrayDeque.class;
		throw new SerializerCompilationException("No implementation of collection " + type.getName());
	}

	private static Class<?> mapImplementation(Class<?> type) {
		if (!type.isInterface() && !Modifier.isAbstract(type.getModifiers())) return type;
		if (type.isAssignableFrom(LinkedHashMap.class)) return LinkedHashMap.class;
		if (type.isAssignableFrom(TreeMap.class)) return TreeMap.class;
		throw new SerializerCompilationException("No implementation of map " + type.getName());
	}

	private static Constructor<?> getConstructor(Class<?> type) {
		try {
			return type.getConstructor();
		} catch (NoSuchMethodException e) {
			throw new SerializerCompilationException("No public no-argument constructor of " + type.getName(), e);
		}
	}

	private static Method getValuesMethod(Class<?> enumType) {
		try {
			return enumType.getMethod("values");
		} catch (NoSuchMethodException e) {
			throw new SerializerCompilationException("No values() method of " + enumType.getName(), e);
		}
	}

	@Override
	public String toString() {
		return "SerializerBuildPlan{" + builder + ", " + ctx + '}';
	}
}
