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
import io.binpack.serializer.reflection.CollectionTraits;
import io.binpack.serializer.reflection.MethodDefinition;
import io.binpack.serializer.reflection.SerializationTarget;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static io.binpack.common.Checks.checkArgument;
import static io.binpack.serializer.GeneratedEnumSerializer.PACK_UNDERLYING_VALUE_TO;
import static io.binpack.serializer.GeneratedEnumSerializer.UNPACK_FROM_UNDERLYING_VALUE;
import static io.binpack.serializer.GeneratedObjectSerializer.CREATE_OBJECT_FROM_CONTEXT;
import static io.binpack.serializer.GeneratedObjectSerializer.CREATE_UNPACKING_CONTEXT;

/**
 * Emits the code of a serializer for a single target type.
 * <p>
 * A builder is stateless, everything it emits goes into a {@link GenerationContext}.
 * Every {@code emit*} method returns a construct that is either used as an operand of another one,
 * or becomes a body of a helper defined with {@link #defineHelper}. Helpers, together with the operation lists
 * registered in a context, are turned into a {@link SerializerFactory} by {@link #createSerializerConstructor}
 * or {@link #createEnumSerializerConstructor}.
 * <p>
 * All methods that take a context throw {@link IllegalStateException} if the context is not
 * {@link GenerationContext.State#OPEN open}.
 *
 * @param <C> type of generation context
 * @param <N> type of constructs
 */
public abstract class SerializerBuilder<C extends GenerationContext<N>, N extends Construct> {
	private static final Logger logger = LoggerFactory.getLogger(SerializerBuilder.class);

	/**
	 * Creates a context for a target type
	 *
	 * @param targetType a type a serializer is generated for
	 * @param flavor     a requested flavor, the context reports the one that is actually used
	 */
	public abstract C createContext(Class<?> targetType, EmitterFlavor flavor);

	// region literals
	public abstract N emitIntConstant(C ctx, int value);

	public abstract N emitLongConstant(C ctx, long value);

	public abstract N emitDoubleConstant(C ctx, double value);

	public abstract N emitBooleanConstant(C ctx, boolean value);

	public abstract N emitStringConstant(C ctx, String value);

	public abstract N emitNullConstant(C ctx, Class<?> type);

	/**
	 * Returns a default value of a type: zero, {@code false} or {@code null}
	 */
	public abstract N emitDefaultValue(C ctx, Class<?> type);

	public abstract N emitEnumConstant(C ctx, Enum<?> value);
	// endregion

	// region references
	/**
	 * Returns a reference to the serializer that executes generated code
	 */
	public abstract N emitThisReference(C ctx);

	/**
	 * Declares a local variable, or returns a local already declared in the current scope with the same name
	 */
	public abstract N declareLocal(C ctx, Class<?> type, String name);

	/**
	 * Returns a parameter of the current helper converted to a given type
	 */
	public abstract N referArgument(C ctx, Class<?> type, String name, int index);

	public abstract N emitStoreVariable(C ctx, N variable, N value);
	// endregion

	// region member access
	public abstract N emitGetField(C ctx, @Nullable N instance, Field field);

	public abstract N emitSetField(C ctx, @Nullable N instance, Field field, N value);

	public abstract N emitGetProperty(C ctx, N instance, Method getter);

	public abstract N emitSetProperty(C ctx, N instance, Method setter, N value);

	/**
	 * Invokes a two-parameter method that stores a value by a key, like {@link java.util.Map#put}
	 *
	 * @throws io.binpack.serializer.reflection.UnresolvedMemberException if no method accepts a key and a value of given types
	 * @throws io.binpack.serializer.reflection.AmbiguousMemberException  if several methods accept them
	 */
	public abstract N emitSetIndexedProperty(C ctx, N instance, Class<?> declaringType, String name,
			Class<?> keyType, Class<?> valueType, N key, N value);
	// endregion

	// region control flow
	/**
	 * Returns a conditional, a missing else branch makes it a statement
	 */
	public abstract N emitConditionalExpression(C ctx, N condition, N ifTrue, @Nullable N ifFalse);

	/**
	 * Returns a conditional whose condition is a short-circuit conjunction of given conditions
	 */
	public abstract N emitAndConditionalExpression(C ctx, List<N> conditions, N ifTrue, @Nullable N ifFalse);

	/**
	 * Iterates over the elements of a collection, an array or the entries of a map
	 *
	 * @param body receives the current element and returns a statement
	 */
	public abstract N emitForEachLoop(C ctx, CollectionTraits traits, N collection, Function<N, N> body);

	/**
	 * Evaluates a statement for every index from zero to {@code count} exclusive
	 *
	 * @param body receives the current index and returns a statement
	 */
	public abstract N emitForLoop(C ctx, N count, Function<N, N> body);

	public abstract N emitTryFinally(C ctx, N tryBlock, N finallyBlock);
	// endregion

	// region operators
	/**
	 * Compares primitives by value and references with {@code equals}; comparison with a {@code null} constant is a null check
	 */
	public abstract N emitEqualsExpression(C ctx, N left, N right);

	public abstract N emitNotEqualsExpression(C ctx, N left, N right);

	public abstract N emitGreaterThanExpression(C ctx, N left, N right);

	public abstract N emitLessThanExpression(C ctx, N left, N right);

	public abstract N emitNotExpression(C ctx, N operand);

	public abstract N emitIncrement(C ctx, N variable);
	// endregion

	// region invocation
	public abstract N emitCreateNewObjectExpression(C ctx, Constructor<?> constructor, List<N> arguments);

	/**
	 * Invokes a method; a helper is invoked through its delegate with the serializer as the first argument
	 *
	 * @param instance an owner of an instance method, {@code null} for static methods and helpers
	 */
	public abstract N emitInvokeMethodExpression(C ctx, @Nullable N instance, MethodDefinition method, List<N> arguments);

	/**
	 * Same as {@link #emitInvokeMethodExpression}, the result is discarded
	 */
	public abstract N emitInvokeVoidMethod(C ctx, @Nullable N instance, MethodDefinition method, List<N> arguments);

	/**
	 * Invokes the single abstract method of a functional interface
	 */
	public abstract N emitInvokeDelegateExpression(C ctx, Class<?> delegateType, N delegate, List<N> arguments);
	// endregion

	// region arrays
	public abstract N emitCreateNewArrayExpression(C ctx, Class<?> elementType, N length);

	public abstract N emitCreateNewArrayExpression(C ctx, Class<?> elementType, List<N> initializers);

	public abstract N emitGetArrayElement(C ctx, N array, N index);

	public abstract N emitSetArrayElement(C ctx, N array, N index, N value);
	// endregion

	// region metadata
	public abstract N emitTypeOfExpression(C ctx, Class<?> type);

	public abstract N emitMethodOfExpression(C ctx, Method method);

	public abstract N emitFieldOfExpression(C ctx, Field field);
	// endregion

	// region conversions
	public abstract N emitBoxExpression(C ctx, N value);

	public abstract N emitUnboxExpression(C ctx, N value, Class<?> primitiveType);

	public abstract N emitCast(C ctx, N value, Class<?> type);
	// endregion

	/**
	 * Returns a block of statements evaluated in order, its value is the value of the last statement.
	 * <p>
	 * {@code null} statements are skipped. Locals referenced by the statements become variables of the block.
	 *
	 * @throws SerializerCompilationException if the last statement is not assignable to the result type
	 */
	public abstract N emitSequentialStatements(C ctx, Class<?> resultType, List<@Nullable N> statements);

	// region delegates
	/**
	 * Defines a helper with a body emitted by a function of the helper's parameters.
	 * The first parameter is the serializer, the rest are the parameters of the delegate type.
	 *
	 * @param delegateType a functional interface that the helper implements
	 * @throws SerializerCompilationException if the body cannot be compiled
	 */
	public abstract MethodDefinition defineHelper(C ctx, String name, Class<?> delegateType, Function<List<N>, N> body);

	/**
	 * Returns a delegate of a defined helper, which is either captured by generated code
	 * or looked up from the serializer, as the flavor of the context says
	 */
	public abstract N emitGetPrivateMethodDelegate(C ctx, MethodDefinition helper);

	/**
	 * Returns a delegate of a defined helper captured by generated code
	 */
	public abstract N emitNewPrivateMethodDelegate(C ctx, MethodDefinition helper);

	/**
	 * Returns a delegate that invokes a static method and registers it as a delegate of the serializer under the method's name
	 */
	public abstract N emitGetStaticDelegateExpression(C ctx, Method method);
	// endregion

	// region terminal operations
	/**
	 * Assembles a serializer of an object from the operation lists registered in the context.
	 * <p>
	 * Each operation list is evaluated once. Self-packing targets get no pack operations, self-unpacking targets
	 * get no unpack operations, and tuple-like targets get no named pack operations.
	 *
	 * @throws SerializerCompilationException if the operation lists are missing or inconsistent
	 */
	@SuppressWarnings("unchecked")
	public final <T> SerializerFactory<T> createSerializerConstructor(C ctx, SerializationTarget target, PolymorphismSchema schema) {
		ctx.finish();
		Class<T> targetType = (Class<T>) ctx.getTargetType();
		checkArgument(target.getType() == targetType, "Target %s does not match context of %s", target, targetType.getName());

		List<PackOperation<T>> packOperations = target.isPackable() ?
				List.of() :
				evaluateList(ctx, "initPackOperations", ctx.getPackOperations(), PackOperation.class);
		Map<String, PackOperation<T>> packOperationTable = target.isPackable() || target.isTuple() ?
				Map.of() :
				evaluateTable(ctx, "initPackOperationTable", ctx.getPackOperationTable(), PackOperation.class);
		List<UnpackOperation<T>> unpackOperations = target.isUnpackable() ?
				List.of() :
				evaluateList(ctx, "initUnpackOperations", ctx.getUnpackOperations(), UnpackOperation.class);
		Map<String, UnpackOperation<T>> unpackOperationTable = target.isUnpackable() || target.isTuple() ?
				Map.of() :
				evaluateTable(ctx, "initUnpackOperationTable", ctx.getUnpackOperationTable(), UnpackOperation.class);
		List<String> memberNames = evaluateList(ctx, "initMemberNames", ctx.getMemberNames(), String.class);

		ctx.exposeDelegate(CREATE_UNPACKING_CONTEXT, requireHelper(ctx, CREATE_UNPACKING_CONTEXT, Delegate0.class));
		ctx.exposeDelegate(CREATE_OBJECT_FROM_CONTEXT, requireHelper(ctx, CREATE_OBJECT_FROM_CONTEXT, Delegate1.class));

		List<Object> constants = getConstants(ctx);
		Map<String, Object> delegates = new LinkedHashMap<>(ctx.getDelegates());
		ctx.markCompiled();
		logger.debug("Assembled serializer of {}: {} members, {} constants, {} delegates",
				targetType.getName(), memberNames.size(), constants.size(), delegates.size());

		return context -> new GeneratedObjectSerializer<>(context, targetType, schema,
				packOperations, packOperationTable, unpackOperations, unpackOperationTable,
				memberNames, constants, delegates);
	}

	/**
	 * Assembles a serializer of an enum from the {@code packUnderlyingValueTo} and {@code unpackFromUnderlyingValue} helpers.
	 * <p>
	 * Unlike {@link #createSerializerConstructor}, it takes no schema: an enum has no subtypes to dispatch on,
	 * so its serializers always report {@link PolymorphismSchema#DEFAULT}.
	 *
	 * @throws SerializerCompilationException if a helper is missing
	 */
	@SuppressWarnings("unchecked")
	public final <E extends Enum<E>> SerializerFactory<E> createEnumSerializerConstructor(C ctx) {
		ctx.finish();
		Class<E> targetType = (Class<E>) ctx.getTargetType();
		checkArgument(targetType.isEnum(), "Not an enum: %s", targetType.getName());

		Delegate2 packUnderlyingValueTo = requireHelper(ctx, PACK_UNDERLYING_VALUE_TO, Delegate2.class);
		Delegate1 unpackFromUnderlyingValue = requireHelper(ctx, UNPACK_FROM_UNDERLYING_VALUE, Delegate1.class);

		List<Object> constants = getConstants(ctx);
		Map<String, Object> delegates = new LinkedHashMap<>(ctx.getDelegates());
		ctx.markCompiled();
		logger.debug("Assembled enum serializer of {}", targetType.getName());

		return context -> new GeneratedEnumSerializer<>(context, targetType, PolymorphismSchema.DEFAULT,
				packUnderlyingValueTo, unpackFromUnderlyingValue, constants, delegates);
	}

	/**
	 * Compiles a construct that takes no parameters and returns its value
	 */
	protected abstract Object evaluate(C ctx, String name, N construct);

	/**
	 * Returns constants that generated code loads from the serializer
	 */
	protected abstract List<Object> getConstants(C ctx);
	// endregion

	@SuppressWarnings("unchecked")
	private <E> List<E> evaluateList(C ctx, String name, @Nullable N construct, Class<?> elementType) {
		Object value = evaluate(ctx, name, checkRegistered(ctx, name, construct, List.class));
		List<?> list = (List<?>) value;
		for (Object element : list) {
			if (!elementType.isInstance(element)) {
				throw new SerializerCompilationException(name + " of " + ctx.getTargetType().getName() +
						" contains " + element + ", expected " + elementType.getName());
			}
		}
		return (List<E>) list;
	}

	@SuppressWarnings("unchecked")
	private <E> Map<String, E> evaluateTable(C ctx, String name, @Nullable N construct, Class<?> elementType) {
		Object value = evaluate(ctx, name, checkRegistered(ctx, name, construct, Map.class));
		Map<?, ?> map = (Map<?, ?>) value;
		for (Map.Entry<?, ?> entry : map.entrySet()) {
			if (!(entry.getKey() instanceof String) || !elementType.isInstance(entry.getValue())) {
				throw new SerializerCompilationException(name + " of " + ctx.getTargetType().getName() +
						" contains " + entry + ", expected " + elementType.getName() + " by name");
			}
		}
		return Collections.unmodifiableMap((Map<String, E>) map);
	}

	private N checkRegistered(C ctx, String name, @Nullable N construct, Class<?> expectedType) {
		if (construct == null) {
			throw new SerializerCompilationException(name + " of " + ctx.getTargetType().getName() + " is not registered");
		}
		if (!expectedType.isAssignableFrom(construct.getType())) {
			throw new SerializerCompilationException(name + " of " + ctx.getTargetType().getName() + " has type " +
					construct.getType().getName() + ", expected " + expectedType.getName());
		}
		return construct;
	}

	private static <D> D requireHelper(GenerationContext<?> ctx, String name, Class<D> delegateType) {
		if (!ctx.hasHelper(name)) {
			throw new SerializerCompilationException("Helper " + name + " of " + ctx.getTargetType().getName() + " is not defined");
		}
		Object instance = ctx.getHelperInstance(name);
		if (!delegateType.isInstance(instance)) {
			throw new SerializerCompilationException("Helper " + name + " of " + ctx.getTargetType().getName() +
					" does not implement " + delegateType.getName());
		}
		return delegateType.cast(instance);
	}

	/**
	 * Returns the most specific type both given types are assignable to
	 */
	protected static Class<?> commonType(Class<?> type1, Class<?> type2) {
		if (type1 == type2) return type1;
		if (type1 == void.class || type2 == void.class) return void.class;
		if (type1.isPrimitive() || type2.isPrimitive()) {
			throw new SerializerCompilationException("Types " + type1.getName() + " and " + type2.getName() + " cannot be unified");
		}
		if (type1.isAssignableFrom(type2)) return type1;
		if (type2.isAssignableFrom(type1)) return type2;
		return Object.class;
	}

	protected static boolean isAssignable(Class<?> to, Class<?> from) {
		if (to == void.class) return true;
		if (to.isPrimitive() || from.isPrimitive()) {
			return to == from || !to.isPrimitive() && to.isAssignableFrom(Primitives.wrap(from));
		}
		return to.isAssignableFrom(from);
	}
}
