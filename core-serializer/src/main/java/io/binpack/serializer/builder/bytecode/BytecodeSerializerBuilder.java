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

package io.binpack.serializer.builder.bytecode;

import io.binpack.codegen.container.*;
import io.binpack.codegen.expression.DeclaredLocal;
import io.binpack.codegen.expression.Expression;
import io.binpack.codegen.expression.StoreDef;
import io.binpack.codegen.expression.Variable;
import io.binpack.codegen.util.Primitives;
import io.binpack.serializer.*;
import io.binpack.serializer.builder.SerializerBuilder;
import io.binpack.serializer.builder.SerializerCompilationException;
import io.binpack.serializer.reflection.CollectionTraits;
import io.binpack.serializer.reflection.MethodDefinition;
import io.binpack.serializer.reflection.ReflectionLookup;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.*;
import java.util.function.Function;

import static io.binpack.codegen.expression.Expressions.*;
import static io.binpack.common.Checks.checkArgument;
import static java.util.stream.Collectors.toList;

/**
 * Emits serializers as JVM bytecode.
 * <p>
 * Every helper and every operation list becomes a class defined in a {@link CodeContainer}
 * through an emitter obtained from a {@link CodeContainerManager}.
 * Helpers are compiled as soon as they are defined.
 */
public final class BytecodeSerializerBuilder extends SerializerBuilder<BytecodeGenerationContext, BytecodeConstruct> {
	private static final Logger logger = LoggerFactory.getLogger(BytecodeSerializerBuilder.class);

	private static final Class<?>[] STATIC_DELEGATE_TYPES = {Delegate0.class, Delegate1.class, Delegate2.class, Delegate3.class};

	private final CodeContainerManager manager;
	private final CodeContainerMode containerMode;

	private BytecodeSerializerBuilder(CodeContainerManager manager, CodeContainerMode containerMode) {
		this.manager = manager;
		this.containerMode = containerMode;
	}

	public static BytecodeSerializerBuilder create(CodeContainerManager manager, CodeContainerMode containerMode) {
		return new BytecodeSerializerBuilder(manager, containerMode);
	}

	public static BytecodeSerializerBuilder create() {
		return create(CodeContainerManager.getInstance(), CodeContainerMode.FAST);
	}

	public CodeContainerMode getContainerMode() {
		return containerMode;
	}

	/**
	 * Debuggable containers are persisted, so generated code looks reflection handles up by name
	 */
	private boolean isDumpMode() {
		return containerMode == CodeContainerMode.DEBUGGABLE;
	}

	/**
	 * @throws PlatformUnsupportedException if the platform does not allow dynamic code
	 */
	@Override
	public BytecodeGenerationContext createContext(Class<?> targetType, EmitterFlavor flavor) {
		SerializerEmitter emitter = manager.createEmitter(containerMode, targetType, flavor);
		return new BytecodeGenerationContext(emitter);
	}

	// region literals
	@Override
	public BytecodeConstruct emitIntConstant(BytecodeGenerationContext ctx, int value) {
		ctx.checkOpen();
		return BytecodeConstruct.of(value(value), int.class);
	}

	@Override
	public BytecodeConstruct emitLongConstant(BytecodeGenerationContext ctx, long value) {
		ctx.checkOpen();
		return BytecodeConstruct.of(value(value), long.class);
	}

	@Override
	public BytecodeConstruct emitDoubleConstant(BytecodeGenerationContext ctx, double value) {
		ctx.checkOpen();
		return BytecodeConstruct.of(value(value), double.class);
	}

	@Override
	public BytecodeConstruct emitBooleanConstant(BytecodeGenerationContext ctx, boolean value) {
		ctx.checkOpen();
		return BytecodeConstruct.of(value(value), boolean.class);
	}

	@Override
	public BytecodeConstruct emitStringConstant(BytecodeGenerationContext ctx, String value) {
		ctx.checkOpen();
		return BytecodeConstruct.of(value(value), String.class);
	}

	@Override
	public BytecodeConstruct emitNullConstant(BytecodeGenerationContext ctx, Class<?> type) {
		ctx.checkOpen();
		checkArgument(!type.isPrimitive(), "Primitive %s cannot be null", type);
		return BytecodeConstruct.ofNull(nullRef(type), type);
	}

	@Override
	public BytecodeConstruct emitDefaultValue(BytecodeGenerationContext ctx, Class<?> type) {
		ctx.checkOpen();
		if (!type.isPrimitive()) {
			return emitNullConstant(ctx, type);
		}
		return BytecodeConstruct.of(value(Primitives.defaultValue(type), type), type);
	}

	@Override
	public BytecodeConstruct emitEnumConstant(BytecodeGenerationContext ctx, Enum<?> value) {
		ctx.checkOpen();
		return BytecodeConstruct.of(value(value), value.getDeclaringClass());
	}
	// endregion

	// region references
	@Override
	public BytecodeConstruct emitThisReference(BytecodeGenerationContext ctx) {
		ctx.checkOpen();
		BytecodeConstruct self = ctx.getParameter(0);
		return BytecodeConstruct.of(cast(self.getExpression(), GeneratedSerializer.class), GeneratedSerializer.class);
	}

	@Override
	public BytecodeConstruct declareLocal(BytecodeGenerationContext ctx, Class<?> type, String name) {
		ctx.checkOpen();
		BytecodeConstruct existing = ctx.getLocal(name);
		if (existing != null) {
			checkArgument(existing.getType() == type, "Local %s is already declared as %s", name, existing.getType().getName());
			return existing;
		}
		BytecodeConstruct local = BytecodeConstruct.ofLocal(declaredLocal(type, name));
		ctx.putLocal(name, local);
		return local;
	}

	@Override
	public BytecodeConstruct referArgument(BytecodeGenerationContext ctx, Class<?> type, String name, int index) {
		ctx.checkOpen();
		BytecodeConstruct parameter = ctx.getParameter(index);
		if (parameter.getType() == type) return parameter;
		return BytecodeConstruct.of(cast(parameter.getExpression(), type), type);
	}

	@Override
	public BytecodeConstruct emitStoreVariable(BytecodeGenerationContext ctx, BytecodeConstruct variable, BytecodeConstruct value) {
		ctx.checkOpen();
		checkArgument(variable.getExpression() instanceof StoreDef, "Cannot assign to %s", variable);
		Expression assignment = set((StoreDef) variable.getExpression(), convert(value, variable.getType()));
		return variable.getLocal() != null ?
				BytecodeConstruct.ofAssignment(assignment, variable.getLocal()) :
				BytecodeConstruct.of(assignment, void.class);
	}
	// endregion

	// region member access
	@Override
	public BytecodeConstruct emitGetField(BytecodeGenerationContext ctx, @Nullable BytecodeConstruct instance, Field field) {
		ctx.checkOpen();
		return BytecodeConstruct.of(field(instance != null ? instance.getExpression() : null, field), field.getType());
	}

	@Override
	public BytecodeConstruct emitSetField(BytecodeGenerationContext ctx, @Nullable BytecodeConstruct instance, Field field,
			BytecodeConstruct value) {
		ctx.checkOpen();
		Variable target = field(instance != null ? instance.getExpression() : null, field);
		return BytecodeConstruct.of(set(target, convert(value, field.getType())), void.class);
	}

	@Override
	public BytecodeConstruct emitGetProperty(BytecodeGenerationContext ctx, BytecodeConstruct instance, Method getter) {
		return emitInvokeMethodExpression(ctx, instance, MethodDefinition.of(getter), List.of());
	}

	@Override
	public BytecodeConstruct emitSetProperty(BytecodeGenerationContext ctx, BytecodeConstruct instance, Method setter,
			BytecodeConstruct value) {
		return emitInvokeVoidMethod(ctx, instance, MethodDefinition.of(setter), List.of(value));
	}

	@Override
	public BytecodeConstruct emitSetIndexedProperty(BytecodeGenerationContext ctx, BytecodeConstruct instance, Class<?> declaringType,
			String name, Class<?> keyType, Class<?> valueType, BytecodeConstruct key, BytecodeConstruct value) {
		ctx.checkOpen();
		MethodDefinition method = MethodDefinition.resolveIndexed(declaringType, name, keyType, valueType);
		return emitInvokeVoidMethod(ctx, instance, method, List.of(key, value));
	}
	// endregion

	// region control flow
	@Override
	public BytecodeConstruct emitConditionalExpression(BytecodeGenerationContext ctx, BytecodeConstruct condition,
			BytecodeConstruct ifTrue, @Nullable BytecodeConstruct ifFalse) {
		ctx.checkOpen();
		Expression test = convert(condition, boolean.class);
		if (ifFalse == null) {
			return BytecodeConstruct.of(ifElse(test, convert(ifTrue, void.class), voidExp()), void.class);
		}
		Class<?> type = commonType(ifTrue.getType(), ifFalse.getType());
		return BytecodeConstruct.of(ifElse(test, convert(ifTrue, type), convert(ifFalse, type)), type);
	}

	@Override
	public BytecodeConstruct emitAndConditionalExpression(BytecodeGenerationContext ctx, List<BytecodeConstruct> conditions,
			BytecodeConstruct ifTrue, @Nullable BytecodeConstruct ifFalse) {
		ctx.checkOpen();
		checkArgument(!conditions.isEmpty(), "No conditions");
		Expression test = and(conditions.stream().map(c -> convert(c, boolean.class)).collect(toList()));
		return emitConditionalExpression(ctx, BytecodeConstruct.of(test, boolean.class), ifTrue, ifFalse);
	}

	@Override
	public BytecodeConstruct emitForEachLoop(BytecodeGenerationContext ctx, CollectionTraits traits, BytecodeConstruct collection,
			Function<BytecodeConstruct, BytecodeConstruct> body) {
		ctx.checkOpen();
		DeclaredLocal current = declaredLocal(traits.getElementType(), ctx.newLocalName("current"));
		Expression statement = convert(body.apply(BytecodeConstruct.ofLocal(current)), void.class);

		switch (traits.getKind()) {
			case ARRAY -> {
				DeclaredLocal array = declaredLocal(traits.getCollectionType(), ctx.newLocalName("array"));
				return BytecodeConstruct.of(block(List.of(array, current), List.of(
								set(array, convert(collection, traits.getCollectionType())),
								iterate(length(array), index -> sequence(
										set(current, arrayGet(array, index)),
										statement)))),
						void.class);
			}
			case ITERABLE, MAP -> {
				Expression source = collection.getExpression();
				Method entrySet = traits.getEntrySetMethod();
				if (entrySet != null) {
					source = invoke(source, entrySet, List.of());
				}
				DeclaredLocal iterator = declaredLocal(Iterator.class, ctx.newLocalName("iterator"));
				return BytecodeConstruct.of(block(List.of(iterator, current), List.of(
								set(iterator, invoke(source, traits.getIteratorMethod(), List.of())),
								loop(invoke(iterator, traits.getHasNextMethod(), List.of()), sequence(
										set(current, cast(invoke(iterator, traits.getNextMethod(), List.of()), traits.getElementType())),
										statement)))),
						void.class);
			}
			default -> throw new IllegalArgumentException("Not a collection: " + collection.getType().getName());
		}
	}

	@Override
	public BytecodeConstruct emitForLoop(BytecodeGenerationContext ctx, BytecodeConstruct count,
			Function<BytecodeConstruct, BytecodeConstruct> body) {
		ctx.checkOpen();
		DeclaredLocal index = declaredLocal(int.class, ctx.newLocalName("index"));
		DeclaredLocal limit = declaredLocal(int.class, ctx.newLocalName("count"));
		Expression statement = convert(body.apply(BytecodeConstruct.ofLocal(index)), void.class);
		return BytecodeConstruct.of(block(List.of(index, limit), List.of(
						set(limit, convert(count, int.class)),
						loop(isLt(index, limit), sequence(statement, increment(index))))),
				void.class);
	}

	@Override
	public BytecodeConstruct emitTryFinally(BytecodeGenerationContext ctx, BytecodeConstruct tryBlock, BytecodeConstruct finallyBlock) {
		ctx.checkOpen();
		return BytecodeConstruct.of(tryFinally(tryBlock.getExpression(), finallyBlock.getExpression()), tryBlock.getType());
	}
	// endregion

	// region operators
	@Override
	public BytecodeConstruct emitEqualsExpression(BytecodeGenerationContext ctx, BytecodeConstruct left, BytecodeConstruct right) {
		ctx.checkOpen();
		if (right.isNullConstant()) return BytecodeConstruct.of(isNull(left.getExpression()), boolean.class);
		if (left.isNullConstant()) return BytecodeConstruct.of(isNull(right.getExpression()), boolean.class);
		Class<?> type = operandType(left, right);
		return BytecodeConstruct.of(isEq(convert(left, type), convert(right, type)), boolean.class);
	}

	@Override
	public BytecodeConstruct emitNotEqualsExpression(BytecodeGenerationContext ctx, BytecodeConstruct left, BytecodeConstruct right) {
		ctx.checkOpen();
		if (right.isNullConstant()) return BytecodeConstruct.of(not(isNull(left.getExpression())), boolean.class);
		if (left.isNullConstant()) return BytecodeConstruct.of(not(isNull(right.getExpression())), boolean.class);
		Class<?> type = operandType(left, right);
		return BytecodeConstruct.of(isNe(convert(left, type), convert(right, type)), boolean.class);
	}

	@Override
	public BytecodeConstruct emitGreaterThanExpression(BytecodeGenerationContext ctx, BytecodeConstruct left, BytecodeConstruct right) {
		ctx.checkOpen();
		Class<?> type = operandType(left, right);
		return BytecodeConstruct.of(isGt(convert(left, type), convert(right, type)), boolean.class);
	}

	@Override
	public BytecodeConstruct emitLessThanExpression(BytecodeGenerationContext ctx, BytecodeConstruct left, BytecodeConstruct right) {
		ctx.checkOpen();
		Class<?> type = operandType(left, right);
		return BytecodeConstruct.of(isLt(convert(left, type), convert(right, type)), boolean.class);
	}

	@Override
	public BytecodeConstruct emitNotExpression(BytecodeGenerationContext ctx, BytecodeConstruct operand) {
		ctx.checkOpen();
		return BytecodeConstruct.of(not(convert(operand, boolean.class)), boolean.class);
	}

	@Override
	public BytecodeConstruct emitIncrement(BytecodeGenerationContext ctx, BytecodeConstruct variable) {
		ctx.checkOpen();
		checkArgument(variable.getExpression() instanceof Variable, "Cannot increment %s", variable);
		return BytecodeConstruct.of(increment((Variable) variable.getExpression()), void.class);
	}
	// endregion

	// region invocation
	@Override
	public BytecodeConstruct emitCreateNewObjectExpression(BytecodeGenerationContext ctx, Constructor<?> constructor,
			List<BytecodeConstruct> arguments) {
		ctx.checkOpen();
		return BytecodeConstruct.of(constructor(constructor, expressions(arguments)), constructor.getDeclaringClass());
	}

	@Override
	public BytecodeConstruct emitInvokeMethodExpression(BytecodeGenerationContext ctx, @Nullable BytecodeConstruct instance,
			MethodDefinition method, List<BytecodeConstruct> arguments) {
		ctx.checkOpen();
		if (method.isHelper()) {
			List<BytecodeConstruct> delegateArguments = new ArrayList<>();
			delegateArguments.add(emitThisReference(ctx));
			delegateArguments.addAll(arguments);
			return emitInvokeDelegateExpression(ctx, method.getDelegateType(),
					emitGetPrivateMethodDelegate(ctx, method), delegateArguments);
		}
		checkArgument((instance == null) == method.isStatic(), "Instance must be given for instance methods only: %s", method);
		Method runtimeMethod = method.getMethod();
		return BytecodeConstruct.of(
				invoke(instance != null ? instance.getExpression() : null, runtimeMethod, expressions(arguments)),
				runtimeMethod.getReturnType());
	}

	@Override
	public BytecodeConstruct emitInvokeVoidMethod(BytecodeGenerationContext ctx, @Nullable BytecodeConstruct instance,
			MethodDefinition method, List<BytecodeConstruct> arguments) {
		BytecodeConstruct call = emitInvokeMethodExpression(ctx, instance, method, arguments);
		return BytecodeConstruct.of(convert(call, void.class), void.class);
	}

	@Override
	public BytecodeConstruct emitInvokeDelegateExpression(BytecodeGenerationContext ctx, Class<?> delegateType,
			BytecodeConstruct delegate, List<BytecodeConstruct> arguments) {
		ctx.checkOpen();
		Method method = MethodDefinition.findAbstractMethod(delegateType);
		return BytecodeConstruct.of(
				invoke(convert(delegate, delegateType), method, expressions(arguments)),
				method.getReturnType());
	}
	// endregion

	// region arrays
	@Override
	public BytecodeConstruct emitCreateNewArrayExpression(BytecodeGenerationContext ctx, Class<?> elementType, BytecodeConstruct length) {
		ctx.checkOpen();
		Class<?> arrayType = elementType.arrayType();
		return BytecodeConstruct.of(arrayNew(arrayType, convert(length, int.class)), arrayType);
	}

	@Override
	public BytecodeConstruct emitCreateNewArrayExpression(BytecodeGenerationContext ctx, Class<?> elementType,
			List<BytecodeConstruct> initializers) {
		ctx.checkOpen();
		Class<?> arrayType = elementType.arrayType();
		List<Expression> elements = initializers.stream().map(i -> convert(i, elementType)).collect(toList());
		return BytecodeConstruct.of(arrayNewInit(arrayType, elements), arrayType);
	}

	@Override
	public BytecodeConstruct emitGetArrayElement(BytecodeGenerationContext ctx, BytecodeConstruct array, BytecodeConstruct index) {
		ctx.checkOpen();
		checkArgument(array.getType().isArray(), "Not an array: %s", array);
		return BytecodeConstruct.of(arrayGet(array.getExpression(), convert(index, int.class)), array.getType().getComponentType());
	}

	@Override
	public BytecodeConstruct emitSetArrayElement(BytecodeGenerationContext ctx, BytecodeConstruct array, BytecodeConstruct index,
			BytecodeConstruct value) {
		ctx.checkOpen();
		checkArgument(array.getType().isArray(), "Not an array: %s", array);
		return BytecodeConstruct.of(
				arraySet(array.getExpression(), convert(index, int.class), convert(value, array.getType().getComponentType())),
				void.class);
	}
	// endregion

	// region metadata
	@Override
	public BytecodeConstruct emitTypeOfExpression(BytecodeGenerationContext ctx, Class<?> type) {
		ctx.checkOpen();
		if (type.isPrimitive()) {
			try {
				return BytecodeConstruct.of(field(null, Primitives.wrap(type).getField("TYPE")), Class.class);
			} catch (NoSuchFieldException e) {
				throw new AssertionError(e);
			}
		}
		if (isDumpMode()) {
			return BytecodeConstruct.of(staticCall(ReflectionLookup.class, "type", value(type.getName())), Class.class);
		}
		return BytecodeConstruct.of(value(type), Class.class);
	}

	@Override
	public BytecodeConstruct emitMethodOfExpression(BytecodeGenerationContext ctx, Method method) {
		ctx.checkOpen();
		if (isDumpMode()) {
			List<Expression> parameterTypes = Arrays.stream(method.getParameterTypes())
					.map(type -> (Expression) value(type.getName()))
					.collect(toList());
			return BytecodeConstruct.of(staticCall(ReflectionLookup.class, "method",
					value(method.getDeclaringClass().getName()),
					value(method.getName()),
					arrayNewInit(String[].class, parameterTypes)), Method.class);
		}
		return BytecodeConstruct.of(ctx.getEmitter().constant(method, Method.class), Method.class);
	}

	@Override
	public BytecodeConstruct emitFieldOfExpression(BytecodeGenerationContext ctx, Field field) {
		ctx.checkOpen();
		if (isDumpMode()) {
			return BytecodeConstruct.of(staticCall(ReflectionLookup.class, "field",
					value(field.getDeclaringClass().getName()),
					value(field.getName())), Field.class);
		}
		return BytecodeConstruct.of(ctx.getEmitter().constant(field, Field.class), Field.class);
	}
	// endregion

	// region conversions
	@Override
	public BytecodeConstruct emitBoxExpression(BytecodeGenerationContext ctx, BytecodeConstruct value) {
		ctx.checkOpen();
		checkArgument(value.getType().isPrimitive(), "Not a primitive: %s", value);
		Class<?> wrapperType = Primitives.wrap(value.getType());
		return BytecodeConstruct.of(cast(value.getExpression(), wrapperType), wrapperType);
	}

	@Override
	public BytecodeConstruct emitUnboxExpression(BytecodeGenerationContext ctx, BytecodeConstruct value, Class<?> primitiveType) {
		ctx.checkOpen();
		checkArgument(primitiveType.isPrimitive(), "Not a primitive: %s", primitiveType);
		return BytecodeConstruct.of(cast(value.getExpression(), primitiveType), primitiveType);
	}

	@Override
	public BytecodeConstruct emitCast(BytecodeGenerationContext ctx, BytecodeConstruct value, Class<?> type) {
		ctx.checkOpen();
		if (value.getType() == type) return value;
		return BytecodeConstruct.of(cast(value.getExpression(), type), type);
	}
	// endregion

	@Override
	public BytecodeConstruct emitSequentialStatements(BytecodeGenerationContext ctx, Class<?> resultType,
			List<@Nullable BytecodeConstruct> statements) {
		ctx.checkOpen();
		List<BytecodeConstruct> nonNull = statements.stream().filter(Objects::nonNull).collect(toList());
		if (nonNull.isEmpty()) {
			if (resultType != void.class) {
				throw new SerializerCompilationException("Empty block cannot produce " + resultType.getName());
			}
			return BytecodeConstruct.of(voidExp(), void.class);
		}

		Set<DeclaredLocal> variables = new LinkedHashSet<>();
		List<Expression> parts = new ArrayList<>();
		for (int i = 0; i < nonNull.size(); i++) {
			BytecodeConstruct statement = nonNull.get(i);
			boolean last = i == nonNull.size() - 1;
			if (statement.getLocal() != null) {
				variables.add(statement.getLocal());
				if (!last) continue;
			}
			if (statement.getAssignedLocal() != null) {
				variables.add(statement.getAssignedLocal());
			}
			parts.add(last ? null : statement.getExpression());
		}

		BytecodeConstruct result = nonNull.get(nonNull.size() - 1);
		if (!isAssignable(resultType, result.getType())) {
			throw new SerializerCompilationException("Block of type " + resultType.getName() +
					" ends with a statement of type " + result.getType().getName());
		}
		parts.set(parts.size() - 1, convert(result, resultType));
		return BytecodeConstruct.of(block(List.copyOf(variables), parts), resultType);
	}

	// region delegates
	@Override
	public MethodDefinition defineHelper(BytecodeGenerationContext ctx, String name, Class<?> delegateType,
			Function<List<BytecodeConstruct>, BytecodeConstruct> body) {
		ctx.checkOpen();
		checkArgument(!ctx.hasHelper(name), "Helper %s is already defined", name);
		MethodDefinition definition = MethodDefinition.helper(name, delegateType);
		Method method = MethodDefinition.findAbstractMethod(delegateType);

		Class<?>[] parameterTypes = method.getParameterTypes();
		List<BytecodeConstruct> parameters = new ArrayList<>();
		for (int i = 0; i < parameterTypes.length; i++) {
			parameters.add(BytecodeConstruct.of(arg(i), parameterTypes[i]));
		}

		Expression expression = ctx.withinScope(parameters, () -> {
			BytecodeConstruct result = body.apply(parameters);
			List<DeclaredLocal> locals = ctx.getLocals().stream()
					.map(BytecodeConstruct::getLocal)
					.collect(toList());
			return block(locals, List.of(returnValue(result, method.getReturnType())));
		});

		Object instance = defineOperation(ctx, name, delegateType, expression);
		ctx.registerHelper(definition, instance);
		return definition;
	}

	@Override
	public BytecodeConstruct emitGetPrivateMethodDelegate(BytecodeGenerationContext ctx, MethodDefinition helper) {
		ctx.checkOpen();
		Object instance = ctx.getHelperInstance(helper.getName());
		if (ctx.getFlavor() == EmitterFlavor.FIELD_BASED) {
			return BytecodeConstruct.of(ctx.getEmitter().constant(instance, helper.getDelegateType()), helper.getDelegateType());
		}
		ctx.exposeDelegate(helper.getName(), instance);
		return lookupDelegate(ctx, helper.getName(), helper.getDelegateType());
	}

	@Override
	public BytecodeConstruct emitNewPrivateMethodDelegate(BytecodeGenerationContext ctx, MethodDefinition helper) {
		ctx.checkOpen();
		Object instance = ctx.getHelperInstance(helper.getName());
		return BytecodeConstruct.of(ctx.getEmitter().constant(instance, helper.getDelegateType()), helper.getDelegateType());
	}

	@Override
	public BytecodeConstruct emitGetStaticDelegateExpression(BytecodeGenerationContext ctx, Method method) {
		ctx.checkOpen();
		checkArgument(Modifier.isStatic(method.getModifiers()), "Not a static method: %s", method);
		checkArgument(method.getParameterCount() < STATIC_DELEGATE_TYPES.length, "Too many parameters: %s", method);
		Class<?> delegateType = STATIC_DELEGATE_TYPES[method.getParameterCount()];
		String name = method.getName();

		Object instance = ctx.getExposedDelegate(name);
		if (instance == null) {
			Class<?>[] parameterTypes = method.getParameterTypes();
			List<Expression> arguments = new ArrayList<>();
			for (int i = 0; i < parameterTypes.length; i++) {
				arguments.add(cast(arg(i + 1), parameterTypes[i]));
			}
			BytecodeConstruct call = BytecodeConstruct.of(invoke(null, method, arguments), method.getReturnType());
			instance = defineOperation(ctx, "static$" + name, delegateType, returnValue(call, Object.class));
			ctx.exposeDelegate(name, instance);
		}
		checkArgument(delegateType.isInstance(instance), "Delegate %s is not a static delegate of %s", name, method);

		if (ctx.getFlavor() == EmitterFlavor.FIELD_BASED) {
			return BytecodeConstruct.of(ctx.getEmitter().constant(instance, delegateType), delegateType);
		}
		return lookupDelegate(ctx, name, delegateType);
	}
	// endregion

	@Override
	protected Object evaluate(BytecodeGenerationContext ctx, String name, BytecodeConstruct construct) {
		Delegate0 delegate = defineOperation(ctx, name, Delegate0.class, returnValue(construct, Object.class));
		return delegate.invoke(ctx.getConstantTable());
	}

	@Override
	protected List<Object> getConstants(BytecodeGenerationContext ctx) {
		ConstantTable constants = ctx.getConstantTable();
		return constants != null ? constants.toList() : List.of();
	}

	private static <F> F defineOperation(BytecodeGenerationContext ctx, String name, Class<F> functionalInterface, Expression body) {
		try {
			return ctx.getEmitter().defineOperation(name, functionalInterface, body);
		} catch (IllegalArgumentException | IllegalStateException e) {
			throw new SerializerCompilationException("Could not compile " + name + " of " + ctx.getTargetType().getName(), e);
		} finally {
			logger.trace("Compiled {} of {}", name, ctx.getEmitter());
		}
	}

	private static BytecodeConstruct lookupDelegate(BytecodeGenerationContext ctx, String name, Class<?> delegateType) {
		Expression self = ctx.getParameter(0).getExpression();
		return BytecodeConstruct.of(
				cast(call(cast(self, DelegateTable.class), "getDelegate", value(name)), delegateType),
				delegateType);
	}

	private static Expression returnValue(BytecodeConstruct result, Class<?> returnType) {
		if (returnType != void.class && result.getType() == void.class) {
			return sequence(result.getExpression(), nullRef(Object.class));
		}
		return convert(result, returnType);
	}

	private static Expression convert(BytecodeConstruct construct, Class<?> type) {
		if (type == void.class) {
			return construct.getType() == void.class ?
					construct.getExpression() :
					sequence(construct.getExpression(), voidExp());
		}
		if (construct.getType() == type) {
			return construct.getExpression();
		}
		return cast(construct.getExpression(), type);
	}

	private static Class<?> operandType(BytecodeConstruct left, BytecodeConstruct right) {
		if (left.getType().isPrimitive()) return left.getType();
		if (right.getType().isPrimitive()) return right.getType();
		return left.getType();
	}

	private static List<Expression> expressions(List<BytecodeConstruct> constructs) {
		return constructs.stream().map(BytecodeConstruct::getExpression).collect(toList());
	}

	@Override
	public String toString() {
		return "BytecodeSerializerBuilder{containerMode=" + containerMode + '}';
	}
}
