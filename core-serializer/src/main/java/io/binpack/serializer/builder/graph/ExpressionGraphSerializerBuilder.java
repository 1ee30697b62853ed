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

package io.binpack.serializer.builder.graph;

import io.binpack.codegen.container.EmitterFlavor;
import io.binpack.codegen.util.Primitives;
import io.binpack.serializer.*;
import io.binpack.serializer.builder.SerializerBuilder;
import io.binpack.serializer.builder.SerializerCompilationException;
import io.binpack.serializer.graph.*;
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

import static io.binpack.common.Checks.checkArgument;
import static io.binpack.serializer.graph.CompareNode.Operation.*;
import static io.binpack.serializer.graph.Nodes.*;
import static java.util.stream.Collectors.toList;

/**
 * Builds serializers as expression graphs compiled by {@link GraphCompiler}.
 * <p>
 * Generated code is never defined as classes, so this builder works on platforms
 * without dynamic code. Serializers built here behave exactly like the ones built as bytecode.
 */
public final class ExpressionGraphSerializerBuilder extends SerializerBuilder<GraphGenerationContext, Node> {
	private static final Logger logger = LoggerFactory.getLogger(ExpressionGraphSerializerBuilder.class);

	private static final Method LOOKUP_TYPE = lookupMethod("type", String.class);
	private static final Method LOOKUP_METHOD = lookupMethod("method", String.class, String.class, String[].class);
	private static final Method LOOKUP_FIELD = lookupMethod("field", String.class, String.class);
	private static final Method GET_DELEGATE = findMethod(DelegateTable.class, "getDelegate", String.class);

	private static final Class<?>[] STATIC_DELEGATE_TYPES = {Delegate0.class, Delegate1.class, Delegate2.class, Delegate3.class};

	private final boolean dumpMode;

	private ExpressionGraphSerializerBuilder(boolean dumpMode) {
		this.dumpMode = dumpMode;
	}

	public static ExpressionGraphSerializerBuilder create() {
		return new ExpressionGraphSerializerBuilder(false);
	}

	/**
	 * @param dumpMode whether reflection handles are looked up by name instead of being bound into graphs
	 */
	public static ExpressionGraphSerializerBuilder create(boolean dumpMode) {
		return new ExpressionGraphSerializerBuilder(dumpMode);
	}

	public boolean isDumpMode() {
		return dumpMode;
	}

	@Override
	public GraphGenerationContext createContext(Class<?> targetType, EmitterFlavor flavor) {
		return new GraphGenerationContext(targetType, flavor);
	}

	// region literals
	@Override
	public Node emitIntConstant(GraphGenerationContext ctx, int value) {
		ctx.checkOpen();
		return constant(value, int.class);
	}

	@Override
	public Node emitLongConstant(GraphGenerationContext ctx, long value) {
		ctx.checkOpen();
		return constant(value, long.class);
	}

	@Override
	public Node emitDoubleConstant(GraphGenerationContext ctx, double value) {
		ctx.checkOpen();
		return constant(value, double.class);
	}

	@Override
	public Node emitBooleanConstant(GraphGenerationContext ctx, boolean value) {
		ctx.checkOpen();
		return constant(value, boolean.class);
	}

	@Override
	public Node emitStringConstant(GraphGenerationContext ctx, String value) {
		ctx.checkOpen();
		return constant(value, String.class);
	}

	@Override
	public Node emitNullConstant(GraphGenerationContext ctx, Class<?> type) {
		ctx.checkOpen();
		checkArgument(!type.isPrimitive(), "Primitive %s cannot be null", type);
		return constant(null, type);
	}

	@Override
	public Node emitDefaultValue(GraphGenerationContext ctx, Class<?> type) {
		ctx.checkOpen();
		return constant(Primitives.defaultValue(type), type);
	}

	@Override
	public Node emitEnumConstant(GraphGenerationContext ctx, Enum<?> value) {
		ctx.checkOpen();
		return constant(value, value.getDeclaringClass());
	}
	// endregion

	// region references
	@Override
	public Node emitThisReference(GraphGenerationContext ctx) {
		ctx.checkOpen();
		return convert(ctx.getParameter(0), GeneratedSerializer.class);
	}

	@Override
	public Node declareLocal(GraphGenerationContext ctx, Class<?> type, String name) {
		ctx.checkOpen();
		Node existing = ctx.getLocal(name);
		if (existing != null) {
			checkArgument(existing.getType() == type, "Local %s is already declared as %s", name, existing.getType().getName());
			return existing;
		}
		VariableNode local = variable(type, name);
		ctx.putLocal(name, local);
		return local;
	}

	@Override
	public Node referArgument(GraphGenerationContext ctx, Class<?> type, String name, int index) {
		ctx.checkOpen();
		return convert(ctx.getParameter(index), type);
	}

	@Override
	public Node emitStoreVariable(GraphGenerationContext ctx, Node variable, Node value) {
		ctx.checkOpen();
		checkArgument(variable instanceof VariableNode, "Cannot assign to %s", variable);
		return assign((VariableNode) variable, convert(value, variable.getType()));
	}
	// endregion

	// region member access
	@Override
	public Node emitGetField(GraphGenerationContext ctx, @Nullable Node instance, Field field) {
		ctx.checkOpen();
		return field(instance, field);
	}

	@Override
	public Node emitSetField(GraphGenerationContext ctx, @Nullable Node instance, Field field, Node value) {
		ctx.checkOpen();
		return assignField(instance, field, value);
	}

	@Override
	public Node emitGetProperty(GraphGenerationContext ctx, Node instance, Method getter) {
		return emitInvokeMethodExpression(ctx, instance, MethodDefinition.of(getter), List.of());
	}

	@Override
	public Node emitSetProperty(GraphGenerationContext ctx, Node instance, Method setter, Node value) {
		return emitInvokeVoidMethod(ctx, instance, MethodDefinition.of(setter), List.of(value));
	}

	@Override
	public Node emitSetIndexedProperty(GraphGenerationContext ctx, Node instance, Class<?> declaringType, String name,
			Class<?> keyType, Class<?> valueType, Node key, Node value) {
		ctx.checkOpen();
		MethodDefinition method = MethodDefinition.resolveIndexed(declaringType, name, keyType, valueType);
		return emitInvokeVoidMethod(ctx, instance, method, List.of(key, value));
	}
	// endregion

	// region control flow
	@Override
	public Node emitConditionalExpression(GraphGenerationContext ctx, Node condition, Node ifTrue, @Nullable Node ifFalse) {
		ctx.checkOpen();
		Node test = convert(condition, boolean.class);
		if (ifFalse == null) {
			return condition(test, ifTrue, empty(), void.class);
		}
		return condition(test, ifTrue, ifFalse, commonType(ifTrue.getType(), ifFalse.getType()));
	}

	@Override
	public Node emitAndConditionalExpression(GraphGenerationContext ctx, List<Node> conditions, Node ifTrue, @Nullable Node ifFalse) {
		ctx.checkOpen();
		Node test = andAlso(conditions.stream().map(c -> convert(c, boolean.class)).collect(toList()));
		return emitConditionalExpression(ctx, test, ifTrue, ifFalse);
	}

	/**
	 * Lowers to a loop that tests for the next element, binds it and evaluates the body, or breaks
	 */
	@Override
	public Node emitForEachLoop(GraphGenerationContext ctx, CollectionTraits traits, Node collection, Function<Node, Node> body) {
		ctx.checkOpen();
		VariableNode current = variable(traits.getElementType(), ctx.newLocalName("current"));
		Node statement = convert(body.apply(current), void.class);
		BreakLabel label = label(ctx.newLocalName("forEach"));

		switch (traits.getKind()) {
			case ARRAY -> {
				VariableNode array = variable(traits.getCollectionType(), ctx.newLocalName("array"));
				VariableNode index = variable(int.class, ctx.newLocalName("index"));
				return block(List.of(array, index, current), List.of(
						assign(array, convert(collection, traits.getCollectionType())),
						loop(condition(compare(LT, index, arrayLength(array)),
								block(List.of(), List.of(
										assign(current, arrayIndex(array, index)),
										statement,
										increment(index)), void.class),
								breakLoop(label), void.class), label)), void.class);
			}
			case ITERABLE, MAP -> {
				Node source = collection;
				Method entrySet = traits.getEntrySetMethod();
				if (entrySet != null) {
					source = call(convert(source, entrySet.getDeclaringClass()), entrySet, List.of());
				}
				Method iteratorMethod = traits.getIteratorMethod();
				VariableNode iterator = variable(Iterator.class, ctx.newLocalName("iterator"));
				return block(List.of(iterator, current), List.of(
						assign(iterator, call(convert(source, iteratorMethod.getDeclaringClass()), iteratorMethod, List.of())),
						loop(condition(call(iterator, traits.getHasNextMethod(), List.of()),
								block(List.of(), List.of(
										assign(current, convert(call(iterator, traits.getNextMethod(), List.of()), traits.getElementType())),
										statement), void.class),
								breakLoop(label), void.class), label)), void.class);
			}
			default -> throw new IllegalArgumentException("Not a collection: " + collection.getType().getName());
		}
	}

	@Override
	public Node emitForLoop(GraphGenerationContext ctx, Node count, Function<Node, Node> body) {
		ctx.checkOpen();
		VariableNode index = variable(int.class, ctx.newLocalName("index"));
		VariableNode limit = variable(int.class, ctx.newLocalName("count"));
		Node statement = convert(body.apply(index), void.class);
		BreakLabel label = label(ctx.newLocalName("for"));
		return block(List.of(index, limit), List.of(
				assign(limit, convert(count, int.class)),
				loop(condition(compare(LT, index, limit),
						block(List.of(), List.of(statement, increment(index)), void.class),
						breakLoop(label), void.class), label)), void.class);
	}

	@Override
	public Node emitTryFinally(GraphGenerationContext ctx, Node tryBlock, Node finallyBlock) {
		ctx.checkOpen();
		return tryFinally(tryBlock, finallyBlock);
	}
	// endregion

	// region operators
	@Override
	public Node emitEqualsExpression(GraphGenerationContext ctx, Node left, Node right) {
		ctx.checkOpen();
		return compareOperands(EQ, left, right);
	}

	@Override
	public Node emitNotEqualsExpression(GraphGenerationContext ctx, Node left, Node right) {
		ctx.checkOpen();
		return compareOperands(NE, left, right);
	}

	@Override
	public Node emitGreaterThanExpression(GraphGenerationContext ctx, Node left, Node right) {
		ctx.checkOpen();
		return compareOperands(GT, left, right);
	}

	@Override
	public Node emitLessThanExpression(GraphGenerationContext ctx, Node left, Node right) {
		ctx.checkOpen();
		return compareOperands(LT, left, right);
	}

	@Override
	public Node emitNotExpression(GraphGenerationContext ctx, Node operand) {
		ctx.checkOpen();
		return not(convert(operand, boolean.class));
	}

	@Override
	public Node emitIncrement(GraphGenerationContext ctx, Node variable) {
		ctx.checkOpen();
		checkArgument(variable instanceof VariableNode, "Cannot increment %s", variable);
		return increment((VariableNode) variable);
	}
	// endregion

	// region invocation
	@Override
	public Node emitCreateNewObjectExpression(GraphGenerationContext ctx, Constructor<?> constructor, List<Node> arguments) {
		ctx.checkOpen();
		return newInstance(constructor, arguments);
	}

	@Override
	public Node emitInvokeMethodExpression(GraphGenerationContext ctx, @Nullable Node instance, MethodDefinition method,
			List<Node> arguments) {
		ctx.checkOpen();
		if (method.isHelper()) {
			List<Node> delegateArguments = new ArrayList<>();
			delegateArguments.add(emitThisReference(ctx));
			delegateArguments.addAll(arguments);
			return emitInvokeDelegateExpression(ctx, method.getDelegateType(),
					emitGetPrivateMethodDelegate(ctx, method), delegateArguments);
		}
		checkArgument((instance == null) == method.isStatic(), "Instance must be given for instance methods only: %s", method);
		return call(instance, method.getMethod(), arguments);
	}

	@Override
	public Node emitInvokeVoidMethod(GraphGenerationContext ctx, @Nullable Node instance, MethodDefinition method,
			List<Node> arguments) {
		return convert(emitInvokeMethodExpression(ctx, instance, method, arguments), void.class);
	}

	@Override
	public Node emitInvokeDelegateExpression(GraphGenerationContext ctx, Class<?> delegateType, Node delegate, List<Node> arguments) {
		ctx.checkOpen();
		Method method = MethodDefinition.findAbstractMethod(delegateType);
		return call(convert(delegate, delegateType), method, arguments);
	}
	// endregion

	// region arrays
	@Override
	public Node emitCreateNewArrayExpression(GraphGenerationContext ctx, Class<?> elementType, Node length) {
		ctx.checkOpen();
		return newArray(elementType, convert(length, int.class));
	}

	@Override
	public Node emitCreateNewArrayExpression(GraphGenerationContext ctx, Class<?> elementType, List<Node> initializers) {
		ctx.checkOpen();
		return newArrayInit(elementType, initializers);
	}

	@Override
	public Node emitGetArrayElement(GraphGenerationContext ctx, Node array, Node index) {
		ctx.checkOpen();
		return arrayIndex(array, convert(index, int.class));
	}

	@Override
	public Node emitSetArrayElement(GraphGenerationContext ctx, Node array, Node index, Node value) {
		ctx.checkOpen();
		return arrayAssign(array, convert(index, int.class), value);
	}
	// endregion

	// region metadata
	@Override
	public Node emitTypeOfExpression(GraphGenerationContext ctx, Class<?> type) {
		ctx.checkOpen();
		if (dumpMode && !type.isPrimitive()) {
			return call(null, LOOKUP_TYPE, List.of(constant(type.getName(), String.class)));
		}
		return constant(type, Class.class);
	}

	@Override
	public Node emitMethodOfExpression(GraphGenerationContext ctx, Method method) {
		ctx.checkOpen();
		if (dumpMode) {
			List<Node> parameterTypes = Arrays.stream(method.getParameterTypes())
					.map(type -> (Node) constant(type.getName(), String.class))
					.collect(toList());
			return call(null, LOOKUP_METHOD, List.of(
					constant(method.getDeclaringClass().getName(), String.class),
					constant(method.getName(), String.class),
					newArrayInit(String.class, parameterTypes)));
		}
		return constant(method, Method.class);
	}

	@Override
	public Node emitFieldOfExpression(GraphGenerationContext ctx, Field field) {
		ctx.checkOpen();
		if (dumpMode) {
			return call(null, LOOKUP_FIELD, List.of(
					constant(field.getDeclaringClass().getName(), String.class),
					constant(field.getName(), String.class)));
		}
		return constant(field, Field.class);
	}
	// endregion

	// region conversions
	@Override
	public Node emitBoxExpression(GraphGenerationContext ctx, Node value) {
		ctx.checkOpen();
		checkArgument(value.getType().isPrimitive(), "Not a primitive: %s", value);
		return convert(value, Primitives.wrap(value.getType()));
	}

	@Override
	public Node emitUnboxExpression(GraphGenerationContext ctx, Node value, Class<?> primitiveType) {
		ctx.checkOpen();
		checkArgument(primitiveType.isPrimitive(), "Not a primitive: %s", primitiveType);
		return convert(value, primitiveType);
	}

	@Override
	public Node emitCast(GraphGenerationContext ctx, Node value, Class<?> type) {
		ctx.checkOpen();
		return convert(value, type);
	}
	// endregion

	@Override
	public Node emitSequentialStatements(GraphGenerationContext ctx, Class<?> resultType, List<@Nullable Node> statements) {
		ctx.checkOpen();
		List<Node> nonNull = statements.stream().filter(Objects::nonNull).collect(toList());
		if (nonNull.isEmpty()) {
			if (resultType != void.class) {
				throw new SerializerCompilationException("Empty block cannot produce " + resultType.getName());
			}
			return empty();
		}

		// locals of the current scope belong to the enclosing helper, resetting them here would lose their values
		Collection<Node> scopeLocals = ctx.getLocals();
		Set<VariableNode> variables = new LinkedHashSet<>();
		List<Node> parts = new ArrayList<>();
		for (int i = 0; i < nonNull.size(); i++) {
			Node statement = nonNull.get(i);
			boolean last = i == nonNull.size() - 1;
			if (statement instanceof VariableNode) {
				if (!scopeLocals.contains(statement)) {
					variables.add((VariableNode) statement);
				}
				if (!last) continue;
			}
			parts.add(statement);
		}

		Node result = nonNull.get(nonNull.size() - 1);
		if (!isAssignable(resultType, result.getType())) {
			throw new SerializerCompilationException("Block of type " + resultType.getName() +
					" ends with a statement of type " + result.getType().getName());
		}
		return block(List.copyOf(variables), parts, resultType);
	}

	// region delegates
	@Override
	public MethodDefinition defineHelper(GraphGenerationContext ctx, String name, Class<?> delegateType,
			Function<List<Node>, Node> body) {
		ctx.checkOpen();
		checkArgument(!ctx.hasHelper(name), "Helper %s is already defined", name);
		MethodDefinition definition = MethodDefinition.helper(name, delegateType);
		Method method = MethodDefinition.findAbstractMethod(delegateType);

		Class<?>[] parameterTypes = method.getParameterTypes();
		List<ParameterNode> parameters = new ArrayList<>();
		for (int i = 0; i < parameterTypes.length; i++) {
			parameters.add(parameter(parameterTypes[i], "arg" + i));
		}

		Node lambdaBody = ctx.withinScope(List.copyOf(parameters), () -> {
			Node result = body.apply(List.copyOf(parameters));
			List<VariableNode> locals = ctx.getLocals().stream()
					.map(local -> (VariableNode) local)
					.collect(toList());
			return returnValue(locals, result, method.getReturnType());
		});

		Object instance = compile(ctx, lambda(ctx.lambdaName(name), parameters, lambdaBody, method.getReturnType()))
				.asInterface(delegateType);
		ctx.registerHelper(definition, instance);
		return definition;
	}

	@Override
	public Node emitGetPrivateMethodDelegate(GraphGenerationContext ctx, MethodDefinition helper) {
		ctx.checkOpen();
		Object instance = ctx.getHelperInstance(helper.getName());
		if (ctx.getFlavor() == EmitterFlavor.FIELD_BASED) {
			return constant(instance, helper.getDelegateType());
		}
		ctx.exposeDelegate(helper.getName(), instance);
		return lookupDelegate(ctx, helper.getName(), helper.getDelegateType());
	}

	@Override
	public Node emitNewPrivateMethodDelegate(GraphGenerationContext ctx, MethodDefinition helper) {
		ctx.checkOpen();
		return constant(ctx.getHelperInstance(helper.getName()), helper.getDelegateType());
	}

	@Override
	public Node emitGetStaticDelegateExpression(GraphGenerationContext ctx, Method method) {
		ctx.checkOpen();
		checkArgument(Modifier.isStatic(method.getModifiers()), "Not a static method: %s", method);
		checkArgument(method.getParameterCount() < STATIC_DELEGATE_TYPES.length, "Too many parameters: %s", method);
		Class<?> delegateType = STATIC_DELEGATE_TYPES[method.getParameterCount()];
		String name = method.getName();

		Object instance = ctx.getExposedDelegate(name);
		if (instance == null) {
			List<ParameterNode> parameters = new ArrayList<>();
			parameters.add(parameter(Object.class, "self"));
			for (int i = 0; i < method.getParameterCount(); i++) {
				parameters.add(parameter(Object.class, "arg" + (i + 1)));
			}
			List<Node> arguments = new ArrayList<>(parameters.subList(1, parameters.size()));
			Class<?>[] parameterTypes = method.getParameterTypes();
			for (int i = 0; i < parameterTypes.length; i++) {
				arguments.set(i, convert(arguments.get(i), parameterTypes[i]));
			}
			Node body = returnValue(List.of(), call(null, method, arguments), Object.class);
			instance = compile(ctx, lambda(ctx.lambdaName("static$" + name), parameters, body, Object.class))
					.asDelegate(method.getParameterCount());
			ctx.exposeDelegate(name, instance);
		}
		checkArgument(delegateType.isInstance(instance), "Delegate %s is not a static delegate of %s", name, method);

		if (ctx.getFlavor() == EmitterFlavor.FIELD_BASED) {
			return constant(instance, delegateType);
		}
		return lookupDelegate(ctx, name, delegateType);
	}
	// endregion

	@Override
	protected Object evaluate(GraphGenerationContext ctx, String name, Node construct) {
		LambdaNode lambda = lambda(ctx.lambdaName(name), List.of(), convert(construct, Object.class), Object.class);
		return compile(ctx, lambda).invoke();
	}

	@Override
	protected List<Object> getConstants(GraphGenerationContext ctx) {
		return List.of();
	}

	private static CompiledLambda compile(GraphGenerationContext ctx, LambdaNode lambda) {
		try {
			CompiledLambda compiled = GraphCompiler.compile(lambda);
			logger.trace("Compiled {} of {}", lambda.getName(), ctx);
			return compiled;
		} catch (IllegalArgumentException | IllegalStateException e) {
			throw new SerializerCompilationException("Could not compile " + lambda.getName() + " of " +
					ctx.getTargetType().getName(), e);
		}
	}

	private static Node lookupDelegate(GraphGenerationContext ctx, String name, Class<?> delegateType) {
		Node table = convert(ctx.getParameter(0), DelegateTable.class);
		return convert(call(table, GET_DELEGATE, List.of(constant(name, String.class))), delegateType);
	}

	private static Node returnValue(List<VariableNode> locals, Node result, Class<?> returnType) {
		if (returnType != void.class && result.getType() == void.class) {
			return block(locals, List.of(result, constant(null, Object.class)), returnType);
		}
		return block(locals, List.of(convert(result, returnType)), returnType);
	}

	private static Node compareOperands(CompareNode.Operation operation, Node left, Node right) {
		Class<?> type = left.getType().isPrimitive() ? left.getType() :
				right.getType().isPrimitive() ? right.getType() :
						left.getType();
		if (!type.isPrimitive()) {
			return compare(operation, left, right);
		}
		return compare(operation, convert(left, type), convert(right, type));
	}

	private static Method lookupMethod(String name, Class<?>... parameterTypes) {
		return findMethod(ReflectionLookup.class, name, parameterTypes);
	}

	private static Method findMethod(Class<?> type, String name, Class<?>... parameterTypes) {
		try {
			return type.getMethod(name, parameterTypes);
		} catch (NoSuchMethodException e) {
			throw new AssertionError(e);
		}
	}

	@Override
	public String toString() {
		return "ExpressionGraphSerializerBuilder{dumpMode=" + dumpMode + '}';
	}
}
