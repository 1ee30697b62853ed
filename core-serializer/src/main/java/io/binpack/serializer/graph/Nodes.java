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

import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.List;

/**
 * Static factories of {@link Node}s
 */
public final class Nodes {
	private Nodes() {
	}

	public static ConstantNode constant(@Nullable Object value, Class<?> type) {
		return new ConstantNode(value, type);
	}

	public static ParameterNode parameter(Class<?> type, String name) {
		return new ParameterNode(type, name);
	}

	public static VariableNode variable(Class<?> type, String name) {
		return new VariableNode(type, name);
	}

	public static AssignNode assign(VariableNode variable, Node value) {
		return new AssignNode(variable, value);
	}

	public static FieldNode field(@Nullable Node owner, Field field) {
		return new FieldNode(owner, field);
	}

	public static FieldAssignNode assignField(@Nullable Node owner, Field field, Node value) {
		return new FieldAssignNode(owner, field, value);
	}

	public static CallNode call(@Nullable Node owner, Method method, List<Node> arguments) {
		return new CallNode(owner, method, arguments);
	}

	public static NewNode newInstance(Constructor<?> constructor, List<Node> arguments) {
		return new NewNode(constructor, arguments);
	}

	public static ConditionalNode condition(Node test, Node ifTrue, Node ifFalse, Class<?> type) {
		return new ConditionalNode(test, ifTrue, ifFalse, type);
	}

	public static AndAlsoNode andAlso(List<Node> operands) {
		return new AndAlsoNode(operands);
	}

	public static BreakLabel label(String name) {
		return new BreakLabel(name);
	}

	public static LoopNode loop(Node body, BreakLabel label) {
		return new LoopNode(body, label);
	}

	public static BreakNode breakLoop(BreakLabel label) {
		return new BreakNode(label);
	}

	/**
	 * Returns a block that evaluates to its last statement
	 */
	public static BlockNode block(List<VariableNode> variables, List<Node> statements, Class<?> type) {
		return new BlockNode(variables, statements, type);
	}

	/**
	 * Returns a statement that does nothing
	 */
	public static BlockNode empty() {
		return new BlockNode(List.of(), List.of(new ConstantNode(null, Object.class)), void.class);
	}

	public static TryFinallyNode tryFinally(Node tryBlock, Node finallyBlock) {
		return new TryFinallyNode(tryBlock, finallyBlock);
	}

	public static CompareNode compare(CompareNode.Operation operation, Node left, Node right) {
		return new CompareNode(operation, left, right);
	}

	public static NotNode not(Node operand) {
		return new NotNode(operand);
	}

	public static IncrementNode increment(VariableNode variable) {
		return new IncrementNode(variable);
	}

	public static NewArrayNode newArray(Class<?> elementType, Node length) {
		return NewArrayNode.ofLength(elementType, length);
	}

	public static NewArrayNode newArrayInit(Class<?> elementType, List<Node> elements) {
		return NewArrayNode.ofElements(elementType, elements);
	}

	public static ArrayIndexNode arrayIndex(Node array, Node index) {
		return new ArrayIndexNode(array, index);
	}

	public static ArrayAssignNode arrayAssign(Node array, Node index, Node value) {
		return new ArrayAssignNode(array, index, value);
	}

	public static ArrayLengthNode arrayLength(Node array) {
		return new ArrayLengthNode(array);
	}

	/**
	 * Returns a node that converts a value, or the node itself if it is already of the type
	 */
	public static Node convert(Node operand, Class<?> type) {
		if (operand.getType() == type) return operand;
		return new ConvertNode(operand, type);
	}

	public static LambdaNode lambda(String name, List<ParameterNode> parameters, Node body, Class<?> returnType) {
		return new LambdaNode(name, parameters, body, returnType);
	}
}
