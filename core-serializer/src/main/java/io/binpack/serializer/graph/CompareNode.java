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

import java.util.Objects;

import static io.binpack.common.Checks.checkArgument;

/**
 * Compares operands of the same type. Equality of references is {@link Object#equals}, ordering of references
 * is {@link Comparable#compareTo}.
 */
public final class CompareNode extends Node {
	public enum Operation {
		EQ("=="), NE("!="), LT("<"), GT(">");

		private final String symbol;

		Operation(String symbol) {
			this.symbol = symbol;
		}
	}

	private final Operation operation;
	private final Node left;
	private final Node right;

	CompareNode(Operation operation, Node left, Node right) {
		super(boolean.class);
		checkArgument(left.getType().isPrimitive() == right.getType().isPrimitive() &&
						(!left.getType().isPrimitive() || left.getType() == right.getType()),
				"Cannot compare %s with %s", left.getType().getName(), right.getType().getName());
		checkArgument(left.getType() != void.class, "Cannot compare statements");
		this.operation = operation;
		this.left = left;
		this.right = right;
	}

	public Operation getOperation() {
		return operation;
	}

	@Override
	Evaluator compile(CompilationScope scope) {
		Evaluator left = this.left.compile(scope);
		Evaluator right = this.right.compile(scope);
		Class<?> operandType = this.left.getType();
		return switch (operation) {
			case EQ -> frame -> Objects.equals(left.evaluate(frame), right.evaluate(frame));
			case NE -> frame -> !Objects.equals(left.evaluate(frame), right.evaluate(frame));
			case LT -> frame -> Conversions.compare(left.evaluate(frame), right.evaluate(frame), operandType) < 0;
			case GT -> frame -> Conversions.compare(left.evaluate(frame), right.evaluate(frame), operandType) > 0;
		};
	}

	@Override
	public String toString() {
		return "(" + left + ' ' + operation.symbol + ' ' + right + ')';
	}
}
