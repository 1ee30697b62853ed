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

import java.util.List;

import static io.binpack.common.Checks.checkArgument;
import static java.util.stream.Collectors.joining;

/**
 * Evaluates statements in order, its value is the value of the last statement.
 * Variables of the block are reset to their default values every time the block is entered.
 */
public final class BlockNode extends Node {
	private final List<VariableNode> variables;
	private final List<Node> statements;

	BlockNode(List<VariableNode> variables, List<Node> statements, Class<?> type) {
		super(type);
		checkArgument(!statements.isEmpty(), "Empty block");
		Node last = statements.get(statements.size() - 1);
		checkArgument(Conversions.isConvertible(last.getType(), type), "Block of %s ends with %s", type.getName(), last);
		this.variables = List.copyOf(variables);
		this.statements = List.copyOf(statements);
	}

	public List<VariableNode> getVariables() {
		return variables;
	}

	public List<Node> getStatements() {
		return statements;
	}

	@Override
	Evaluator compile(CompilationScope scope) {
		int[] slots = variables.stream().mapToInt(scope::slotOf).toArray();
		Evaluator[] statements = this.statements.stream().map(statement -> statement.compile(scope)).toArray(Evaluator[]::new);
		Class<?> lastType = this.statements.get(statements.length - 1).getType();
		return frame -> {
			for (int slot : slots) {
				frame.slots[slot] = null;
			}
			Object result = null;
			for (Evaluator statement : statements) {
				result = statement.evaluate(frame);
				if (frame.isBreaking()) return null;
			}
			return Conversions.convert(result, lastType, type);
		};
	}

	@Override
	public String toString() {
		return statements.stream().map(Object::toString).collect(joining("; ", "{", "}"));
	}
}
