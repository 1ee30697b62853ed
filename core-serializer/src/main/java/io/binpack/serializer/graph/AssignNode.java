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

import static io.binpack.common.Checks.checkArgument;

/**
 * Stores a value into a variable, the value is converted to the type of the variable
 */
public final class AssignNode extends Node {
	private final VariableNode variable;
	private final Node value;

	AssignNode(VariableNode variable, Node value) {
		super(void.class);
		checkArgument(Conversions.isConvertible(value.getType(), variable.getType()),
				"Cannot assign %s to %s", value.getType().getName(), variable);
		this.variable = variable;
		this.value = value;
	}

	public VariableNode getVariable() {
		return variable;
	}

	public Node getValue() {
		return value;
	}

	@Override
	Evaluator compile(CompilationScope scope) {
		int slot = scope.slotOf(variable);
		Evaluator value = this.value.compile(scope);
		Class<?> from = this.value.getType();
		Class<?> to = variable.getType();
		return frame -> {
			frame.slots[slot] = Conversions.convert(value.evaluate(frame), from, to);
			return null;
		};
	}

	@Override
	public String toString() {
		return variable.getName() + " = " + value;
	}
}
