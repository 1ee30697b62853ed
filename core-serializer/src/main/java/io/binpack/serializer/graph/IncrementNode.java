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
 * Adds one to an {@code int} or a {@code long} variable
 */
public final class IncrementNode extends Node {
	private final VariableNode variable;

	IncrementNode(VariableNode variable) {
		super(void.class);
		checkArgument(variable.getType() == int.class || variable.getType() == long.class,
				"Cannot increment %s", variable);
		this.variable = variable;
	}

	@Override
	Evaluator compile(CompilationScope scope) {
		Evaluator current = variable.compile(scope);
		int slot = scope.slotOf(variable);
		if (variable.getType() == long.class) {
			return frame -> {
				frame.slots[slot] = (Long) current.evaluate(frame) + 1L;
				return null;
			};
		}
		return frame -> {
			frame.slots[slot] = (Integer) current.evaluate(frame) + 1;
			return null;
		};
	}

	@Override
	public String toString() {
		return variable.getName() + "++";
	}
}
