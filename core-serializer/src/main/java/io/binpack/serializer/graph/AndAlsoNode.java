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
 * A short-circuit conjunction
 */
public final class AndAlsoNode extends Node {
	private final List<Node> operands;

	AndAlsoNode(List<Node> operands) {
		super(boolean.class);
		checkArgument(!operands.isEmpty(), "No operands");
		for (Node operand : operands) {
			checkArgument(operand.getType() == boolean.class, "Operand %s is not boolean", operand);
		}
		this.operands = List.copyOf(operands);
	}

	@Override
	Evaluator compile(CompilationScope scope) {
		Evaluator[] operands = this.operands.stream().map(operand -> operand.compile(scope)).toArray(Evaluator[]::new);
		return frame -> {
			for (Evaluator operand : operands) {
				if (!(Boolean) operand.evaluate(frame)) return false;
			}
			return true;
		};
	}

	@Override
	public String toString() {
		return operands.stream().map(Object::toString).collect(joining(" && ", "(", ")"));
	}
}
