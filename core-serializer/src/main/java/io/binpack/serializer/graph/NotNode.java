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

public final class NotNode extends Node {
	private final Node operand;

	NotNode(Node operand) {
		super(boolean.class);
		checkArgument(operand.getType() == boolean.class, "Operand %s is not boolean", operand);
		this.operand = operand;
	}

	@Override
	Evaluator compile(CompilationScope scope) {
		Evaluator operand = this.operand.compile(scope);
		return frame -> !(Boolean) operand.evaluate(frame);
	}

	@Override
	public String toString() {
		return "!" + operand;
	}
}
