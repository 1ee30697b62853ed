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
 * Boxes, unboxes or casts a value
 */
public final class ConvertNode extends Node {
	private final Node operand;

	ConvertNode(Node operand, Class<?> type) {
		super(type);
		checkArgument(Conversions.isConvertible(operand.getType(), type),
				"Cannot convert %s to %s", operand.getType().getName(), type.getName());
		this.operand = operand;
	}

	public Node getOperand() {
		return operand;
	}

	@Override
	Evaluator compile(CompilationScope scope) {
		Evaluator operand = this.operand.compile(scope);
		Class<?> from = this.operand.getType();
		return frame -> Conversions.convert(operand.evaluate(frame), from, type);
	}

	@Override
	public String toString() {
		return "(" + type.getSimpleName() + ") " + operand;
	}
}
