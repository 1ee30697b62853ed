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
 * Evaluates one of two branches, both branches are converted to the type of the node
 */
public final class ConditionalNode extends Node {
	private final Node test;
	private final Node ifTrue;
	private final Node ifFalse;

	ConditionalNode(Node test, Node ifTrue, Node ifFalse, Class<?> type) {
		super(type);
		checkArgument(test.getType() == boolean.class, "Condition %s is not boolean", test);
		checkArgument(Conversions.isConvertible(ifTrue.getType(), type), "Branch %s is not %s", ifTrue, type.getName());
		checkArgument(Conversions.isConvertible(ifFalse.getType(), type), "Branch %s is not %s", ifFalse, type.getName());
		this.test = test;
		this.ifTrue = ifTrue;
		this.ifFalse = ifFalse;
	}

	@Override
	Evaluator compile(CompilationScope scope) {
		Evaluator test = this.test.compile(scope);
		Evaluator ifTrue = this.ifTrue.compile(scope);
		Evaluator ifFalse = this.ifFalse.compile(scope);
		Class<?> trueType = this.ifTrue.getType();
		Class<?> falseType = this.ifFalse.getType();
		return frame -> (Boolean) test.evaluate(frame) ?
				Conversions.convert(ifTrue.evaluate(frame), trueType, type) :
				Conversions.convert(ifFalse.evaluate(frame), falseType, type);
	}

	@Override
	public String toString() {
		return "if (" + test + ") " + ifTrue + " else " + ifFalse;
	}
}
