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

import java.lang.reflect.Array;

import static io.binpack.common.Checks.checkArgument;
import static io.binpack.serializer.graph.ArrayIndexNode.componentType;

/**
 * Writes an element of an array, the value is converted to the component type
 */
public final class ArrayAssignNode extends Node {
	private final Node array;
	private final Node index;
	private final Node value;

	ArrayAssignNode(Node array, Node index, Node value) {
		super(void.class);
		Class<?> componentType = componentType(array);
		checkArgument(index.getType() == int.class, "Index %s is not int", index);
		checkArgument(Conversions.isConvertible(value.getType(), componentType),
				"Cannot store %s into %s", value.getType().getName(), array.getType().getSimpleName());
		this.array = array;
		this.index = index;
		this.value = value;
	}

	@Override
	Evaluator compile(CompilationScope scope) {
		Evaluator array = this.array.compile(scope);
		Evaluator index = this.index.compile(scope);
		Evaluator value = this.value.compile(scope);
		Class<?> from = this.value.getType();
		Class<?> to = this.array.getType().getComponentType();
		return frame -> {
			Object target = array.evaluate(frame);
			int i = (Integer) index.evaluate(frame);
			Array.set(target, i, Conversions.convert(value.evaluate(frame), from, to));
			return null;
		};
	}

	@Override
	public String toString() {
		return array + "[" + index + "] = " + value;
	}
}
