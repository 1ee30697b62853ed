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

/**
 * Reads an element of an array
 */
public final class ArrayIndexNode extends Node {
	private final Node array;
	private final Node index;

	ArrayIndexNode(Node array, Node index) {
		super(componentType(array));
		checkArgument(index.getType() == int.class, "Index %s is not int", index);
		this.array = array;
		this.index = index;
	}

	static Class<?> componentType(Node array) {
		checkArgument(array.getType().isArray(), "Not an array: %s", array);
		return array.getType().getComponentType();
	}

	@Override
	Evaluator compile(CompilationScope scope) {
		Evaluator array = this.array.compile(scope);
		Evaluator index = this.index.compile(scope);
		return frame -> Array.get(array.evaluate(frame), (Integer) index.evaluate(frame));
	}

	@Override
	public String toString() {
		return array + "[" + index + "]";
	}
}
