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

import io.binpack.codegen.util.Primitives;

/**
 * A local variable. It is reset to the default value of its type by every {@link BlockNode} that declares it.
 */
public final class VariableNode extends Node {
	private final String name;

	VariableNode(Class<?> type, String name) {
		super(type);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	Evaluator compile(CompilationScope scope) {
		int slot = scope.slotOf(this);
		Object defaultValue = Primitives.defaultValue(type);
		return frame -> {
			Object value = frame.slots[slot];
			return value != null ? value : defaultValue;
		};
	}

	@Override
	public String toString() {
		return name + ':' + type.getSimpleName();
	}
}
