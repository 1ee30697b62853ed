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

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import static io.binpack.common.Checks.checkArgument;

/**
 * Assigns frame slots to the parameters and variables of a lambda being compiled
 */
final class CompilationScope {
	private final Map<ParameterNode, Integer> parameters = new IdentityHashMap<>();
	private final Map<VariableNode, Integer> variables = new IdentityHashMap<>();
	private int slotCount;

	CompilationScope(List<ParameterNode> parameters) {
		for (ParameterNode parameter : parameters) {
			checkArgument(!this.parameters.containsKey(parameter), "Duplicate parameter %s", parameter);
			this.parameters.put(parameter, slotCount++);
		}
	}

	int slotOf(ParameterNode parameter) {
		Integer slot = parameters.get(parameter);
		checkArgument(slot != null, "Parameter %s is not in scope", parameter);
		return slot;
	}

	/**
	 * Returns a slot of a variable, a variable gets its slot when it is first seen
	 */
	int slotOf(VariableNode variable) {
		return variables.computeIfAbsent(variable, $ -> slotCount++);
	}

	int getSlotCount() {
		return slotCount;
	}
}
