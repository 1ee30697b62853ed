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

package io.binpack.codegen.container;

import java.util.ArrayList;
import java.util.List;

/**
 * Constants collected by a context-based emitter, in the order they were captured
 */
public final class ConstantTable implements ConstantPool {
	private final List<Object> constants = new ArrayList<>();

	int add(Object constant) {
		for (int i = 0; i < constants.size(); i++) {
			if (constants.get(i) == constant) return i;
		}
		constants.add(constant);
		return constants.size() - 1;
	}

	@Override
	public Object getConstant(int index) {
		return constants.get(index);
	}

	public int size() {
		return constants.size();
	}

	public List<Object> toList() {
		return List.copyOf(constants);
	}

	@Override
	public String toString() {
		return "ConstantTable{size=" + constants.size() + '}';
	}
}
