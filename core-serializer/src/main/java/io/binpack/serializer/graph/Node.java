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

import io.binpack.serializer.builder.Construct;

/**
 * A node of an expression graph.
 * <p>
 * Every node has a static result type, {@code void.class} for statements.
 * Values of primitive types are carried boxed in their wrapper types.
 */
public abstract class Node implements Construct {
	protected final Class<?> type;

	protected Node(Class<?> type) {
		this.type = type;
	}

	@Override
	public final Class<?> getType() {
		return type;
	}

	abstract Evaluator compile(CompilationScope scope);
}
