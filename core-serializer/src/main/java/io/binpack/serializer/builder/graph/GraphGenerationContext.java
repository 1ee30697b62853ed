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

package io.binpack.serializer.builder.graph;

import io.binpack.codegen.container.EmitterFlavor;
import io.binpack.serializer.builder.GenerationContext;
import io.binpack.serializer.graph.Node;

/**
 * A generation context of an expression-graph serializer.
 * No code container is involved, so any requested flavor is used as is.
 */
public final class GraphGenerationContext extends GenerationContext<Node> {
	private int lambdaCount;

	GraphGenerationContext(Class<?> targetType, EmitterFlavor flavor) {
		super(targetType, flavor);
	}

	/**
	 * Returns a name of a compiled lambda, qualified by the target type
	 */
	String lambdaName(String name) {
		return targetType.getSimpleName() + "Serializer$" + name + '#' + lambdaCount++;
	}
}
