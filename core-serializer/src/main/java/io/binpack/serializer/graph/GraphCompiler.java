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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles expression graphs into trees of closures.
 * <p>
 * Compilation needs no class definition, so it works where dynamic code cannot be loaded.
 * Members are resolved to method handles once, at compile time.
 */
public final class GraphCompiler {
	private static final Logger logger = LoggerFactory.getLogger(GraphCompiler.class);

	private GraphCompiler() {
	}

	/**
	 * @throws IllegalArgumentException if a node refers to a parameter of another lambda
	 *                                  or to an inaccessible member
	 */
	public static CompiledLambda compile(LambdaNode lambda) {
		CompilationScope scope = new CompilationScope(lambda.getParameters());
		Evaluator body = lambda.getBody().compile(scope);
		logger.trace("Compiled {} with {} slots", lambda.getName(), scope.getSlotCount());
		return new CompiledLambda(lambda.getName(),
				lambda.getParameters().stream().map(Node::getType).toArray(Class<?>[]::new),
				lambda.getBody().getType(), lambda.getType(), body, scope.getSlotCount());
	}
}
