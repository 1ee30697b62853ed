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

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Constructor;
import java.util.List;

import static io.binpack.serializer.graph.CallNode.checkArguments;
import static io.binpack.serializer.graph.CallNode.evaluateArguments;
import static io.binpack.serializer.graph.FieldNode.invoke;
import static java.util.stream.Collectors.joining;

/**
 * Creates an instance with a public constructor
 */
public final class NewNode extends Node {
	private final Constructor<?> constructor;
	private final List<Node> arguments;

	NewNode(Constructor<?> constructor, List<Node> arguments) {
		super(constructor.getDeclaringClass());
		checkArguments(constructor.getParameterTypes(), arguments, constructor);
		this.constructor = constructor;
		this.arguments = List.copyOf(arguments);
	}

	@Override
	Evaluator compile(CompilationScope scope) {
		MethodHandle handle;
		try {
			handle = MethodHandles.publicLookup().unreflectConstructor(constructor).asFixedArity();
		} catch (IllegalAccessException e) {
			throw new IllegalArgumentException("Constructor " + constructor + " is not accessible", e);
		}
		Evaluator[] evaluators = new Evaluator[arguments.size()];
		Class<?>[] from = new Class<?>[arguments.size()];
		Class<?>[] to = constructor.getParameterTypes();
		for (int i = 0; i < arguments.size(); i++) {
			evaluators[i] = arguments.get(i).compile(scope);
			from[i] = arguments.get(i).getType();
		}
		return frame -> invoke(handle, evaluateArguments(frame, evaluators, from, to));
	}

	@Override
	public String toString() {
		return "new " + type.getSimpleName() + arguments.stream().map(Object::toString).collect(joining(", ", "(", ")"));
	}
}
