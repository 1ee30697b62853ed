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

import java.util.List;

import static io.binpack.common.Checks.checkArgument;
import static java.util.stream.Collectors.joining;

/**
 * The root of a graph: parameters, a body and a return type.
 * A lambda is not evaluated itself, it is compiled with a {@link GraphCompiler}.
 */
public final class LambdaNode extends Node {
	private final String name;
	private final List<ParameterNode> parameters;
	private final Node body;

	LambdaNode(String name, List<ParameterNode> parameters, Node body, Class<?> returnType) {
		super(returnType);
		checkArgument(Conversions.isConvertible(body.getType(), returnType),
				"Body of %s returns %s, expected %s", name, body.getType().getName(), returnType.getName());
		this.name = name;
		this.parameters = List.copyOf(parameters);
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public List<ParameterNode> getParameters() {
		return parameters;
	}

	public Node getBody() {
		return body;
	}

	@Override
	Evaluator compile(CompilationScope scope) {
		throw new IllegalArgumentException("Lambda " + name + " cannot be nested");
	}

	@Override
	public String toString() {
		return name + parameters.stream().map(Object::toString).collect(joining(", ", "(", ")")) + " -> " + body;
	}
}
