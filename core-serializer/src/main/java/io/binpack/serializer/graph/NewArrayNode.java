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
import java.util.List;

import static io.binpack.common.Checks.checkArgument;
import static java.util.stream.Collectors.joining;

/**
 * Creates an array either of a given length or filled with given elements
 */
public final class NewArrayNode extends Node {
	private final Class<?> elementType;
	private final Node length;
	private final List<Node> elements;

	private NewArrayNode(Class<?> elementType, Node length, List<Node> elements) {
		super(elementType.arrayType());
		this.elementType = elementType;
		this.length = length;
		this.elements = elements;
	}

	static NewArrayNode ofLength(Class<?> elementType, Node length) {
		checkArgument(length.getType() == int.class, "Length %s is not int", length);
		return new NewArrayNode(elementType, length, List.of());
	}

	static NewArrayNode ofElements(Class<?> elementType, List<Node> elements) {
		for (Node element : elements) {
			checkArgument(Conversions.isConvertible(element.getType(), elementType),
					"Element %s is not %s", element, elementType.getName());
		}
		return new NewArrayNode(elementType, new ConstantNode(elements.size(), int.class), List.copyOf(elements));
	}

	public Class<?> getElementType() {
		return elementType;
	}

	@Override
	Evaluator compile(CompilationScope scope) {
		Evaluator length = this.length.compile(scope);
		Evaluator[] elements = this.elements.stream().map(element -> element.compile(scope)).toArray(Evaluator[]::new);
		Class<?>[] elementTypes = this.elements.stream().map(Node::getType).toArray(Class<?>[]::new);
		return frame -> {
			Object array = Array.newInstance(elementType, (Integer) length.evaluate(frame));
			for (int i = 0; i < elements.length; i++) {
				Array.set(array, i, Conversions.convert(elements[i].evaluate(frame), elementTypes[i], elementType));
			}
			return array;
		};
	}

	@Override
	public String toString() {
		return "new " + elementType.getSimpleName() +
				(elements.isEmpty() ? "[" + length + "]" : elements.stream().map(Object::toString).collect(joining(", ", "[]{", "}")));
	}
}
