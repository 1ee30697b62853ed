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

import org.jetbrains.annotations.Nullable;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.List;

import static io.binpack.common.Checks.checkArgument;
import static io.binpack.serializer.graph.FieldNode.invoke;
import static java.util.stream.Collectors.joining;

/**
 * Invokes a public method, {@code owner} is {@code null} for static methods.
 * Arguments are converted to the parameter types of the method.
 */
public final class CallNode extends Node {
	private final @Nullable Node owner;
	private final Method method;
	private final List<Node> arguments;

	CallNode(@Nullable Node owner, Method method, List<Node> arguments) {
		super(method.getReturnType());
		checkArgument((owner == null) == Modifier.isStatic(method.getModifiers()),
				"Owner must be given for instance methods only: %s", method);
		checkArguments(method.getParameterTypes(), arguments, method);
		this.owner = owner;
		this.method = method;
		this.arguments = List.copyOf(arguments);
	}

	public @Nullable Node getOwner() {
		return owner;
	}

	public Method getMethod() {
		return method;
	}

	public List<Node> getArguments() {
		return arguments;
	}

	@Override
	Evaluator compile(CompilationScope scope) {
		MethodHandle handle;
		try {
			handle = MethodHandles.publicLookup().unreflect(method).asFixedArity();
		} catch (IllegalAccessException e) {
			throw new IllegalArgumentException("Method " + method + " is not accessible", e);
		}
		int offset = owner != null ? 1 : 0;
		Evaluator[] evaluators = new Evaluator[arguments.size() + offset];
		Class<?>[] from = new Class<?>[evaluators.length];
		Class<?>[] to = new Class<?>[evaluators.length];
		if (owner != null) {
			evaluators[0] = owner.compile(scope);
			from[0] = to[0] = owner.getType();
		}
		Class<?>[] parameterTypes = method.getParameterTypes();
		for (int i = 0; i < arguments.size(); i++) {
			evaluators[i + offset] = arguments.get(i).compile(scope);
			from[i + offset] = arguments.get(i).getType();
			to[i + offset] = parameterTypes[i];
		}
		return frame -> invoke(handle, evaluateArguments(frame, evaluators, from, to));
	}

	static void checkArguments(Class<?>[] parameterTypes, List<Node> arguments, Object target) {
		checkArgument(parameterTypes.length == arguments.size(), "%s expects %s arguments, got %s",
				target, parameterTypes.length, arguments.size());
		for (int i = 0; i < parameterTypes.length; i++) {
			checkArgument(Conversions.isConvertible(arguments.get(i).getType(), parameterTypes[i]),
					"Argument #%s of %s cannot be converted from %s", i, target, arguments.get(i).getType().getName());
		}
	}

	static Object[] evaluateArguments(Frame frame, Evaluator[] evaluators, Class<?>[] from, Class<?>[] to) {
		Object[] values = new Object[evaluators.length];
		for (int i = 0; i < evaluators.length; i++) {
			values[i] = Conversions.convert(evaluators[i].evaluate(frame), from[i], to[i]);
		}
		return values;
	}

	@Override
	public String toString() {
		return (owner != null ? owner.toString() : method.getDeclaringClass().getSimpleName()) + '.' + method.getName() +
				arguments.stream().map(Object::toString).collect(joining(", ", "(", ")"));
	}
}
