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

import io.binpack.serializer.*;
import org.jetbrains.annotations.Nullable;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandleProxies;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;

import static io.binpack.common.Checks.checkArgument;
import static java.lang.invoke.MethodType.methodType;

/**
 * A lambda compiled by {@link GraphCompiler}. It is stateless and may be invoked concurrently.
 */
public final class CompiledLambda {
	private static final MethodHandle INVOKE;

	static {
		try {
			INVOKE = MethodHandles.lookup().findVirtual(CompiledLambda.class, "invoke",
					methodType(Object.class, Object[].class));
		} catch (NoSuchMethodException | IllegalAccessException e) {
			throw new ExceptionInInitializerError(e);
		}
	}

	private final String name;
	private final Class<?>[] parameterTypes;
	private final Class<?> bodyType;
	private final Class<?> returnType;
	private final Evaluator body;
	private final int slotCount;

	CompiledLambda(String name, Class<?>[] parameterTypes, Class<?> bodyType, Class<?> returnType, Evaluator body, int slotCount) {
		this.name = name;
		this.parameterTypes = parameterTypes;
		this.bodyType = bodyType;
		this.returnType = returnType;
		this.body = body;
		this.slotCount = slotCount;
	}

	public String getName() {
		return name;
	}

	public int getParameterCount() {
		return parameterTypes.length;
	}

	/**
	 * Evaluates the lambda, arguments are converted to the types of its parameters
	 */
	public @Nullable Object invoke(Object... arguments) {
		checkArgument(arguments.length == parameterTypes.length, "%s expects %s arguments, got %s",
				name, parameterTypes.length, arguments.length);
		Frame frame = new Frame(slotCount);
		for (int i = 0; i < arguments.length; i++) {
			frame.slots[i] = Conversions.convert(arguments[i], Object.class, parameterTypes[i]);
		}
		return Conversions.convert(body.evaluate(frame), bodyType, returnType);
	}

	/**
	 * Returns a delegate whose first argument is the serializer
	 *
	 * @param arity number of arguments that follow the serializer
	 */
	public Object asDelegate(int arity) {
		checkArgument(parameterTypes.length == arity + 1, "%s takes %s arguments, not %s", name, parameterTypes.length, arity + 1);
		return switch (arity) {
			case 0 -> (Delegate0) self -> invoke(self);
			case 1 -> (Delegate1) (self, arg1) -> invoke(self, arg1);
			case 2 -> (Delegate2) (self, arg1, arg2) -> invoke(self, arg1, arg2);
			case 3 -> (Delegate3) (self, arg1, arg2, arg3) -> invoke(self, arg1, arg2, arg3);
			default -> throw new IllegalArgumentException("No delegate of arity " + arity);
		};
	}

	/**
	 * Adapts the lambda to a functional interface
	 */
	public <F> F asInterface(Class<F> type) {
		if (type == Delegate0.class) return type.cast(asDelegate(0));
		if (type == Delegate1.class) return type.cast(asDelegate(1));
		if (type == Delegate2.class) return type.cast(asDelegate(2));
		if (type == Delegate3.class) return type.cast(asDelegate(3));
		if (type == PackOperation.class) {
			PackOperation<Object> operation = (serializer, context, packer, target) ->
					invoke(serializer, context, packer, target);
			return type.cast(operation);
		}
		if (type == UnpackOperation.class) {
			UnpackOperation<Object> operation = (serializer, context, unpacker, unpackingContext, itemIndex, itemsCount) ->
					invoke(serializer, context, unpacker, unpackingContext, itemIndex, itemsCount);
			return type.cast(operation);
		}
		Method method = Arrays.stream(type.getMethods())
				.filter(m -> Modifier.isAbstract(m.getModifiers()))
				.findFirst()
				.orElseThrow(() -> new IllegalArgumentException("Not a functional interface: " + type.getName()));
		checkArgument(method.getParameterCount() == parameterTypes.length, "%s takes %s arguments, %s takes %s",
				name, parameterTypes.length, method, method.getParameterCount());
		MethodHandle target = INVOKE.bindTo(this)
				.asCollector(Object[].class, parameterTypes.length)
				.asType(methodType(method.getReturnType(), method.getParameterTypes()));
		return MethodHandleProxies.asInterfaceInstance(type, target);
	}

	@Override
	public String toString() {
		return "CompiledLambda{" + name + '}';
	}
}
