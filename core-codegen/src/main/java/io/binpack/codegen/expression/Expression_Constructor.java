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

package io.binpack.codegen.expression;

import io.binpack.codegen.Context;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.Type;
import org.objectweb.asm.commons.GeneratorAdapter;

import java.lang.reflect.Constructor;
import java.util.List;

import static io.binpack.codegen.util.TypeChecks.checkType;
import static io.binpack.codegen.util.TypeChecks.isAssignable;
import static org.objectweb.asm.Type.getType;
import static org.objectweb.asm.commons.Method.getMethod;

/**
 * Creates a new instance, either with an exact constructor or with one
 * resolved by the types of the arguments
 */
final class Expression_Constructor implements Expression {
	private final Class<?> type;
	private final @Nullable Constructor<?> constructor;
	private final List<Expression> arguments;

	Expression_Constructor(Class<?> type, List<Expression> arguments) {
		this.type = type;
		this.constructor = null;
		this.arguments = arguments;
	}

	Expression_Constructor(Constructor<?> constructor, List<Expression> arguments) {
		if (constructor.getParameterCount() != arguments.size()) {
			throw new IllegalArgumentException("Expected " + constructor.getParameterCount() + " arguments for " + constructor);
		}
		this.type = constructor.getDeclaringClass();
		this.constructor = constructor;
		this.arguments = arguments;
	}

	@Override
	public Type load(Context ctx) {
		if (constructor == null) {
			return ctx.invokeConstructor(getType(type), arguments);
		}
		GeneratorAdapter g = ctx.getGeneratorAdapter();
		Type ownerType = getType(type);
		g.newInstance(ownerType);
		g.dup();
		Class<?>[] parameterTypes = constructor.getParameterTypes();
		for (int i = 0; i < parameterTypes.length; i++) {
			Type argumentType = arguments.get(i).load(ctx);
			checkType(argumentType, isAssignable());
			ctx.cast(argumentType, getType(parameterTypes[i]));
		}
		g.invokeConstructor(ownerType, getMethod(constructor));
		return ownerType;
	}
}
