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

import java.lang.reflect.Method;
import java.util.List;

import static io.binpack.codegen.util.TypeChecks.checkType;
import static io.binpack.codegen.util.TypeChecks.isAssignable;
import static java.lang.reflect.Modifier.isStatic;
import static org.objectweb.asm.Opcodes.INVOKESTATIC;
import static org.objectweb.asm.Type.getType;
import static org.objectweb.asm.commons.Method.getMethod;

/**
 * A call of an exact method, arguments are converted to its parameter types
 */
final class Expression_Invoke implements Expression {
	private final @Nullable Expression owner;
	private final Method method;
	private final List<Expression> arguments;

	Expression_Invoke(@Nullable Expression owner, Method method, List<Expression> arguments) {
		if ((owner == null) != isStatic(method.getModifiers())) {
			throw new IllegalArgumentException("Owner must be given for instance methods only: " + method);
		}
		if (method.getParameterCount() != arguments.size()) {
			throw new IllegalArgumentException("Expected " + method.getParameterCount() + " arguments for " + method);
		}
		this.owner = owner;
		this.method = method;
		this.arguments = arguments;
	}

	@Override
	public Type load(Context ctx) {
		GeneratorAdapter g = ctx.getGeneratorAdapter();
		Class<?> declaringClass = method.getDeclaringClass();
		Type declaringType = getType(declaringClass);

		if (owner != null) {
			Type ownerType = owner.load(ctx);
			checkType(ownerType, isAssignable());
			ctx.cast(ownerType, declaringType);
		}

		Class<?>[] parameterTypes = method.getParameterTypes();
		for (int i = 0; i < parameterTypes.length; i++) {
			Type argumentType = arguments.get(i).load(ctx);
			checkType(argumentType, isAssignable());
			ctx.cast(argumentType, getType(parameterTypes[i]));
		}

		org.objectweb.asm.commons.Method asmMethod = getMethod(method);
		if (owner == null) {
			g.visitMethodInsn(INVOKESTATIC, declaringType.getInternalName(), asmMethod.getName(),
					asmMethod.getDescriptor(), declaringClass.isInterface());
		} else if (declaringClass.isInterface()) {
			g.invokeInterface(declaringType, asmMethod);
		} else {
			g.invokeVirtual(declaringType, asmMethod);
		}
		return getType(method.getReturnType());
	}
}
