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

import static io.binpack.codegen.util.Utils.exceptionInGeneratedClass;
import static java.lang.String.format;
import static org.objectweb.asm.Type.getType;

/**
 * A static field declared by the class being generated
 */
final class Expression_StaticField implements Variable {
	private final String name;

	Expression_StaticField(String name) {
		this.name = name;
	}

	@Override
	public Type load(Context ctx) {
		Type fieldType = fieldType(ctx);
		ctx.getGeneratorAdapter().getStatic(ctx.getSelfType(), name, fieldType);
		return fieldType;
	}

	@Override
	public @Nullable Object beginStore(Context ctx) {
		return null;
	}

	@Override
	public void store(Context ctx, @Nullable Object storeContext, Type type) {
		Type fieldType = fieldType(ctx);
		ctx.cast(type, fieldType);
		ctx.getGeneratorAdapter().putStatic(ctx.getSelfType(), name, fieldType);
	}

	private Type fieldType(Context ctx) {
		Class<?> fieldClass = ctx.getFields().get(name);
		if (fieldClass == null) {
			throw new IllegalArgumentException(format("No static field %s in generated class. %s",
					name, exceptionInGeneratedClass(ctx)));
		}
		return getType(fieldClass);
	}
}
