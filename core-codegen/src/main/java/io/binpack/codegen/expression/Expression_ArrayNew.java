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
import org.objectweb.asm.Type;

import static io.binpack.codegen.util.TypeChecks.checkType;
import static io.binpack.codegen.util.TypeChecks.isWidenedToInt;

final class Expression_ArrayNew implements Expression {
	private final Class<?> arrayType;
	private final Expression length;

	Expression_ArrayNew(Class<?> arrayType, Expression length) {
		if (!arrayType.isArray())
			throw new IllegalArgumentException("Not an array type: " + arrayType);
		this.arrayType = arrayType;
		this.length = length;
	}

	@Override
	public Type load(Context ctx) {
		Type lengthType = length.load(ctx);
		checkType(lengthType, isWidenedToInt());
		ctx.getGeneratorAdapter().newArray(Type.getType(arrayType.getComponentType()));
		return Type.getType(arrayType);
	}
}
