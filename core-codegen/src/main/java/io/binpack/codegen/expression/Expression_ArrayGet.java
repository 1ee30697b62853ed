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

import static io.binpack.codegen.util.TypeChecks.*;

final class Expression_ArrayGet implements Expression {
	private final Expression array;
	private final Expression index;

	Expression_ArrayGet(Expression array, Expression index) {
		this.array = array;
		this.index = index;
	}

	@Override
	public Type load(Context ctx) {
		Type arrayType = array.load(ctx);
		checkType(arrayType, isArray());
		checkType(index.load(ctx), isWidenedToInt());

		// one dimension down, so int[][] yields int[]
		Type componentType = Type.getType(arrayType.getDescriptor().substring(1));
		ctx.getGeneratorAdapter().arrayLoad(componentType);
		return componentType;
	}
}
