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

final class Expression_ArraySet implements Expression {
	private final Expression array;
	private final Expression index;
	private final Expression element;

	Expression_ArraySet(Expression array, Expression index, Expression element) {
		this.array = array;
		this.index = index;
		this.element = element;
	}

	@Override
	public Type load(Context ctx) {
		Type arrayType = array.load(ctx);
		checkType(arrayType, isArray());
		Type componentType = Type.getType(arrayType.getDescriptor().substring(1));

		Type indexType = index.load(ctx);
		checkType(indexType, isWidenedToInt());

		Type elementType = element.load(ctx);
		checkType(elementType, isAssignable());
		ctx.cast(elementType, componentType);

		ctx.getGeneratorAdapter().arrayStore(componentType);
		return Type.VOID_TYPE;
	}
}
