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
import static io.binpack.codegen.util.TypeChecks.isAssignable;
import static io.binpack.codegen.util.Utils.isPrimitiveType;

final class Expression_Cast implements Expression {
	private static final Type OBJECT_TYPE = Type.getType(Object.class);

	private final Expression expression;
	private final Type targetType;

	Expression_Cast(Expression expression, Type targetType) {
		this.expression = expression;
		this.targetType = targetType;
	}

	@Override
	public Type load(Context ctx) {
		Type sourceType = expression.load(ctx);
		checkType(sourceType, isAssignable());
		if (!targetType.equals(OBJECT_TYPE) || isPrimitiveType(sourceType)) {
			ctx.cast(sourceType, targetType);
		}
		return targetType;
	}
}
