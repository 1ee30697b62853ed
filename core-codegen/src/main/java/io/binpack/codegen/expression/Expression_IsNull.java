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
import org.objectweb.asm.Label;
import org.objectweb.asm.Type;
import org.objectweb.asm.commons.GeneratorAdapter;

import static io.binpack.codegen.util.TypeChecks.checkType;
import static io.binpack.codegen.util.TypeChecks.isAssignable;
import static io.binpack.codegen.util.Utils.isPrimitiveType;
import static org.objectweb.asm.Type.BOOLEAN_TYPE;

/**
 * {@code true} for a {@code null} reference. A primitive is never {@code null}.
 */
final class Expression_IsNull implements Expression {
	private final Expression value;

	Expression_IsNull(Expression value) {
		this.value = value;
	}

	@Override
	public Type load(Context ctx) {
		GeneratorAdapter g = ctx.getGeneratorAdapter();
		Type type = value.load(ctx);
		checkType(type, isAssignable());
		if (isPrimitiveType(type)) {
			ctx.discard(type);
			g.push(false);
			return BOOLEAN_TYPE;
		}

		Label isNull = new Label();
		Label end = new Label();
		g.ifNull(isNull);
		g.push(false);
		g.goTo(end);
		g.mark(isNull);
		g.push(true);
		g.mark(end);
		return BOOLEAN_TYPE;
	}
}
