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
import org.objectweb.asm.Label;
import org.objectweb.asm.Type;
import org.objectweb.asm.commons.GeneratorAdapter;

import static io.binpack.codegen.util.TypeChecks.checkType;
import static io.binpack.codegen.util.TypeChecks.is;
import static org.objectweb.asm.Type.BOOLEAN_TYPE;

final class Expression_If implements Expression {
	private final Expression condition;
	private final Expression then;
	private final Expression otherwise;

	Expression_If(Expression condition, Expression then, Expression otherwise) {
		this.condition = condition;
		this.then = then;
		this.otherwise = otherwise;
	}

	@Override
	public @Nullable Type load(Context ctx) {
		GeneratorAdapter g = ctx.getGeneratorAdapter();
		Label otherwiseLabel = new Label();
		Label end = new Label();

		checkType(condition.load(ctx), is(BOOLEAN_TYPE));
		g.ifZCmp(GeneratorAdapter.EQ, otherwiseLabel);

		Type thenType = then.load(ctx);
		g.goTo(end);

		g.mark(otherwiseLabel);
		Type otherwiseType = otherwise.load(ctx);

		g.mark(end);
		return ctx.unifyTypes(thenType, otherwiseType);
	}
}
