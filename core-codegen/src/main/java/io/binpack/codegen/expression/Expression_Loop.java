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
import static io.binpack.codegen.util.TypeChecks.is;
import static org.objectweb.asm.Type.BOOLEAN_TYPE;
import static org.objectweb.asm.Type.VOID_TYPE;

/**
 * A {@code while} loop. Locals first used by the condition are stored before the body runs.
 */
final class Expression_Loop implements Expression {
	private final Expression condition;
	private final Expression body;

	Expression_Loop(Expression condition, Expression body) {
		this.condition = condition;
		this.body = body;
	}

	@Override
	public Type load(Context ctx) {
		GeneratorAdapter g = ctx.getGeneratorAdapter();
		Label test = g.mark();
		Label exit = new Label();

		checkType(condition.load(ctx), is(BOOLEAN_TYPE), "Loop condition is not boolean");
		g.ifZCmp(GeneratorAdapter.EQ, exit);
		ctx.discard(body.load(ctx));
		g.goTo(test);

		g.mark(exit);
		return VOID_TYPE;
	}
}
