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
import org.objectweb.asm.commons.GeneratorAdapter;

import static io.binpack.codegen.util.TypeChecks.checkType;
import static io.binpack.codegen.util.TypeChecks.isArithmetic;

/**
 * Adds one to a numeric variable in place
 */
final class Expression_Increment implements Expression {
	private final Variable variable;

	Expression_Increment(Variable variable) {
		this.variable = variable;
	}

	@Override
	public Type load(Context ctx) {
		GeneratorAdapter g = ctx.getGeneratorAdapter();
		Object storeContext = variable.beginStore(ctx);
		Type type = variable.load(ctx);
		checkType(type, isArithmetic());
		switch (type.getSort()) {
			case Type.LONG -> g.push(1L);
			case Type.FLOAT -> g.push(1.0f);
			case Type.DOUBLE -> g.push(1.0d);
			default -> g.push(1);
		}
		g.math(GeneratorAdapter.ADD, type);
		variable.store(ctx, storeContext, type);
		return Type.VOID_TYPE;
	}
}
