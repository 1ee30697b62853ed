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

import java.util.List;

/**
 * A sequence that owns a set of named local variables.
 * Each variable is allocated and set to its default value before the first statement.
 */
final class Expression_Block implements Expression {
	private final List<DeclaredLocal> variables;
	private final Expression body;

	Expression_Block(List<DeclaredLocal> variables, Expression body) {
		this.variables = variables;
		this.body = body;
	}

	@Override
	public @Nullable Type load(Context ctx) {
		for (DeclaredLocal variable : variables) {
			ctx.declareLocal(variable);
		}
		return body.load(ctx);
	}
}
