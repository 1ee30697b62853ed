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

import static io.binpack.codegen.util.TypeChecks.checkType;
import static io.binpack.codegen.util.TypeChecks.isNotThrow;
import static org.objectweb.asm.Type.VOID_TYPE;

/**
 * Statements run in order. Values of all but the last one are dropped.
 */
final class Expression_Sequence implements Expression {
	private final List<Expression> expressions;

	Expression_Sequence(List<Expression> expressions) {
		this.expressions = expressions;
	}

	List<Expression> getExpressions() {
		return expressions;
	}

	@Override
	public @Nullable Type load(Context ctx) {
		Type last = VOID_TYPE;
		for (Expression expression : expressions) {
			checkType(last, isNotThrow(), "Unreachable statement after an expression that always throws");
			ctx.discard(last);
			ctx.markSequencePoint();
			last = expression.load(ctx);
		}
		return last;
	}
}
