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
import org.objectweb.asm.commons.Method;

import static io.binpack.codegen.util.TypeChecks.checkType;
import static io.binpack.codegen.util.TypeChecks.isAssignable;
import static io.binpack.codegen.util.Utils.invokeVirtualOrInterface;
import static io.binpack.codegen.util.Utils.isPrimitiveType;
import static org.objectweb.asm.Type.BOOLEAN_TYPE;
import static org.objectweb.asm.Type.INT_TYPE;

/**
 * A {@code boolean} comparison of two values of the same kind. Primitives are compared by value,
 * references with {@link Object#equals} for (in)equality and with {@link Comparable#compareTo} for ordering.
 */
final class Expression_Compare implements Expression {
	private static final Type OBJECT_TYPE = Type.getType(Object.class);
	private static final Method EQUALS = new Method("equals", BOOLEAN_TYPE, new Type[]{OBJECT_TYPE});
	private static final Method COMPARE_TO = new Method("compareTo", INT_TYPE, new Type[]{OBJECT_TYPE});

	enum Operation {
		EQ(GeneratorAdapter.EQ),
		NE(GeneratorAdapter.NE),
		LT(GeneratorAdapter.LT),
		GT(GeneratorAdapter.GT);

		final int mode;

		Operation(int mode) {
			this.mode = mode;
		}
	}

	private final Operation operation;
	private final Expression left;
	private final Expression right;

	Expression_Compare(Operation operation, Expression left, Expression right) {
		this.operation = operation;
		this.left = left;
		this.right = right;
	}

	@Override
	public Type load(Context ctx) {
		GeneratorAdapter g = ctx.getGeneratorAdapter();
		Type leftType = left.load(ctx);
		checkType(leftType, isAssignable());
		Type rightType = right.load(ctx);
		checkType(rightType, isAssignable());

		boolean primitive = isPrimitiveType(leftType);
		if (primitive != isPrimitiveType(rightType) || primitive && leftType.getSort() != rightType.getSort()) {
			throw new IllegalArgumentException("Cannot compare " + leftType.getClassName() + " with " + rightType.getClassName());
		}

		Label holds = new Label();
		Label end = new Label();
		if (primitive) {
			g.ifCmp(leftType, operation.mode, holds);
		} else if (operation == Operation.EQ || operation == Operation.NE) {
			invokeVirtualOrInterface(ctx, leftType, EQUALS);
			// equals leaves 1 for equal values
			g.ifZCmp(operation == Operation.EQ ? GeneratorAdapter.NE : GeneratorAdapter.EQ, holds);
		} else {
			invokeVirtualOrInterface(ctx, leftType, COMPARE_TO);
			g.ifZCmp(operation.mode, holds);
		}
		g.push(false);
		g.goTo(end);
		g.mark(holds);
		g.push(true);
		g.mark(end);
		return BOOLEAN_TYPE;
	}
}
