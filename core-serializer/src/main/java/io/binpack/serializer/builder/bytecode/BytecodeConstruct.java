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

package io.binpack.serializer.builder.bytecode;

import io.binpack.codegen.expression.DeclaredLocal;
import io.binpack.codegen.expression.Expression;
import io.binpack.serializer.builder.Construct;
import org.jetbrains.annotations.Nullable;

/**
 * An {@link Expression} together with the Java type of its value
 */
public final class BytecodeConstruct implements Construct {
	private final Expression expression;
	private final Class<?> type;
	private final @Nullable DeclaredLocal local;
	private final @Nullable DeclaredLocal assignedLocal;
	private final boolean nullConstant;

	private BytecodeConstruct(Expression expression, Class<?> type, @Nullable DeclaredLocal local,
			@Nullable DeclaredLocal assignedLocal, boolean nullConstant) {
		this.expression = expression;
		this.type = type;
		this.local = local;
		this.assignedLocal = assignedLocal;
		this.nullConstant = nullConstant;
	}

	public static BytecodeConstruct of(Expression expression, Class<?> type) {
		return new BytecodeConstruct(expression, type, null, null, false);
	}

	static BytecodeConstruct ofLocal(DeclaredLocal local) {
		return new BytecodeConstruct(local, local.getType(), local, null, false);
	}

	static BytecodeConstruct ofAssignment(Expression expression, DeclaredLocal assignedLocal) {
		return new BytecodeConstruct(expression, void.class, null, assignedLocal, false);
	}

	static BytecodeConstruct ofNull(Expression expression, Class<?> type) {
		return new BytecodeConstruct(expression, type, null, null, true);
	}

	public Expression getExpression() {
		return expression;
	}

	@Override
	public Class<?> getType() {
		return type;
	}

	/**
	 * Returns a local this construct refers to, if it is a bare reference to a local
	 */
	public @Nullable DeclaredLocal getLocal() {
		return local;
	}

	/**
	 * Returns a local this construct stores a value to, if it is an assignment of a local
	 */
	public @Nullable DeclaredLocal getAssignedLocal() {
		return assignedLocal;
	}

	public boolean isNullConstant() {
		return nullConstant;
	}

	@Override
	public String toString() {
		return "BytecodeConstruct{" + (local != null ? local : expression.getClass().getSimpleName()) + ':' + type.getSimpleName() + '}';
	}
}
