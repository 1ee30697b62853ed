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

package io.binpack.serializer.graph;

import org.jetbrains.annotations.Nullable;

import static io.binpack.common.Checks.checkArgument;

/**
 * A value bound into the graph when it is built
 */
public final class ConstantNode extends Node {
	private final @Nullable Object value;

	ConstantNode(@Nullable Object value, Class<?> type) {
		super(type);
		checkArgument(value != null || !type.isPrimitive(), "Primitive %s constant cannot be null", type);
		checkArgument(value == null || type.isPrimitive() || type.isInstance(value),
				"Constant %s is not an instance of %s", value, type);
		this.value = type.isPrimitive() ? Conversions.convert(value, value.getClass(), type) : value;
	}

	public @Nullable Object getValue() {
		return value;
	}

	@Override
	Evaluator compile(CompilationScope scope) {
		Object value = this.value;
		return frame -> value;
	}

	@Override
	public String toString() {
		return String.valueOf(value);
	}
}
