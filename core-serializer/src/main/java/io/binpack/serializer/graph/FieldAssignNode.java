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

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;

import static io.binpack.common.Checks.checkArgument;
import static io.binpack.serializer.graph.FieldNode.invoke;

/**
 * Writes a public non-final field
 */
public final class FieldAssignNode extends Node {
	private final @Nullable Node owner;
	private final Field field;
	private final Node value;

	FieldAssignNode(@Nullable Node owner, Field field, Node value) {
		super(void.class);
		checkArgument((owner == null) == Modifier.isStatic(field.getModifiers()),
				"Owner must be given for instance fields only: %s", field);
		checkArgument(!Modifier.isFinal(field.getModifiers()), "Field %s is final", field);
		checkArgument(Conversions.isConvertible(value.getType(), field.getType()),
				"Cannot assign %s to %s", value.getType().getName(), field);
		this.owner = owner;
		this.field = field;
		this.value = value;
	}

	@Override
	Evaluator compile(CompilationScope scope) {
		MethodHandle setter;
		try {
			setter = MethodHandles.publicLookup().unreflectSetter(field);
		} catch (IllegalAccessException e) {
			throw new IllegalArgumentException("Field " + field + " is not accessible", e);
		}
		Evaluator value = this.value.compile(scope);
		Class<?> from = this.value.getType();
		Class<?> to = field.getType();
		if (owner == null) {
			return frame -> invoke(setter, Conversions.convert(value.evaluate(frame), from, to));
		}
		Evaluator owner = this.owner.compile(scope);
		return frame -> {
			Object instance = owner.evaluate(frame);
			return invoke(setter, instance, Conversions.convert(value.evaluate(frame), from, to));
		};
	}

	@Override
	public String toString() {
		return (owner != null ? owner.toString() : field.getDeclaringClass().getSimpleName()) + '.' + field.getName() +
				" = " + value;
	}
}
