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
import java.lang.reflect.UndeclaredThrowableException;

import static io.binpack.common.Checks.checkArgument;

/**
 * Reads a public field, {@code owner} is {@code null} for static fields
 */
public final class FieldNode extends Node {
	private final @Nullable Node owner;
	private final Field field;

	FieldNode(@Nullable Node owner, Field field) {
		super(field.getType());
		checkArgument((owner == null) == Modifier.isStatic(field.getModifiers()),
				"Owner must be given for instance fields only: %s", field);
		this.owner = owner;
		this.field = field;
	}

	public @Nullable Node getOwner() {
		return owner;
	}

	public Field getField() {
		return field;
	}

	@Override
	Evaluator compile(CompilationScope scope) {
		MethodHandle getter;
		try {
			getter = MethodHandles.publicLookup().unreflectGetter(field);
		} catch (IllegalAccessException e) {
			throw new IllegalArgumentException("Field " + field + " is not accessible", e);
		}
		if (owner == null) {
			return frame -> invoke(getter);
		}
		Evaluator owner = this.owner.compile(scope);
		return frame -> invoke(getter, owner.evaluate(frame));
	}

	static Object invoke(MethodHandle handle, Object... arguments) {
		try {
			return handle.invokeWithArguments(arguments);
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new UndeclaredThrowableException(e);
		}
	}

	@Override
	public String toString() {
		return (owner != null ? owner.toString() : field.getDeclaringClass().getSimpleName()) + '.' + field.getName();
	}
}
