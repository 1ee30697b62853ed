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

package io.binpack.codegen.util;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.Type;

import java.util.List;
import java.util.function.Predicate;

import static io.binpack.codegen.util.Utils.isEqualType;
import static org.objectweb.asm.Type.*;

/**
 * Operand checks of generated expressions. A {@code null} type stands for an expression that always throws.
 */
public final class TypeChecks {
	private TypeChecks() {
	}

	@Contract("null, _ -> fail")
	public static void checkType(@Nullable Type type, Predicate<@Nullable Type> predicate) {
		checkType(type, predicate, type == null ?
				"Operand always throws and has no value" :
				"Operand of type " + type.getClassName() + " is not allowed here");
	}

	@Contract("null, _, _ -> fail")
	public static void checkType(@Nullable Type type, Predicate<@Nullable Type> predicate, String message) {
		if (!predicate.test(type)) throw new IllegalArgumentException(message);
	}

	public static Predicate<@Nullable Type> isNotThrow() {
		return type -> type != null;
	}

	public static Predicate<@Nullable Type> is(Type type, Type... otherTypes) {
		List<Type> allowed = List.of(otherTypes);
		return tested -> tested != null &&
				(isEqualType(tested, type) || allowed.stream().anyMatch(other -> isEqualType(tested, other)));
	}

	public static Predicate<@Nullable Type> isWidenedToInt() {
		return sortWithin(CHAR, INT);
	}

	public static Predicate<@Nullable Type> isArithmetic() {
		return sortWithin(CHAR, DOUBLE);
	}

	public static Predicate<@Nullable Type> isAssignable() {
		return sortWithin(BOOLEAN, OBJECT);
	}

	public static Predicate<@Nullable Type> isObject() {
		return sortWithin(OBJECT, OBJECT);
	}

	public static Predicate<@Nullable Type> isArray() {
		return sortWithin(ARRAY, ARRAY);
	}

	// relies on the order of ASM sorts: VOID, BOOLEAN, CHAR, BYTE, SHORT, INT, FLOAT, LONG, DOUBLE, ARRAY, OBJECT
	private static Predicate<@Nullable Type> sortWithin(int lowest, int highest) {
		return type -> type != null && type.getSort() >= lowest && type.getSort() <= highest;
	}
}
