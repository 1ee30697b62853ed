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

import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.objectweb.asm.Type.getType;

/**
 * Static factories of {@link Expression}s
 */
public class Expressions {
	/**
	 * Returns a new constant for the value
	 *
	 * @param value value which will be created as constant
	 * @return new instance of the constant expression
	 */
	public static Expression_Constant value(Object value) {
		return new Expression_Constant(value);
	}

	/**
	 * Returns a new constant for the value of a given type
	 *
	 * @param value value which will be created as constant
	 * @param type  actual type of value
	 * @return new instance of the constant expression
	 */
	public static Expression_Constant value(Object value, Class<?> type) {
		return new Expression_Constant(value, type);
	}

	public static Expression nullRef(Class<?> type) {
		return new Expression_Null(getType(type));
	}

	public static Expression voidExp() {
		return Expression_Void.INSTANCE;
	}

	/**
	 * @see #sequence(List)
	 */
	public static Expression sequence(Expression... parts) {
		return sequence(List.of(parts));
	}

	/**
	 * Returns a sequence of operations which will be processed one after the other.
	 * Nested sequences are flattened
	 *
	 * @param parts list of operations
	 * @return new instance of the sequence expression
	 */
	public static Expression sequence(List<Expression> parts) {
		List<Expression> list = new ArrayList<>(parts.size());
		for (Expression part : parts) {
			if (part instanceof Expression_Sequence) {
				list.addAll(((Expression_Sequence) part).getExpressions());
			} else {
				list.add(part);
			}
		}
		return new Expression_Sequence(list);
	}

	/**
	 * Returns a sequence that owns the given named local variables
	 *
	 * @param variables variables that are initialized to default values before the first statement
	 * @param parts     list of operations
	 */
	public static Expression block(List<DeclaredLocal> variables, List<Expression> parts) {
		return new Expression_Block(List.copyOf(variables), sequence(parts));
	}

	/**
	 * Returns an expression that represents a new local variable with some action applied to it
	 *
	 * @param expression initial value of a new local variable
	 * @param fn         function applied to a new local variable
	 */
	public static Expression let(Expression expression, Function<Variable, Expression> fn) {
		Variable variable = new Expression_Let(expression);
		return sequence(variable, fn.apply(variable));
	}

	public static DeclaredLocal declaredLocal(Class<?> type, String name) {
		return new DeclaredLocal(type, name);
	}

	/**
	 * Sets the value from the argument 'from' to the argument 'to'
	 *
	 * @param to   variable which will be changed
	 * @param from variable which changes
	 */
	public static Expression set(StoreDef to, Expression from) {
		return new Expression_Set(to, from);
	}

	/**
	 * Casts expression to the type, boxing and unboxing primitives if needed
	 */
	public static Expression cast(Expression expression, Class<?> type) {
		return new Expression_Cast(expression, getType(type));
	}

	/**
	 * Returns an argument of the method being generated
	 *
	 * @param argument ordinal number of an argument, starting from 0
	 */
	public static Variable arg(int argument) {
		return new Expression_VarArg(argument);
	}

	public static Variable field(@Nullable Expression owner, Field field) {
		return new Expression_Field(owner, field);
	}

	/**
	 * Returns a static field declared by the class being generated
	 */
	public static Variable staticField(String name) {
		return new Expression_StaticField(name);
	}

	/**
	 * Returns a call of an instance method, resolved by name and argument types
	 */
	public static Expression call(Expression owner, String methodName, Expression... arguments) {
		return new Expression_Call(owner, methodName, List.of(arguments));
	}

	public static Expression staticCall(Class<?> owner, String methodName, Expression... arguments) {
		return new Expression_StaticCall(owner, methodName, List.of(arguments));
	}

	/**
	 * Returns a call of an exact method, {@code owner} must be {@code null} for static methods
	 */
	public static Expression invoke(@Nullable Expression owner, Method method, List<Expression> arguments) {
		return new Expression_Invoke(owner, method, List.copyOf(arguments));
	}

	/**
	 * Returns a new instance of the class, the constructor is resolved by argument types
	 */
	public static Expression constructor(Class<?> type, Expression... arguments) {
		return new Expression_Constructor(type, List.of(arguments));
	}

	public static Expression constructor(Constructor<?> constructor, List<Expression> arguments) {
		return new Expression_Constructor(constructor, List.copyOf(arguments));
	}

	public static Expression arrayNew(Class<?> arrayType, Expression length) {
		return new Expression_ArrayNew(arrayType, length);
	}

	/**
	 * Returns a new array filled with the given elements
	 */
	public static Expression arrayNewInit(Class<?> arrayType, List<Expression> elements) {
		return let(arrayNew(arrayType, value(elements.size())), array -> {
			List<Expression> parts = new ArrayList<>();
			for (int i = 0; i < elements.size(); i++) {
				parts.add(arraySet(array, value(i), elements.get(i)));
			}
			parts.add(array);
			return sequence(parts);
		});
	}

	public static Expression arrayGet(Expression array, Expression index) {
		return new Expression_ArrayGet(array, index);
	}

	public static Expression arraySet(Expression array, Expression index, Expression value) {
		return new Expression_ArraySet(array, index, value);
	}

	public static Expression length(Expression array) {
		return new Expression_ArrayLength(array);
	}

	/**
	 * Returns a conditional expression, the condition must be of a {@code boolean} type
	 */
	public static Expression ifElse(Expression condition, Expression expressionTrue, Expression expressionFalse) {
		return new Expression_If(condition, expressionTrue, expressionFalse);
	}

	/**
	 * Compares primitives by value and objects with {@link Object#equals}
	 */
	public static Expression isEq(Expression left, Expression right) {
		return new Expression_Compare(Expression_Compare.Operation.EQ, left, right);
	}

	public static Expression isNe(Expression left, Expression right) {
		return new Expression_Compare(Expression_Compare.Operation.NE, left, right);
	}

	/**
	 * Compares primitives by value and objects with {@link Comparable#compareTo}
	 */
	public static Expression isLt(Expression left, Expression right) {
		return new Expression_Compare(Expression_Compare.Operation.LT, left, right);
	}

	public static Expression isGt(Expression left, Expression right) {
		return new Expression_Compare(Expression_Compare.Operation.GT, left, right);
	}

	public static Expression isNull(Expression expression) {
		return new Expression_IsNull(expression);
	}

	public static Expression not(Expression expression) {
		return new Expression_If(expression, value(false), value(true));
	}

	/**
	 * Returns a short-circuit conjunction of boolean expressions, {@code true} if there are none
	 */
	public static Expression and(List<Expression> predicates) {
		Expression result = value(true);
		for (int i = predicates.size() - 1; i >= 0; i--) {
			result = new Expression_If(predicates.get(i), result, value(false));
		}
		return result;
	}

	public static Expression loop(Expression condition, Expression body) {
		return new Expression_Loop(condition, body);
	}

	/**
	 * Evaluates the body for every index from {@code 0} inclusive to {@code count} exclusive
	 */
	public static Expression iterate(Expression count, Function<Expression, Expression> forIndex) {
		return let(value(0), index ->
				let(count, limit ->
						loop(isLt(index, limit),
								sequence(forIndex.apply(index), increment(index)))));
	}

	public static Expression increment(Variable variable) {
		return new Expression_Increment(variable);
	}

	public static Expression tryFinally(Expression tryBlock, Expression finallyBlock) {
		return new Expression_TryFinally(tryBlock, finallyBlock);
	}

	public static Expression throwException(Expression exception) {
		return new Expression_Throw(exception);
	}
}
