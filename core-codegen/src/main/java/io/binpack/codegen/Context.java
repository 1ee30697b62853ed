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

package io.binpack.codegen;

import io.binpack.codegen.expression.DeclaredLocal;
import io.binpack.codegen.expression.Expression;
import io.binpack.codegen.expression.Expression_VarLocal;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.Label;
import org.objectweb.asm.Type;
import org.objectweb.asm.commons.GeneratorAdapter;
import org.objectweb.asm.commons.Method;

import java.lang.reflect.Executable;
import java.lang.reflect.Modifier;
import java.util.*;

import static io.binpack.codegen.util.TypeChecks.checkType;
import static io.binpack.codegen.util.TypeChecks.isAssignable;
import static io.binpack.codegen.util.TypeChecks.isNotThrow;
import static io.binpack.codegen.util.Utils.*;
import static java.lang.String.format;
import static java.util.stream.Collectors.joining;
import static org.objectweb.asm.Opcodes.ACONST_NULL;
import static org.objectweb.asm.Opcodes.INVOKESTATIC;
import static org.objectweb.asm.Type.*;

/**
 * State of a single method body while its expressions emit bytecode: the generator,
 * the local variables allocated so far, and the conversions and member lookups the expressions share
 */
public final class Context {
	private static final Type OBJECT_TYPE = getType(Object.class);
	private static final Map<Integer, Class<?>> PRIMITIVE_SORTS = Map.of(
			VOID, void.class, BOOLEAN, boolean.class, CHAR, char.class, BYTE, byte.class, SHORT, short.class,
			INT, int.class, FLOAT, float.class, LONG, long.class, DOUBLE, double.class);
	private static final List<java.lang.reflect.Method> OBJECT_METHODS = instanceMethods(Object.class);

	private final ClassLoader classLoader;
	private final ClassBuilder<?> classBuilder;
	private final GeneratorAdapter g;
	private final Type selfType;
	private final Method method;

	private final Map<Object, Expression_VarLocal> letLocals = new HashMap<>();
	private final Map<DeclaredLocal, Expression_VarLocal> declaredLocals = new HashMap<>();

	public Context(ClassLoader classLoader, ClassBuilder<?> builder, GeneratorAdapter g, Type selfType, Method method) {
		this.classLoader = classLoader;
		this.classBuilder = builder;
		this.g = g;
		this.selfType = selfType;
		this.method = method;
	}

	public ClassBuilder<?> getClassBuilder() {
		return classBuilder;
	}

	public GeneratorAdapter getGeneratorAdapter() {
		return g;
	}

	public Type getSelfType() {
		return selfType;
	}

	public Map<String, Class<?>> getFields() {
		return classBuilder.fields;
	}

	public Method getMethod() {
		return method;
	}

	// region locals
	public Expression_VarLocal newLocal(Type type) {
		return type == VOID_TYPE ? Expression_VarLocal.VAR_LOCAL_VOID : new Expression_VarLocal(g.newLocal(type));
	}

	/**
	 * Returns the local bound to the key. The first request evaluates the expression
	 * at the current position and stores its value in a new local.
	 */
	public Expression_VarLocal ensureLocal(Object key, Expression expression) {
		Expression_VarLocal local = letLocals.get(key);
		if (local != null) return local;
		Type type = expression.load(this);
		checkType(type, isNotThrow());
		local = newLocal(type);
		local.store(this);
		letLocals.put(key, local);
		return local;
	}

	/**
	 * Allocates the slot of a named local and stores the default value of its type there.
	 * A local that already has a slot keeps it.
	 */
	public Expression_VarLocal declareLocal(DeclaredLocal variable) {
		Expression_VarLocal local = declaredLocals.get(variable);
		if (local != null) return local;
		Class<?> type = variable.getType();
		local = newLocal(getType(type));
		pushDefault(type);
		local.store(this);
		declaredLocals.put(variable, local);
		return local;
	}

	/**
	 * Same as {@link #declareLocal} for a local that is used outside of any block declaring it
	 */
	public Expression_VarLocal ensureDeclaredLocal(DeclaredLocal variable) {
		return declareLocal(variable);
	}

	private void pushDefault(Class<?> type) {
		if (!type.isPrimitive()) {
			g.visitInsn(ACONST_NULL);
		} else if (type == long.class) {
			g.push(0L);
		} else if (type == float.class) {
			g.push(0.0f);
		} else if (type == double.class) {
			g.push(0.0);
		} else if (type == boolean.class) {
			g.push(false);
		} else {
			g.push(0);
		}
	}

	/**
	 * Drops a value of the given type from the stack. Nothing is on the stack
	 * after a void expression or after one that always throws.
	 */
	public void discard(@Nullable Type type) {
		if (type == null) return;
		if (type.getSize() == 2) {
			g.pop2();
		} else if (type.getSize() == 1) {
			g.pop();
		}
	}

	/**
	 * Gives the next statement its own line number if the class carries debug information
	 */
	public void markSequencePoint() {
		if (!classBuilder.isDebugInfo()) return;
		Label label = g.mark();
		g.visitLineNumber(classBuilder.nextLineNumber(), label);
	}
	// endregion

	// region types
	/**
	 * Returns the type both branches of a conditional can be assigned to
	 */
	public @Nullable Type unifyTypes(@Nullable Type type1, @Nullable Type type2) {
		if (type1 == null || type2 == null) return type1 == null ? type2 : type1;
		if (type1.equals(type2)) return type1;
		if (isReference(type1) && isReference(type2)) {
			Class<?> class1 = toJavaType(type1);
			Class<?> class2 = toJavaType(type2);
			if (class1.isAssignableFrom(class2)) return type1;
			if (class2.isAssignableFrom(class1)) return type2;
			return OBJECT_TYPE;
		}
		if (type1.getSort() == type2.getSort()) return type1;
		throw new IllegalArgumentException(format("Branches of %s and %s have no common type. %s",
				type1.getClassName(), type2.getClassName(), exceptionInGeneratedClass(this)));
	}

	private static boolean isReference(Type type) {
		return type.getSort() == OBJECT || type.getSort() == ARRAY;
	}

	public Class<?> toJavaType(Type type) {
		Class<?> primitive = PRIMITIVE_SORTS.get(type.getSort());
		if (primitive != null) return primitive;
		if (type.equals(selfType)) {
			throw new IllegalArgumentException("Class " + type.getClassName() + " is being generated and cannot be loaded");
		}
		String name = type.getSort() == ARRAY ? type.getDescriptor().replace('/', '.') : type.getClassName();
		try {
			return Class.forName(name, false, classLoader);
		} catch (ClassNotFoundException e) {
			throw new IllegalArgumentException("Class " + name + " is not visible to the class loader of generated code", e);
		}
	}

	/**
	 * Converts the value on top of the stack. Primitives are boxed, unboxed and widened or narrowed
	 * as needed, references are checked against the target type unless it is a supertype.
	 */
	public void cast(Type from, Type to) {
		if (from.equals(to)) return;
		if (to == VOID_TYPE) {
			discard(from);
			return;
		}
		if (from == VOID_TYPE) {
			throw new IllegalArgumentException(format("A void expression has no value to convert to %s. %s",
					to.getClassName(), exceptionInGeneratedClass(this)));
		}

		if (isValueType(from) && isValueType(to)) {
			convertValue(from, to);
		} else if (isPrimitiveType(from)) {
			g.box(from);
			if (!toJavaType(to).isAssignableFrom(toJavaType(wrap(from)))) {
				g.checkCast(to);
			}
		} else if (isPrimitiveType(to)) {
			Type wrapper = wrap(to);
			g.checkCast(wrapper);
			convertValue(wrapper, to);
		} else if (!toJavaType(to).isAssignableFrom(toJavaType(from))) {
			g.checkCast(to);
		}
	}

	private static boolean isValueType(Type type) {
		return isPrimitiveType(type) || isWrapperType(type);
	}

	private void convertValue(Type from, Type to) {
		Type source = from;
		if (isWrapperType(from)) {
			source = unwrap(from);
			g.invokeVirtual(from, unwrapToPrimitive(source));
		}
		Type target = isWrapperType(to) ? unwrap(to) : to;
		if (source.getSort() != target.getSort()) {
			g.cast(source, target);
		}
		if (isWrapperType(to)) {
			g.valueOf(target);
		}
	}
	// endregion

	// region member lookup
	/**
	 * Calls the most specific public instance method of the owner that accepts the arguments
	 */
	public Type invoke(Expression owner, String methodName, List<Expression> arguments) {
		Type ownerType = owner.load(this);
		checkType(ownerType, isAssignable());
		Class<?> ownerClass = toJavaType(ownerType);
		Class<?>[] argumentTypes = loadArguments(arguments);

		List<java.lang.reflect.Method> candidates = instanceMethods(ownerClass);
		if (ownerClass.isInterface()) {
			candidates.addAll(OBJECT_METHODS);
		}
		java.lang.reflect.Method found = mostSpecific(candidates, methodName, argumentTypes);
		if (found == null) {
			throw new IllegalArgumentException("No method " + ownerClass.getName() + '#' + methodName + describe(argumentTypes));
		}
		invokeVirtualOrInterface(this, ownerType, Method.getMethod(found));
		return getType(found.getReturnType());
	}

	public Type invokeStatic(Type ownerType, String methodName, List<Expression> arguments) {
		Class<?> ownerClass = toJavaType(ownerType);
		Class<?>[] argumentTypes = loadArguments(arguments);

		List<java.lang.reflect.Method> candidates = new ArrayList<>();
		for (java.lang.reflect.Method candidate : ownerClass.getMethods()) {
			if (Modifier.isStatic(candidate.getModifiers())) candidates.add(candidate);
		}
		java.lang.reflect.Method found = mostSpecific(candidates, methodName, argumentTypes);
		if (found == null) {
			throw new IllegalArgumentException("No static method " + ownerClass.getName() + '.' + methodName + describe(argumentTypes));
		}
		Method asmMethod = Method.getMethod(found);
		g.visitMethodInsn(INVOKESTATIC, ownerType.getInternalName(), asmMethod.getName(), asmMethod.getDescriptor(),
				ownerClass.isInterface());
		return asmMethod.getReturnType();
	}

	public Type invokeConstructor(Type ownerType, List<Expression> arguments) {
		Class<?> ownerClass = toJavaType(ownerType);
		g.newInstance(ownerType);
		g.dup();
		Class<?>[] argumentTypes = loadArguments(arguments);

		java.lang.reflect.Constructor<?> found = mostSpecific(List.of(ownerClass.getConstructors()), null, argumentTypes);
		if (found == null) {
			throw new IllegalArgumentException("No constructor " + ownerClass.getName() + describe(argumentTypes));
		}
		g.invokeConstructor(ownerType, Method.getMethod(found));
		return ownerType;
	}

	private Class<?>[] loadArguments(List<Expression> arguments) {
		Class<?>[] types = new Class<?>[arguments.size()];
		for (int i = 0; i < types.length; i++) {
			Type type = arguments.get(i).load(this);
			checkType(type, isAssignable());
			types[i] = toJavaType(type);
		}
		return types;
	}

	/**
	 * Picks the candidate whose parameters every other applicable candidate accepts.
	 * A {@code null} name matches constructors.
	 */
	private static <E extends Executable> @Nullable E mostSpecific(List<E> candidates, @Nullable String name, Class<?>[] argumentTypes) {
		E best = null;
		for (E candidate : candidates) {
			if (name != null && !name.equals(candidate.getName())) continue;
			Class<?>[] parameters = candidate.getParameterTypes();
			if (!accepts(parameters, argumentTypes)) continue;
			if (best == null || accepts(best.getParameterTypes(), parameters) && !accepts(parameters, best.getParameterTypes())) {
				best = candidate;
			} else if (!accepts(parameters, best.getParameterTypes())) {
				throw new IllegalArgumentException("Ambiguous call of " + candidate.getName() + describe(argumentTypes) +
						": " + best + " or " + candidate);
			}
		}
		return best;
	}

	private static boolean accepts(Class<?>[] parameters, Class<?>[] arguments) {
		if (parameters.length != arguments.length) return false;
		for (int i = 0; i < parameters.length; i++) {
			if (!parameters[i].isAssignableFrom(arguments[i])) return false;
		}
		return true;
	}

	private static List<java.lang.reflect.Method> instanceMethods(Class<?> type) {
		List<java.lang.reflect.Method> methods = new ArrayList<>();
		for (java.lang.reflect.Method candidate : type.getMethods()) {
			if (!Modifier.isStatic(candidate.getModifiers())) methods.add(candidate);
		}
		return methods;
	}

	private static String describe(Class<?>[] argumentTypes) {
		return Arrays.stream(argumentTypes).map(Class::getName).collect(joining(",", "(", ")"));
	}
	// endregion
}
