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

package io.binpack.serializer.reflection;

import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;

import static io.binpack.common.Checks.checkArgument;
import static io.binpack.common.Checks.checkState;
import static java.util.stream.Collectors.joining;
import static java.util.stream.Collectors.toList;

/**
 * A target of an invocation in generated code.
 * <p>
 * It is either a runtime method, or a helper that is generated together with a serializer.
 * A helper is invoked through an instance of its functional interface, whose first parameter
 * is always the serializer itself; {@link #getParameterTypes()} of a helper exclude that parameter.
 */
public final class MethodDefinition {
	private final String name;
	private final Class<?> declaringType;
	private final Class<?> returnType;
	private final List<Class<?>> parameterTypes;
	private final boolean isStatic;

	private final @Nullable Method method;
	private final @Nullable Class<?> delegateType;

	private MethodDefinition(String name, Class<?> declaringType, Class<?> returnType, List<Class<?>> parameterTypes,
			boolean isStatic, @Nullable Method method, @Nullable Class<?> delegateType) {
		this.name = name;
		this.declaringType = declaringType;
		this.returnType = returnType;
		this.parameterTypes = parameterTypes;
		this.isStatic = isStatic;
		this.method = method;
		this.delegateType = delegateType;
	}

	public static MethodDefinition of(Method method) {
		return new MethodDefinition(method.getName(), method.getDeclaringClass(), method.getReturnType(),
				List.of(method.getParameterTypes()), Modifier.isStatic(method.getModifiers()), method, null);
	}

	/**
	 * Resolves a public method by exact parameter types
	 *
	 * @throws UnresolvedMemberException if there is no such method
	 */
	public static MethodDefinition resolve(Class<?> declaringType, String name, Class<?>... parameterTypes) {
		try {
			return of(declaringType.getMethod(name, parameterTypes));
		} catch (NoSuchMethodException e) {
			throw new UnresolvedMemberException("No method " + declaringType.getName() + '#' + name +
					Arrays.stream(parameterTypes).map(Class::getSimpleName).collect(joining(", ", "(", ")")), e);
		}
	}

	/**
	 * Resolves a public method by name only
	 *
	 * @throws UnresolvedMemberException if there is no method with such name
	 * @throws AmbiguousMemberException  if the method is overloaded
	 */
	public static MethodDefinition resolve(Class<?> declaringType, String name) {
		List<Method> candidates = Arrays.stream(declaringType.getMethods())
				.filter(m -> m.getName().equals(name) && !m.isBridge())
				.collect(toList());
		return of(single(declaringType, name, candidates));
	}

	/**
	 * Resolves a public two-parameter method that accepts a key and a value, like {@code Map.put}
	 *
	 * @throws UnresolvedMemberException if no method accepts given types
	 * @throws AmbiguousMemberException  if more than one method accepts given types
	 */
	public static MethodDefinition resolveIndexed(Class<?> declaringType, String name, Class<?> keyType, Class<?> valueType) {
		List<Method> candidates = Arrays.stream(declaringType.getMethods())
				.filter(m -> m.getName().equals(name) && !m.isBridge() && !Modifier.isStatic(m.getModifiers()))
				.filter(m -> m.getParameterCount() == 2 &&
						isAssignable(m.getParameterTypes()[0], keyType) &&
						isAssignable(m.getParameterTypes()[1], valueType))
				.collect(toList());
		return of(single(declaringType, name, candidates));
	}

	/**
	 * Describes a helper invoked through an instance of a functional interface
	 *
	 * @param name         name of the helper, unique within a serializer
	 * @param delegateType a functional interface, its first parameter receives the serializer
	 */
	public static MethodDefinition helper(String name, Class<?> delegateType) {
		Method method = findAbstractMethod(delegateType);
		checkArgument(method.getParameterCount() >= 1, "Helper delegate %s should accept a serializer", delegateType.getName());
		List<Class<?>> parameterTypes = List.of(method.getParameterTypes()).subList(1, method.getParameterCount());
		return new MethodDefinition(name, delegateType, method.getReturnType(), List.copyOf(parameterTypes), false, null, delegateType);
	}

	/**
	 * Returns the single abstract method of a functional interface
	 */
	public static Method findAbstractMethod(Class<?> functionalInterface) {
		checkArgument(functionalInterface.isInterface(), "Not an interface: %s", functionalInterface.getName());
		List<Method> methods = Arrays.stream(functionalInterface.getMethods())
				.filter(m -> Modifier.isAbstract(m.getModifiers()))
				.collect(toList());
		checkArgument(methods.size() == 1, "Not a functional interface: %s", functionalInterface.getName());
		return methods.get(0);
	}

	private static Method single(Class<?> declaringType, String name, List<Method> candidates) {
		if (candidates.isEmpty()) {
			throw new UnresolvedMemberException("No method " + declaringType.getName() + '#' + name);
		}
		if (candidates.size() > 1) {
			throw new AmbiguousMemberException("Ambiguous method " + declaringType.getName() + '#' + name + ": " + candidates);
		}
		return candidates.get(0);
	}

	private static boolean isAssignable(Class<?> to, Class<?> from) {
		if (to.isPrimitive() || from.isPrimitive()) return to == from;
		return to.isAssignableFrom(from);
	}

	public String getName() {
		return name;
	}

	public Class<?> getDeclaringType() {
		return declaringType;
	}

	public Class<?> getReturnType() {
		return returnType;
	}

	public List<Class<?>> getParameterTypes() {
		return parameterTypes;
	}

	public boolean isStatic() {
		return isStatic;
	}

	public boolean isHelper() {
		return delegateType != null;
	}

	public Method getMethod() {
		checkState(method != null, "Helper %s has no runtime method", name);
		return method;
	}

	public Class<?> getDelegateType() {
		checkState(delegateType != null, "Method %s is not a helper", name);
		return delegateType;
	}

	@Override
	public String toString() {
		return declaringType.getSimpleName() + '#' + name +
				parameterTypes.stream().map(Class::getSimpleName).collect(joining(", ", "(", ")"));
	}
}
