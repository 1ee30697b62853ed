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

import io.binpack.codegen.Context;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.Type;
import org.objectweb.asm.commons.GeneratorAdapter;
import org.objectweb.asm.commons.Method;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static io.binpack.common.Checks.checkArgument;
import static java.lang.String.format;
import static org.objectweb.asm.Type.*;

public final class Utils {
	private static final Type OBJECT_TYPE = Type.getType(Object.class);
	private static final Map<Type, Type> PRIMITIVE_TO_WRAPPER = new HashMap<>();
	private static final Map<String, Type> WRAPPER_TO_PRIMITIVE = new HashMap<>();

	static {
		for (Class<?> primitiveType : Primitives.allPrimitiveTypes()) {
			Type primitive = getType(primitiveType);
			Type wrapper = getType(Primitives.wrap(primitiveType));
			PRIMITIVE_TO_WRAPPER.put(primitive, wrapper);
			WRAPPER_TO_PRIMITIVE.put(wrapper.getClassName(), primitive);
		}
		PRIMITIVE_TO_WRAPPER.put(VOID_TYPE, getType(Void.class));
	}

	private Utils() {
	}

	/**
	 * Primitive types are equal by sort, reference types by descriptor
	 */
	public static boolean isEqualType(@Nullable Type type1, @Nullable Type type2) {
		if (type1 == null || type2 == null) return type1 == type2;
		if (type1.getSort() != type2.getSort()) return false;
		return type1.getSort() <= DOUBLE || type1.equals(type2);
	}

	public static boolean isPrimitiveType(Type type) {
		return PRIMITIVE_TO_WRAPPER.containsKey(type) && type.getSort() != VOID;
	}

	public static boolean isWrapperType(Type type) {
		return type.getSort() == OBJECT && WRAPPER_TO_PRIMITIVE.containsKey(type.getClassName());
	}

	/**
	 * Returns the unboxing method of a wrapper, such as {@code int intValue()} for {@code int}
	 */
	public static Method unwrapToPrimitive(Type primitiveType) {
		checkArgument(isPrimitiveType(primitiveType), () -> "No unboxing method for " + primitiveType.getClassName());
		return new Method(primitiveType.getClassName() + "Value", primitiveType, new Type[0]);
	}

	public static Type wrap(Type type) {
		Type wrapper = PRIMITIVE_TO_WRAPPER.get(type);
		checkArgument(wrapper != null, () -> type.getClassName() + " is not primitive");
		return wrapper;
	}

	public static Type unwrap(Type type) {
		Type primitive = type.getSort() == OBJECT ? WRAPPER_TO_PRIMITIVE.get(type.getClassName()) : null;
		checkArgument(primitive != null, () -> type.getClassName() + " is not a wrapper type");
		return primitive;
	}

	public static void invokeVirtualOrInterface(Context context, Type owner, Method method) {
		GeneratorAdapter g = context.getGeneratorAdapter();
		Class<?> ownerClass = context.toJavaType(owner);
		if (!ownerClass.isInterface()) {
			g.invokeVirtual(owner, method);
			return;
		}

		if (!hasMethod(context, ownerClass, method) && hasMethod(context, Object.class, method)) {
			g.invokeVirtual(OBJECT_TYPE, method);
		} else {
			g.invokeInterface(owner, method);
		}
	}

	private static boolean hasMethod(Context context, Class<?> owner, Method method) {
		Type[] argumentTypes = method.getArgumentTypes();
		Class<?>[] parameterTypes = new Class[argumentTypes.length];
		for (int i = 0; i < argumentTypes.length; i++) {
			parameterTypes[i] = context.toJavaType(argumentTypes[i]);
		}

		try {
			owner.getMethod(method.getName(), parameterTypes);
		} catch (NoSuchMethodException e) {
			return false;
		}
		return true;
	}

	public static String exceptionInGeneratedClass(Context ctx) {
		return format("Thrown in generated class %s in method %s",
				ctx.getSelfType().getClassName(),
				ctx.getMethod());
	}

	/**
	 * Reads a system property named after the simple name of a class, such as {@code CodeContainer.debugOutputDir}
	 */
	public static String getStringSetting(Class<?> cls, String key, String defaultValue) {
		return System.getProperty(cls.getSimpleName() + '.' + key, defaultValue);
	}

	public static <E extends Enum<E>> E getEnumSetting(Class<?> cls, String key, E defaultValue) {
		String setting = getStringSetting(cls, key, null);
		return setting == null ? defaultValue : Enum.valueOf(defaultValue.getDeclaringClass(), setting);
	}

	public static @Nullable Path getPathSetting(Class<?> cls, String key, @Nullable Path defaultValue) {
		String setting = getStringSetting(cls, key, null);
		return setting == null ? defaultValue : Path.of(setting);
	}
}
