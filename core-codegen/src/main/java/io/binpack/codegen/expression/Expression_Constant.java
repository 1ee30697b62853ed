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

import io.binpack.codegen.ClassBuilder;
import io.binpack.codegen.Context;
import io.binpack.codegen.util.Primitives;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.Type;
import org.objectweb.asm.commons.GeneratorAdapter;

import java.util.concurrent.atomic.AtomicInteger;

import static org.objectweb.asm.Type.getType;

/**
 * A constant value.
 * <p>
 * Primitives, strings, classes and enum constants are pushed directly.
 * Any other value is stored in a static final field of the generated class,
 * initialized through {@link ClassBuilder#getStaticConstant(int)}.
 */
public final class Expression_Constant implements Expression {
	private static final AtomicInteger COUNTER = new AtomicInteger();

	private final Object value;
	private final @Nullable Class<?> cls;

	private final int id = COUNTER.incrementAndGet();

	Expression_Constant(Object value) {
		this.value = value;
		this.cls = null;
	}

	Expression_Constant(Object value, Class<?> cls) {
		if (!Primitives.wrap(cls).isInstance(value)) {
			throw new IllegalArgumentException(value + " is not an instance of " + cls);
		}
		this.value = value;
		this.cls = cls;
	}

	public Object getValue() {
		return value;
	}

	public int getId() {
		return id;
	}

	public boolean isJvmPrimitive() {
		return value instanceof String || value instanceof Class || Primitives.isWrapperType(value.getClass());
	}

	// the type the value has in generated code: a primitive for a boxed literal unless another type was asked for
	private Class<?> valueType() {
		if (cls != null) return cls;
		if (value instanceof Class) return Class.class;
		if (value instanceof Enum) return ((Enum<?>) value).getDeclaringClass();
		return Primitives.unwrap(value.getClass());
	}

	@Override
	public Type load(Context ctx) {
		GeneratorAdapter g = ctx.getGeneratorAdapter();
		Type type = getType(valueType());
		if (pushLiteral(g, value)) {
			if (Primitives.isWrapperType(value.getClass()) && !valueType().isPrimitive()) {
				ctx.cast(getType(Primitives.unwrap(value.getClass())), type);
			}
		} else if (value instanceof Enum) {
			Type enumType = getType(((Enum<?>) value).getDeclaringClass());
			g.getStatic(enumType, ((Enum<?>) value).name(), enumType);
		} else {
			String field = "$STATIC_CONSTANT_" + id;
			ctx.getClassBuilder().withStaticFinalField(field, valueType(), this);
			g.getStatic(ctx.getSelfType(), field, type);
		}
		return type;
	}

	private static boolean pushLiteral(GeneratorAdapter g, Object value) {
		if (value instanceof Boolean) {
			g.push((boolean) (Boolean) value);
		} else if (value instanceof Character) {
			g.push((int) (Character) value);
		} else if (value instanceof Byte || value instanceof Short || value instanceof Integer) {
			g.push(((Number) value).intValue());
		} else if (value instanceof Long) {
			g.push((long) (Long) value);
		} else if (value instanceof Float) {
			g.push((float) (Float) value);
		} else if (value instanceof Double) {
			g.push((double) (Double) value);
		} else if (value instanceof String) {
			g.push((String) value);
		} else if (value instanceof Class) {
			g.push(getType((Class<?>) value));
		} else {
			return false;
		}
		return true;
	}
}
