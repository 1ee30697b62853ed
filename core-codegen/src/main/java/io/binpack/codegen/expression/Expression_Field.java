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

import io.binpack.codegen.Context;
import org.jetbrains.annotations.Nullable;
import org.objectweb.asm.Type;
import org.objectweb.asm.commons.GeneratorAdapter;

import java.lang.reflect.Field;

import static io.binpack.codegen.util.TypeChecks.checkType;
import static io.binpack.codegen.util.TypeChecks.isObject;
import static java.lang.reflect.Modifier.isStatic;
import static org.objectweb.asm.Type.getType;

/**
 * A public field resolved by reflection, either static or of a given owner
 */
final class Expression_Field implements Variable {
	private final @Nullable Expression owner;
	private final Field field;

	Expression_Field(@Nullable Expression owner, Field field) {
		if ((owner == null) != isStatic(field.getModifiers())) {
			throw new IllegalArgumentException("Owner must be given for instance fields only: " + field);
		}
		this.owner = owner;
		this.field = field;
	}

	@Override
	public Type load(Context ctx) {
		GeneratorAdapter g = ctx.getGeneratorAdapter();
		Type declaringType = getType(field.getDeclaringClass());
		Type fieldType = getType(field.getType());
		if (owner == null) {
			g.getStatic(declaringType, field.getName(), fieldType);
		} else {
			loadOwner(ctx, declaringType);
			g.getField(declaringType, field.getName(), fieldType);
		}
		return fieldType;
	}

	@Override
	public @Nullable Object beginStore(Context ctx) {
		if (owner != null) {
			loadOwner(ctx, getType(field.getDeclaringClass()));
		}
		return null;
	}

	@Override
	public void store(Context ctx, @Nullable Object storeContext, Type type) {
		GeneratorAdapter g = ctx.getGeneratorAdapter();
		Type declaringType = getType(field.getDeclaringClass());
		Type fieldType = getType(field.getType());
		ctx.cast(type, fieldType);
		if (owner == null) {
			g.putStatic(declaringType, field.getName(), fieldType);
		} else {
			g.putField(declaringType, field.getName(), fieldType);
		}
	}

	private void loadOwner(Context ctx, Type declaringType) {
		Type ownerType = owner.load(ctx);
		checkType(ownerType, isObject());
		ctx.cast(ownerType, declaringType);
	}
}
