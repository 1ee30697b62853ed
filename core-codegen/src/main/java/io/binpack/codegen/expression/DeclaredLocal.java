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

/**
 * A named local variable of a known type.
 * <p>
 * The slot is allocated and set to the default value of its type by the innermost
 * {@link Expressions#block(java.util.List, java.util.List) block} that declares it,
 * or lazily on first use if no block declares it.
 */
public final class DeclaredLocal implements Variable {
	private final Class<?> type;
	private final String name;

	DeclaredLocal(Class<?> type, String name) {
		this.type = type;
		this.name = name;
	}

	public Class<?> getType() {
		return type;
	}

	public String getName() {
		return name;
	}

	@Override
	public Type load(Context ctx) {
		return ctx.ensureDeclaredLocal(this).load(ctx);
	}

	@Override
	public @Nullable Object beginStore(Context ctx) {
		return null;
	}

	@Override
	public void store(Context ctx, @Nullable Object storeContext, Type valueType) {
		Expression_VarLocal local = ctx.ensureDeclaredLocal(this);
		ctx.cast(valueType, Type.getType(type));
		local.store(ctx);
	}

	@Override
	public String toString() {
		return name + ':' + type.getSimpleName();
	}
}
