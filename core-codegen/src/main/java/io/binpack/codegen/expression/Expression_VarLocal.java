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
 * A local variable slot that has already been allocated
 */
public final class Expression_VarLocal implements Variable {
	private static final int VOID = -1;
	public static final Expression_VarLocal VAR_LOCAL_VOID = new Expression_VarLocal(VOID);

	private final int local;

	public Expression_VarLocal(int local) {
		this.local = local;
	}

	@Override
	public Type load(Context ctx) {
		if (local == VOID) return Type.VOID_TYPE;
		ctx.getGeneratorAdapter().loadLocal(local);
		return ctx.getGeneratorAdapter().getLocalType(local);
	}

	@Override
	public @Nullable Object beginStore(Context ctx) {
		return null;
	}

	@Override
	public void store(Context ctx, @Nullable Object storeContext, Type type) {
		store(ctx);
	}

	public void store(Context ctx) {
		if (local == VOID) return;
		ctx.getGeneratorAdapter().storeLocal(local);
	}
}
