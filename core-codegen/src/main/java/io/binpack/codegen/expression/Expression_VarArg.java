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
 * An argument of the method being generated, by its ordinal number
 */
final class Expression_VarArg implements Variable {
	private final int argument;

	Expression_VarArg(int argument) {
		this.argument = argument;
	}

	@Override
	public Type load(Context ctx) {
		ctx.getGeneratorAdapter().loadArg(argument);
		return ctx.getGeneratorAdapter().getArgumentTypes()[argument];
	}

	@Override
	public @Nullable Object beginStore(Context ctx) {
		return null;
	}

	@Override
	public void store(Context ctx, @Nullable Object storeContext, Type type) {
		ctx.cast(type, ctx.getGeneratorAdapter().getArgumentTypes()[argument]);
		ctx.getGeneratorAdapter().storeArg(argument);
	}
}
