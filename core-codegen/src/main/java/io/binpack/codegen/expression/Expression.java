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
 * A node of generated code that emits its instructions into a method
 */
public interface Expression {
	/**
	 * Emits instructions of this expression and returns the type of the value left on the stack
	 *
	 * @param ctx information about a method being generated
	 * @return type of the produced value or {@code null} if the expression always throws
	 */
	@Nullable Type load(Context ctx);
}
