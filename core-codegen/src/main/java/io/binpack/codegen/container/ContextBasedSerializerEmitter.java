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

package io.binpack.codegen.container;

import io.binpack.codegen.expression.Expression;

import static io.binpack.codegen.expression.Expressions.*;

/**
 * Keeps every non-literal constant in a {@link ConstantTable}.
 * <p>
 * Generated code loads such constants through its first argument, which must be a {@link ConstantPool}
 * holding the same constants as {@link #getConstantPool()}.
 */
public final class ContextBasedSerializerEmitter extends SerializerEmitter {
	private final ConstantTable constants = new ConstantTable();

	ContextBasedSerializerEmitter(CodeContainer container, Class<?> targetType, int sequence) {
		super(container, targetType, sequence);
	}

	@Override
	public EmitterFlavor getFlavor() {
		return EmitterFlavor.CONTEXT_BASED;
	}

	@Override
	public Expression constant(Object value, Class<?> type) {
		if (isLiteral(value)) {
			return value(value, type);
		}
		int index = constants.add(value);
		return cast(call(cast(arg(0), ConstantPool.class), "getConstant", value(index)), type);
	}

	public ConstantTable getConstantPool() {
		return constants;
	}
}
